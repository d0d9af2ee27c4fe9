package com.example.word2xml.util.transform;

/**
 * 中间标记约定（结构转换的输出，语义结构化的输入）
 *
 * 根元素 doc 下是块级元素序列：
 * - p：段落，属性 role / level / list-type / label / style / content-type / jc
 * - table：已重建的表格（colgroup / thead / tbody，单元格带 rowspan / colspan）
 *
 * 行内：bold、italic 等格式标签，命名字符样式对应的语义标签（citebib、bib-surname ...），
 * xref / ext-link / target / break，批注为处理指令 comment-start / comment-end
 */
public final class Markup {

    public static final String ROOT = "doc";

    public static final String ROLE = "role";
    public static final String LEVEL = "level";
    public static final String LIST_TYPE = "list-type";
    public static final String LABEL = "label";
    public static final String STYLE = "style";
    public static final String CONTENT_TYPE = "content-type";
    public static final String JUSTIFY = "jc";

    public static final String COMMENT_START = "comment-start";
    public static final String COMMENT_END = "comment-end";

    private Markup() {
    }
}

package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.style.LabelTable;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 章前信息提取
 *
 * 从中间标记中取出章号、章标题、作者、部分（Part）、摘要和关键词，
 * 组装为 book-part-meta；取出的段落从正文中删除。缺少的项目直接省略
 */
@Slf4j
public class FrontMatterBuilder {

    private static final Pattern AUTHOR_SEPARATOR = Pattern.compile("\\s+and\\s+|\\s*[,&]\\s*");

    /**
     * 提取结果
     */
    public static class FrontMatter {
        private Element chapterMeta;
        private String partId;
        private Element partMeta;

        /** 章的 book-part-meta；没有任何章前信息时为 null */
        public Element getChapterMeta() { return chapterMeta; }

        /** 部分的 ID（如 pt2）；文档不属于某个部分时为 null */
        public String getPartId() { return partId; }

        public Element getPartMeta() { return partMeta; }
    }

    /**
     * 提取章前信息；会设置 ctx 中的章号
     *
     * @param doc    中间标记根元素
     * @param labels 语言标签表
     * @param ctx    转换上下文
     * @return 提取结果
     */
    public static FrontMatter extract(Element doc, LabelTable labels, ConversionContext ctx) {
        FrontMatter fm = new FrontMatter();
        Element meta = new Element("book-part-meta");
        Element titleGroup = new Element("title-group");

        // 章号："Chapter 3"
        Element number = firstWithRole(doc, ParagraphRole.CHAPTER_NUMBER);
        if (number != null) {
            String text = TextUtils.collapseWhitespace(number.text());
            Matcher m = Pattern.compile("(?i)^(" + Pattern.quote(labels.getChapter()) + ")\\s+([0-9A-Za-z]+)").matcher(text);
            if (m.find()) {
                ctx.setChapterNumber(m.group(2));
            } else {
                Matcher digits = Pattern.compile("\\d+").matcher(text);
                if (digits.find()) {
                    ctx.setChapterNumber(digits.group());
                }
            }
            titleGroup.appendElement("label").text(text);
            number.remove();
        }

        Element title = firstWithRole(doc, ParagraphRole.CHAPTER_TITLE);
        if (title != null) {
            Element t = titleGroup.appendElement("title");
            XmlUtils.moveChildren(title, t);
            XmlUtils.unwrapSole(t, "bold");
            title.remove();
        }
        if (titleGroup.childNodeSize() > 0) {
            meta.appendChild(titleGroup);
        }

        Element author = firstWithRole(doc, ParagraphRole.CHAPTER_AUTHOR);
        if (author != null) {
            Element contribGroup = contributors(TextUtils.collapseWhitespace(author.text()));
            if (contribGroup != null) {
                meta.appendChild(contribGroup);
            }
            author.remove();
        }

        Element abs = headedParagraph(doc, Pattern.compile("(?i)^" + Pattern.quote(labels.getAbstractLabel()) + "\\s*:?$"));
        if (abs != null) {
            Element heading = abs.previousElementSibling();
            Element abstractEl = meta.appendElement("abstract");
            abstractEl.appendElement("title").text(TextUtils.collapseWhitespace(heading.text()).replaceAll(":$", ""));
            Element p = abstractEl.appendElement("p");
            XmlUtils.moveChildren(abs, p);
            heading.remove();
            abs.remove();
        }

        keywords(doc, labels, meta);

        if (meta.childNodeSize() > 0) {
            fm.chapterMeta = meta;
        }
        part(doc, labels, fm);

        log.info("[{}] 章前信息: 章号 {}, 元数据 {} 项, 部分 {}", ctx.getDocumentName(),
                ctx.getChapterNumber(), meta.children().size(), fm.partId);
        return fm;
    }

    /**
     * 部分（Part / Section）：PartNumber + PartTitle
     */
    private static void part(Element doc, LabelTable labels, FrontMatter fm) {
        Element number = firstWithRole(doc, ParagraphRole.PART_NUMBER);
        if (number == null) {
            return;
        }
        String text = TextUtils.collapseWhitespace(number.text());
        Matcher m = Pattern.compile("(?i)^(?:" + Pattern.quote(labels.getPart()) + "|Part|Section)\\s+([0-9A-Z.\\-]+)$")
                .matcher(text);
        String id = m.find() ? m.group(1) : text.replaceAll("[^0-9A-Za-z]", "");
        fm.partId = "pt" + id;

        Element meta = new Element("book-part-meta");
        Element titleGroup = meta.appendElement("title-group");
        titleGroup.appendElement("label").text(text);
        Element title = firstWithRole(doc, ParagraphRole.PART_TITLE);
        if (title != null) {
            Element t = titleGroup.appendElement("title");
            XmlUtils.moveChildren(title, t);
            XmlUtils.unwrapSole(t, "bold");
            title.remove();
        }
        number.remove();
        fm.partMeta = meta;
    }

    /**
     * 关键词：标题段落 "Keywords" + 下一段，或单段 "Keywords: a, b, c"。
     * 优先按逗号切分，没有逗号时按分号切分
     */
    private static void keywords(Element doc, LabelTable labels, Element meta) {
        String stem = Pattern.quote(labels.getKeywords().replaceAll("s$", ""));
        Element body = headedParagraph(doc, Pattern.compile("(?i)^" + stem + "s?\\s*:?$"));
        String heading;
        String list;
        if (body != null) {
            Element headingEl = body.previousElementSibling();
            heading = TextUtils.collapseWhitespace(headingEl.text()).replaceAll(":$", "");
            list = TextUtils.collapseWhitespace(body.text());
            headingEl.remove();
            body.remove();
        } else {
            Pattern inline = Pattern.compile("(?i)^(" + stem + "s?)\\s*[:\\uFF1A]\\s*(.+)$");
            Element found = null;
            Matcher m = null;
            for (Element p : doc.children()) {
                if (!"p".equals(p.normalName())) {
                    continue;
                }
                m = inline.matcher(TextUtils.collapseWhitespace(p.text()));
                if (m.find()) {
                    found = p;
                    break;
                }
            }
            if (found == null) {
                return;
            }
            heading = m.group(1);
            list = m.group(2);
            found.remove();
        }

        Element group = meta.appendElement("kwd-group").attr("kwd-group-type", "author");
        group.appendElement("title").text(heading);
        String[] parts = list.contains(",") ? list.split("\\s*,\\s*") : list.split("\\s*;\\s*");
        for (String part : parts) {
            String kwd = part.trim().replaceAll("[.;]$", "");
            if (!kwd.isEmpty()) {
                group.appendElement("kwd").text(kwd);
            }
        }
    }

    /**
     * 作者行："Jane Smith and John Doe" / "A. Lee, B. Chan"，最后一个词为姓
     */
    static Element contributors(String text) {
        Element group = new Element("contrib-group");
        for (String name : AUTHOR_SEPARATOR.split(text)) {
            String n = name.trim();
            if (n.isEmpty()) {
                continue;
            }
            Element nameEl = group.appendElement("contrib").attr("contrib-type", "author").appendElement("name");
            int space = n.lastIndexOf(' ');
            if (space < 0) {
                nameEl.appendElement("surname").text(n);
            } else {
                nameEl.appendElement("surname").text(n.substring(space + 1));
                nameEl.appendText(" ");
                nameEl.appendElement("given-names").text(n.substring(0, space));
            }
        }
        return group.children().isEmpty() ? null : group;
    }

    /**
     * 查找 "标题段落 + 下一段" 结构，返回下一段；标题段落用 previousElementSibling 取得
     */
    private static Element headedParagraph(Element doc, Pattern heading) {
        for (Element p : doc.children()) {
            if (!"p".equals(p.normalName()) || !heading.matcher(TextUtils.collapseWhitespace(p.text())).find()) {
                continue;
            }
            Element next = p.nextElementSibling();
            if (next != null && "p".equals(next.normalName())) {
                return next;
            }
        }
        return null;
    }

    private static Element firstWithRole(Element doc, ParagraphRole role) {
        for (Element p : doc.children()) {
            if ("p".equals(p.normalName()) && role.getValue().equals(p.attr(Markup.ROLE))) {
                return p;
            }
        }
        return null;
    }
}

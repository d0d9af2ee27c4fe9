package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.structure.dto.BibliographyEntry;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.style.LabelTable;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 语义结构化
 *
 * 把中间标记（平铺的段落、列表项、表格）组织成 book / book-part / body 结构。
 * 各步骤有先后依赖：
 * 1. 章前信息（确定章号，后续所有 ID 都带章号）
 * 2. 图表浮动体
 * 3. 章节嵌套
 * 4. 列表嵌套、关键词表
 * 5. 参考文献，然后文中引用、图表引用
 * 6. 浮动体放置、关键词链接
 * 7. 清理中间属性
 */
@Slf4j
public class SemanticStructurer {

    private final LabelTable labels;
    private final FloatLabelMatcher matcher;

    public SemanticStructurer(LabelTable labels) {
        this.labels = labels;
        this.matcher = new FloatLabelMatcher(labels);
    }

    /**
     * 结构化
     *
     * @param doc 中间标记根元素（挂在输出文档下）
     * @param ctx 转换上下文
     * @return book 根元素，替换 doc 挂在同一个输出文档下
     */
    public Element structure(Element doc, ConversionContext ctx) {
        long start = System.currentTimeMillis();

        FrontMatterBuilder.FrontMatter frontMatter = FrontMatterBuilder.extract(doc, labels, ctx);
        List<FloatBlock> floats = FloatBuilder.build(doc, matcher, ctx);
        SectionNester.nest(doc, ctx);
        ListNester.nest(doc, ctx);
        Map<String, String> terms = KeyTermLinker.buildLists(doc, ctx);
        List<BibliographyEntry> entries = BibliographyExtractor.extract(doc, ctx);
        CitationResolver.resolve(doc, entries, ctx);
        FloatReferenceResolver.resolve(doc, floats, matcher, ctx);

        Element book = new Element("book").attr("xmlns:xlink", XmlUtils.XLINK_NS);
        Element container = book.appendElement("book-body");
        if (frontMatter.getPartId() != null) {
            Element part = container.appendElement("book-part")
                    .attr("id", frontMatter.getPartId())
                    .attr("book-part-type", "part");
            part.appendChild(frontMatter.getPartMeta());
            container = part.appendElement("body");
        }
        Element chapter = container.appendElement("book-part")
                .attr("id", "ch" + ctx.getChapterNumber())
                .attr("book-part-type", "chapter");
        if (frontMatter.getChapterMeta() != null) {
            chapter.appendChild(frontMatter.getChapterMeta());
        }
        Element body = chapter.appendElement("body");
        XmlUtils.moveChildren(doc, body);
        doc.replaceWith(book);

        FloatPlacer.place(body, floats, ctx);
        KeyTermLinker.link(body, terms, ctx);
        cleanup(book);

        ctx.getReport().setSectionCount(ctx.getSectionCount());
        ctx.getReport().setListCount(book.getElementsByTag("list").size());
        log.info("[{}] 语义结构化完成: 章节 {} 个, 列表 {} 个, 参考文献 {} 条, 浮动体 {} 个, 耗时 {} ms",
                ctx.getDocumentName(), ctx.getSectionCount(), ctx.getReport().getListCount(), entries.size(),
                floats.size(), System.currentTimeMillis() - start);
        return book;
    }

    /**
     * 清理中间属性和残留标记
     */
    static void cleanup(Element root) {
        for (Element p : new ArrayList<>(root.getElementsByTag("p"))) {
            String role = p.attr(Markup.ROLE);
            if (!role.isEmpty() && !isPlainRole(role) && !p.hasAttr(Markup.CONTENT_TYPE) && p.hasAttr(Markup.STYLE)) {
                p.attr(Markup.CONTENT_TYPE, p.attr(Markup.STYLE));
            }
            p.removeAttr(Markup.ROLE);
            p.removeAttr(Markup.LEVEL);
            p.removeAttr(Markup.LIST_TYPE);
            p.removeAttr(Markup.LABEL);
            p.removeAttr(Markup.STYLE);
            p.removeAttr(Markup.JUSTIFY);
            if (!p.hasAttr(Markup.CONTENT_TYPE) && !p.hasAttr("id") && blank(p)) {
                p.remove();
            }
        }
        for (Element list : root.getElementsByTag("list")) {
            list.removeAttr(ListNester.LEVEL);
        }
        for (Element el : new ArrayList<>(root.getAllElements())) {
            String tag = el.normalName();
            if (tag.startsWith("bib-") || "figure-number".equals(tag) || "table-number".equals(tag)) {
                el.unwrap();
            }
        }
    }

    private static boolean isPlainRole(String role) {
        return ParagraphRole.PARA.getValue().equals(role)
                || ParagraphRole.MARKER.getValue().equals(role)
                || ParagraphRole.LIST_ITEM.getValue().equals(role);
    }

    /**
     * 只含空白文本（批注标记等处理指令不算空白）
     */
    private static boolean blank(Element p) {
        for (Node child : p.childNodes()) {
            if (!(child instanceof TextNode) || !((TextNode) child).isBlank()) {
                return false;
            }
        }
        return true;
    }
}

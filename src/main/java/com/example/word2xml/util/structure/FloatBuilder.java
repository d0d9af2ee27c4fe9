package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.structure.dto.FloatKind;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * 图表浮动体构建
 *
 * figure-caption 段落 -> fig（label、caption/title、graphic 占位）
 * table-caption 段落 + 随后的表格（+ table-source 段落） -> table-wrap
 * 没有题注的表格包成不带 ID 的 table-wrap，原位保留，不参与浮动
 */
@Slf4j
public class FloatBuilder {

    /**
     * 构建浮动体
     *
     * @param doc     中间标记根元素
     * @param matcher 标签识别
     * @param ctx     转换上下文
     * @return 按原文顺序排列的浮动体
     */
    public static List<FloatBlock> build(Element doc, FloatLabelMatcher matcher, ConversionContext ctx) {
        List<FloatBlock> floats = new ArrayList<>();
        for (Element block : new ArrayList<>(doc.children())) {
            if (block.parent() == null) {
                continue;
            }
            if (hasRole(block, ParagraphRole.FIGURE_CAPTION)) {
                floats.add(figure(block, matcher, ctx));
            } else if (hasRole(block, ParagraphRole.TABLE_CAPTION)) {
                floats.add(table(block, matcher, ctx));
            } else if ("table".equals(block.normalName())) {
                Element wrap = new Element("table-wrap")
                        .attr("position", "anchor")
                        .attr("content-type", "table");
                block.before(wrap);
                wrap.appendChild(block);
            }
        }
        log.info("[{}] 浮动体: {} 个", ctx.getDocumentName(), floats.size());
        return floats;
    }

    private static FloatBlock figure(Element caption, FloatLabelMatcher matcher, ConversionContext ctx) {
        String id = ctx.nextFigureId();
        Element fig = new Element(FloatKind.FIGURE.getElementName())
                .attr("id", id)
                .attr("position", "float")
                .attr("orientation", "portrait");
        String[] label = label(caption, matcher, FloatKind.FIGURE, ctx);
        appendLabelAndCaption(fig, label[0], caption);
        fig.appendElement("graphic")
                .attr("xlink:href", "media/" + id)
                .attr("mime-subtype", "jpeg");
        caption.before(fig);
        caption.remove();
        return new FloatBlock(id, FloatKind.FIGURE, label[0], label[1], fig);
    }

    private static FloatBlock table(Element caption, FloatLabelMatcher matcher, ConversionContext ctx) {
        String id = ctx.nextTableId();
        Element wrap = new Element(FloatKind.TABLE.getElementName())
                .attr("id", id)
                .attr("position", "float")
                .attr("orientation", "portrait")
                .attr("content-type", "table");
        String[] label = label(caption, matcher, FloatKind.TABLE, ctx);
        appendLabelAndCaption(wrap, label[0], caption);
        caption.before(wrap);
        caption.remove();

        Element next = skipEmptyParagraphs(wrap.nextElementSibling());
        if (next != null && "table".equals(next.normalName())) {
            wrap.appendChild(next);
            Element source = skipEmptyParagraphs(wrap.nextElementSibling());
            if (source != null && hasRole(source, ParagraphRole.TABLE_SOURCE)) {
                Element attrib = wrap.appendElement("table-wrap-foot").appendElement("attrib");
                XmlUtils.moveChildren(source, attrib);
                source.remove();
            }
        } else {
            ctx.anomaly("表题 " + TextUtils.truncate(label[0], 40) + " 后面没有表格");
        }
        return new FloatBlock(id, FloatKind.TABLE, label[0], label[1], wrap);
    }

    /**
     * 从题注段落中取出标签，返回 {标签文字, 编号}；题注不以标签开头时编号为空串
     */
    private static String[] label(Element caption, FloatLabelMatcher matcher, FloatKind kind, ConversionContext ctx) {
        String raw = XmlUtils.rawText(caption);
        FloatLabelMatcher.LabelMatch m = matcher.leading(raw);
        if (m == null || m.getKind() != kind) {
            ctx.anomaly("题注没有可识别的标签: " + TextUtils.truncate(TextUtils.collapseWhitespace(raw), 40));
            return new String[]{"", ""};
        }
        String label = TextUtils.collapseWhitespace(raw.substring(m.getStart(), m.getEnd()));
        // 去掉标签以及其后的分隔符（": " "." " - "）
        int end = m.getEnd();
        while (end < raw.length() && (Character.isWhitespace(raw.charAt(end)) || ":.-\u2013\u2014".indexOf(raw.charAt(end)) >= 0)) {
            end++;
        }
        XmlUtils.removeLeadingChars(caption, end);
        return new String[]{label, m.getNumber()};
    }

    private static void appendLabelAndCaption(Element floatEl, String label, Element caption) {
        if (!label.isEmpty()) {
            floatEl.appendElement("label").text(label);
        }
        XmlUtils.unwrapSole(caption, "bold");
        if (!XmlUtils.isEmpty(caption)) {
            Element title = floatEl.appendElement("caption").appendElement("title");
            XmlUtils.moveChildren(caption, title);
        }
    }

    private static Element skipEmptyParagraphs(Element el) {
        Element current = el;
        while (current != null && "p".equals(current.normalName())
                && ParagraphRole.PARA.getValue().equals(current.attr(Markup.ROLE))
                && !current.hasAttr(Markup.CONTENT_TYPE)
                && XmlUtils.isEmpty(current)) {
            current = current.nextElementSibling();
        }
        return current;
    }

    static boolean hasRole(Element el, ParagraphRole role) {
        return "p".equals(el.normalName()) && role.getValue().equals(el.attr(Markup.ROLE));
    }
}

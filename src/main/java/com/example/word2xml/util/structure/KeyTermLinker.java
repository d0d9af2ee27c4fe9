package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 关键词表与链接
 */
@Slf4j
public class KeyTermLinker {

    static final String KEY_TERMS = "key-terms";

    /**
     * 连续的关键词段落组成项目符号列表，每项段落带 term{k} ID
     *
     * @return 关键词（小写） -> ID
     */
    public static Map<String, String> buildLists(Element root, ConversionContext ctx) {
        Map<String, String> terms = new LinkedHashMap<>();
        for (Element p : new ArrayList<>(root.getElementsByTag("p"))) {
            if (!ParagraphRole.KEY_TERM.getValue().equals(p.attr(Markup.ROLE))) {
                continue;
            }
            Element list = p.previousElementSibling();
            if (list == null || !"list".equals(list.normalName()) || !KEY_TERMS.equals(list.attr("specific-use"))) {
                list = new Element("list").attr("list-type", "bullet").attr("specific-use", KEY_TERMS);
                p.before(list);
            }
            String id = ctx.nextKeyTermId();
            Element item = list.appendElement("list-item");
            item.appendChild(p);
            p.attr("id", id);
            p.removeAttr(Markup.ROLE);
            p.removeAttr(Markup.STYLE);
            String term = TextUtils.collapseWhitespace(p.text()).toLowerCase(Locale.ROOT);
            if (!term.isEmpty()) {
                terms.putIfAbsent(term, id);
            }
        }
        log.debug("[{}] 关键词: {} 个", ctx.getDocumentName(), terms.size());
        return terms;
    }

    /**
     * 正文中加粗的关键词（或加 s 的复数）链接到关键词表
     *
     * @return 生成的链接数
     */
    public static int link(Element root, Map<String, String> terms, ConversionContext ctx) {
        if (terms.isEmpty()) {
            return 0;
        }
        int linked = 0;
        for (Element bold : new ArrayList<>(root.getElementsByTag("bold"))) {
            if (!textOnly(bold) || XmlUtils.ancestor(bold, "ref-list") != null
                    || XmlUtils.ancestor(bold, "title") != null || inTermList(bold)) {
                continue;
            }
            String text = TextUtils.collapseWhitespace(bold.text()).toLowerCase(Locale.ROOT);
            String id = terms.get(text);
            if (id == null && text.endsWith("s")) {
                id = terms.get(text.substring(0, text.length() - 1));
            }
            if (id == null) {
                continue;
            }
            Element xref = new Element("xref").attr("ref-type", "keyterm").attr("rid", id);
            XmlUtils.moveChildren(bold, xref);
            bold.appendChild(xref);
            linked++;
        }
        log.info("[{}] 关键词链接: {} 处", ctx.getDocumentName(), linked);
        return linked;
    }

    private static boolean inTermList(Element el) {
        Element list = XmlUtils.ancestor(el, "list");
        return list != null && KEY_TERMS.equals(list.attr("specific-use"));
    }

    private static boolean textOnly(Element el) {
        if (el.childNodeSize() == 0) {
            return false;
        }
        for (Node child : el.childNodes()) {
            if (!(child instanceof TextNode)) {
                return false;
            }
        }
        return true;
    }
}

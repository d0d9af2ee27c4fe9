package com.example.word2xml.util.common;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * jsoup 输出树操作工具
 */
public class XmlUtils {

    /** XLink 命名空间 */
    public static final String XLINK_NS = "http://www.w3.org/1999/xlink";

    /**
     * 新建 XML 输出文档
     *
     * @param prettyPrint 是否格式化输出
     */
    public static Document newXmlDocument(boolean prettyPrint) {
        Document doc = new Document("");
        doc.parser(Parser.xmlParser());
        doc.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset("UTF-8")
                .prettyPrint(prettyPrint);
        return doc;
    }

    /**
     * 按文档顺序收集所有后代文本节点
     */
    public static List<TextNode> textNodes(Node root) {
        List<TextNode> out = new ArrayList<>();
        collectTextNodes(root, out);
        return out;
    }

    private static void collectTextNodes(Node node, List<TextNode> out) {
        if (node instanceof TextNode) {
            out.add((TextNode) node);
            return;
        }
        for (Node child : node.childNodes()) {
            collectTextNodes(child, out);
        }
    }

    /**
     * 拼接所有后代文本（不压缩空白）
     */
    public static String rawText(Node root) {
        StringBuilder sb = new StringBuilder();
        for (TextNode text : textNodes(root)) {
            sb.append(text.getWholeText());
        }
        return sb.toString();
    }

    /**
     * 从开头删除 count 个字符，可跨多个文本节点；删空的文本节点一并移除
     */
    public static void removeLeadingChars(Element root, int count) {
        int remaining = count;
        for (TextNode text : textNodes(root)) {
            if (remaining <= 0) {
                break;
            }
            String value = text.getWholeText();
            if (value.length() <= remaining) {
                remaining -= value.length();
                text.remove();
            } else {
                text.text(value.substring(remaining));
                remaining = 0;
            }
        }
        removeEmptyWrappers(root);
    }

    /**
     * 删除开头的空白字符
     */
    public static void trimLeading(Element root) {
        String text = rawText(root);
        int n = 0;
        while (n < text.length() && Character.isWhitespace(text.charAt(n))) {
            n++;
        }
        if (n > 0) {
            removeLeadingChars(root, n);
        }
    }

    /**
     * 删除没有任何内容的行内包装元素（自闭合的里程碑元素除外）
     */
    public static void removeEmptyWrappers(Element root) {
        for (Element child : new ArrayList<>(root.children())) {
            removeEmptyWrappers(child);
            if (child.childNodeSize() == 0 && isInlineWrapper(child)) {
                child.remove();
            }
        }
    }

    private static boolean isInlineWrapper(Element el) {
        switch (el.normalName()) {
            case "break":
            case "target":
            case "graphic":
            case "col":
            case "td":
            case "th":
                return false;
            default:
                return el.attributesSize() == 0;
        }
    }

    /**
     * 判断元素是否没有实际内容：没有非空白文本，也没有子元素
     */
    public static boolean isEmpty(Element el) {
        return el.children().isEmpty() && el.wholeText().trim().isEmpty();
    }

    /**
     * 元素的有效子节点（忽略空白文本）只有一个指定标签的元素时返回它，否则返回 null
     */
    public static Element soleChild(Element el, String tag) {
        Element found = null;
        for (Node child : el.childNodes()) {
            if (child instanceof TextNode) {
                if (!((TextNode) child).isBlank()) {
                    return null;
                }
            } else if (child instanceof Element && found == null && tag.equals(((Element) child).normalName())) {
                found = (Element) child;
            } else {
                return null;
            }
        }
        return found;
    }

    /**
     * 去掉整体包裹内容的某个标签（如标题外层的 bold）
     */
    public static void unwrapSole(Element el, String tag) {
        Element sole = soleChild(el, tag);
        if (sole != null) {
            sole.unwrap();
        }
    }

    /**
     * 把 from 的全部子节点移到 to 的末尾
     */
    public static void moveChildren(Element from, Element to) {
        for (Node child : new ArrayList<>(from.childNodes())) {
            to.appendChild(child);
        }
    }

    /**
     * 最近的指定标签祖先（不含自身）；没有返回 null
     */
    public static Element ancestor(Node node, String tag) {
        Node current = node.parent();
        while (current != null) {
            if (current instanceof Element && tag.equals(((Element) current).normalName())) {
                return (Element) current;
            }
            current = current.parent();
        }
        return null;
    }

    /**
     * 按文档顺序收集指定标签的后代元素（不含自身）
     */
    public static List<Element> descendants(Element root, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element el : root.getElementsByTag(tag)) {
            if (el != root) {
                out.add(el);
            }
        }
        return out;
    }
}

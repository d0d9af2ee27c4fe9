package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.structure.dto.FloatKind;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 图表交叉引用解析
 *
 * "Figures 3 and 5"、"Table 2.1, 2.3" 之类的复合引用先按连接词切分，再逐段匹配；
 * 没有词干的片段沿用前一片段的类型（第一段默认取字符样式对应的类型）。
 * "Figures 3–5" 这样的范围，终点的 xref 的 rid 同时列出中间的 4（IDREFS）
 */
@Slf4j
public class FloatReferenceResolver {

    public static final String FIGURE_CITATION = "figure-citation";
    public static final String TABLE_CITATION = "table-citation";

    /**
     * 解析全部图表引用
     *
     * @return 已解析的引用片段数
     */
    public static int resolve(Element root, List<FloatBlock> floats, FloatLabelMatcher matcher, ConversionContext ctx) {
        Map<String, FloatBlock> byLabel = new HashMap<>();
        for (FloatBlock block : floats) {
            if (!block.getNumber().isEmpty()) {
                byLabel.putIfAbsent(key(block.getKind(), block.getNumber()), block);
            }
        }

        int resolved = 0;
        for (Element el : new ArrayList<>(root.getAllElements())) {
            String tag = el.normalName();
            if (!FIGURE_CITATION.equals(tag) && !TABLE_CITATION.equals(tag)) {
                continue;
            }
            FloatKind kind = FIGURE_CITATION.equals(tag) ? FloatKind.FIGURE : FloatKind.TABLE;
            List<String> parts = matcher.split(el.text());
            if (parts.size() == 1) {
                FloatBlock target = lookup(matcher.find(parts.get(0)), kind, byLabel);
                apply(el, target, kind, ctx);
                resolved += target != null ? 1 : 0;
                continue;
            }

            List<Node> nodes = new ArrayList<>();
            FloatKind current = kind;
            FloatBlock previous = null;
            for (int i = 0; i < parts.size(); i++) {
                String part = parts.get(i);
                if (i % 2 == 1 || part.trim().isEmpty()) {
                    nodes.add(new TextNode(part));
                    continue;
                }
                FloatLabelMatcher.LabelMatch m = matcher.find(part);
                if (m == null) {
                    nodes.add(new TextNode(part));
                    previous = null;
                    continue;
                }
                if (m.getKind() != null) {
                    current = m.getKind();
                }
                FloatBlock target = lookup(m, current, byLabel);
                Element ref = new Element("xref").text(part);
                apply(ref, target, current, ctx);
                nodes.add(ref);
                if (target != null) {
                    resolved++;
                    if (previous != null && previous.getKind() == target.getKind() && matcher.isRange(parts.get(i - 1))) {
                        resolved += expandRange(ref, previous, target, byLabel);
                    }
                }
                previous = target;
            }
            for (Node node : nodes) {
                el.before(node);
            }
            el.remove();
        }
        log.info("[{}] 图表引用: 解析 {} 个", ctx.getDocumentName(), resolved);
        return resolved;
    }

    /**
     * 范围中间的浮动体 ID 放到终点 xref 的 rid 里
     *
     * @return 补充的浮动体数
     */
    private static int expandRange(Element ref, FloatBlock from, FloatBlock to, Map<String, FloatBlock> byLabel) {
        List<String> ids = new ArrayList<>();
        for (String number : FloatLabelMatcher.between(from.getNumber(), to.getNumber())) {
            FloatBlock inner = byLabel.get(key(to.getKind(), number));
            if (inner != null) {
                ids.add(inner.getId());
            }
        }
        if (ids.isEmpty()) {
            return 0;
        }
        int added = ids.size();
        ids.add(to.getId());
        ref.attr("rid", String.join(" ", ids));
        return added;
    }

    private static FloatBlock lookup(FloatLabelMatcher.LabelMatch m, FloatKind fallback, Map<String, FloatBlock> byLabel) {
        if (m == null) {
            return null;
        }
        FloatKind kind = m.getKind() != null ? m.getKind() : fallback;
        String number = m.getNumber();
        FloatBlock found = byLabel.get(key(kind, number));
        // "Figure 3a" 找不到时退回 "Figure 3"
        if (found == null && Character.isLetter(number.charAt(number.length() - 1))) {
            found = byLabel.get(key(kind, number.substring(0, number.length() - 1)));
        }
        return found;
    }

    private static void apply(Element el, FloatBlock target, FloatKind kind, ConversionContext ctx) {
        if (target != null) {
            el.tagName("xref");
            el.attr("ref-type", target.getKind().getRefType()).attr("rid", target.getId());
            return;
        }
        String text = TextUtils.collapseWhitespace(el.text());
        el.tagName("named-content");
        el.attr("content-type", "unresolved-" + kind.getRefType());
        ctx.getReport().addUnresolvedCitation(text);
        log.warn("[{}] 图表引用未解析: {}", ctx.getDocumentName(), text);
    }

    private static String key(FloatKind kind, String number) {
        return kind.name() + ":" + number;
    }
}

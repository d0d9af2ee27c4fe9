package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.style.ListType;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表嵌套重建
 *
 * 1. 每个列表项段落先变成只含一项的 list（带 level、list-type）
 * 2. 嵌套（不动点）：相邻两个 list，后者级别恰好比前者大 1（不要求类型相同）时，
 *    把后面级别更深的连续 list 整体移入前者最后一个 list-item
 * 3. 合并：相邻、类型和级别都相同的 list 合并为一个；同级不同类型的保持为新列表
 *
 * 度量：相邻兄弟 list 中级别差恰好为 +1 的对数。每次移动消除一对且不产生新对，
 * 因此嵌套轮数不超过初始度量；超过即视为实现错误。
 * 对已嵌套的输出再执行一次不会改变任何内容
 */
@Slf4j
public class ListNester {

    public static final String LEVEL = "level";

    /**
     * 嵌套结果
     */
    public static class Result {
        private final int initialMeasure;
        private final int iterations;
        private final int listCount;

        Result(int initialMeasure, int iterations, int listCount) {
            this.initialMeasure = initialMeasure;
            this.iterations = iterations;
            this.listCount = listCount;
        }

        /** 初始可嵌套对数 */
        public int getInitialMeasure() { return initialMeasure; }

        /** 实际执行的嵌套次数 */
        public int getIterations() { return iterations; }

        /** 最终 list 元素个数 */
        public int getListCount() { return listCount; }
    }

    /**
     * 重建列表嵌套
     *
     * @param root 容器根元素（正文或章节）
     * @param ctx  转换上下文
     * @return 嵌套结果
     */
    public static Result nest(Element root, ConversionContext ctx) {
        wrapItems(root);

        int measure = countNestablePairs(root);
        reportLevelJumps(root, ctx);
        int iterations = 0;
        Element parent = findNestable(root);
        while (parent != null) {
            iterations++;
            if (iterations > measure) {
                throw new IllegalStateException("列表嵌套超过迭代上界 " + measure);
            }
            moveDeeperRun(parent);
            parent = findNestable(root);
        }

        mergeAdjacent(root);
        int listCount = root.getElementsByTag("list").size();
        log.debug("[{}] 列表重建: 初始度量 {}, 嵌套 {} 次, 列表 {} 个",
                ctx.getDocumentName(), measure, iterations, listCount);
        return new Result(measure, iterations, listCount);
    }

    /**
     * 列表项段落 -> 单项 list
     */
    private static void wrapItems(Element root) {
        for (Element p : root.getElementsByTag("p")) {
            if (!ParagraphRole.LIST_ITEM.getValue().equals(p.attr(Markup.ROLE))) {
                continue;
            }
            ListType type = ListType.fromValue(p.attr(Markup.LIST_TYPE));
            Element list = new Element("list")
                    .attr("list-type", type.getValue())
                    .attr(LEVEL, p.attr(Markup.LEVEL));
            Element item = list.appendElement("list-item");
            if (type.isOrdered() && !p.attr(Markup.LABEL).isEmpty()) {
                item.appendElement("label").text(p.attr(Markup.LABEL));
            }
            p.before(list);
            item.appendChild(p);
            p.removeAttr(Markup.ROLE);
            p.removeAttr(Markup.LEVEL);
            p.removeAttr(Markup.LIST_TYPE);
            p.removeAttr(Markup.LABEL);
        }
    }

    /**
     * 度量：相邻兄弟 list 中级别差恰好为 +1 的对数
     */
    public static int countNestablePairs(Element root) {
        int count = 0;
        for (Element list : root.getElementsByTag("list")) {
            Element next = nextList(list);
            if (next != null && level(next) == level(list) + 1) {
                count++;
            }
        }
        return count;
    }

    private static void reportLevelJumps(Element root, ConversionContext ctx) {
        for (Element list : root.getElementsByTag("list")) {
            Element next = nextList(list);
            if (next != null && level(next) > level(list) + 1) {
                ctx.anomaly("列表级别从 " + level(list) + " 跳到 " + level(next) + "，不做嵌套");
            }
        }
    }

    private static Element findNestable(Element root) {
        for (Element list : root.getElementsByTag("list")) {
            Element next = nextList(list);
            if (next != null && level(next) == level(list) + 1) {
                return list;
            }
        }
        return null;
    }

    /**
     * 把 parent 之后级别更深的连续 list 移入 parent 的最后一个 list-item
     */
    private static void moveDeeperRun(Element parent) {
        int level = level(parent);
        Element item = lastItem(parent);
        Element next = nextList(parent);
        while (next != null && level(next) > level) {
            Element following = nextList(next);
            item.appendChild(next);
            next = following;
        }
    }

    /**
     * 合并相邻的同类型同级别 list
     */
    private static void mergeAdjacent(Element root) {
        for (Element list : root.getElementsByTag("list")) {
            if (list.parent() == null) {
                continue;
            }
            Element next = nextList(list);
            while (next != null && sameKind(list, next)) {
                Node between = list.nextSibling();
                while (between != null && between != next) {
                    Node after = between.nextSibling();
                    between.remove();
                    between = after;
                }
                for (Element item : new ArrayList<>(next.children())) {
                    list.appendChild(item);
                }
                next.remove();
                next = nextList(list);
            }
        }
    }

    private static boolean sameKind(Element a, Element b) {
        return level(a) == level(b) && a.attr("list-type").equals(b.attr("list-type"));
    }

    /**
     * 紧邻的下一个兄弟 list（中间只允许空白文本）
     */
    static Element nextList(Element list) {
        Node next = list.nextSibling();
        while (next instanceof TextNode && ((TextNode) next).isBlank()) {
            next = next.nextSibling();
        }
        if (next instanceof Element && "list".equals(((Element) next).normalName())) {
            return (Element) next;
        }
        return null;
    }

    private static Element lastItem(Element list) {
        List<Element> items = new ArrayList<>();
        for (Element child : list.children()) {
            if ("list-item".equals(child.normalName())) {
                items.add(child);
            }
        }
        if (items.isEmpty()) {
            return list.appendElement("list-item");
        }
        return items.get(items.size() - 1);
    }

    static int level(Element list) {
        try {
            return Integer.parseInt(list.attr(LEVEL));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}

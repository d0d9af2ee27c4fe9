package com.example.word2xml.util.transform;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.HashSet;
import java.util.Arrays;

/**
 * 相邻相同行内包装标签合并
 *
 * 例：&lt;bold&gt;a&lt;/bold&gt; &lt;bold&gt;b&lt;/bold&gt; 合并为 &lt;bold&gt;a b&lt;/bold&gt;
 *
 * 不动点循环：每轮合并所有可合并的相邻对，直到没有可合并的对为止。
 * 每次合并元素总数减 1，因此轮数不超过初始元素数
 */
public final class InlineCoalescer {

    /** 可合并的行内包装标签 */
    private static final Set<String> MERGEABLE = new HashSet<>(Arrays.asList(
            "bold", "italic", "underline", "strike", "sc", "sup", "sub", "styled-content",
            "citebib", "figure-citation", "table-citation", "figure-number", "table-number",
            "bib-surname", "bib-given-names", "bib-collab", "bib-year", "bib-chapter-title", "bib-source",
            "bib-article-title", "bib-publisher", "bib-publisher-loc", "bib-volume", "bib-issue",
            "bib-fpage", "bib-lpage", "bib-url", "bib-doi"));

    private InlineCoalescer() {
    }

    /**
     * 合并结果
     */
    public static class Result {
        private final int iterations;
        private final int merges;
        private final int initialMeasure;

        Result(int iterations, int merges, int initialMeasure) {
            this.iterations = iterations;
            this.merges = merges;
            this.initialMeasure = initialMeasure;
        }

        /** 执行的轮数（含最后一轮无合并的检查） */
        public int getIterations() { return iterations; }

        /** 合并次数 */
        public int getMerges() { return merges; }

        /** 初始时可合并的相邻对数量 */
        public int getInitialMeasure() { return initialMeasure; }
    }

    /**
     * 对元素内部执行合并直到不动点
     *
     * @param root 段落或单元格元素
     * @return 合并结果（用于验证终止界）
     */
    public static Result coalesce(Element root) {
        int initialMeasure = countMergeablePairs(root);
        int bound = root.getAllElements().size();
        int iterations = 0;
        int merges = 0;
        while (true) {
            iterations++;
            if (iterations > bound + 1) {
                throw new IllegalStateException("行内合并超过迭代上界 " + bound);
            }
            int merged = mergePass(root);
            if (merged == 0) {
                break;
            }
            merges += merged;
        }
        return new Result(iterations, merges, initialMeasure);
    }

    /**
     * 统计可合并的相邻对数量（度量）
     */
    public static int countMergeablePairs(Element root) {
        int count = 0;
        List<Node> children = root.childNodes();
        for (int i = 0; i < children.size(); i++) {
            Node node = children.get(i);
            if (node instanceof Element) {
                count += countMergeablePairs((Element) node);
                if (nextMergeable((Element) node) != null) {
                    count++;
                }
            }
        }
        return count;
    }

    private static int mergePass(Element root) {
        int merged = 0;
        for (Node node : new ArrayList<>(root.childNodes())) {
            if (!(node instanceof Element) || node.parent() != root) {
                continue;
            }
            Element el = (Element) node;
            Element next = nextMergeable(el);
            while (next != null) {
                Node between = el.nextSibling();
                if (between != next) {
                    // 中间的空白文本并入前一个元素
                    el.appendChild(between);
                }
                for (Node child : new ArrayList<>(next.childNodes())) {
                    el.appendChild(child);
                }
                next.remove();
                merged++;
                next = nextMergeable(el);
            }
            merged += mergePass(el);
        }
        return merged;
    }

    /**
     * 下一个可合并的兄弟：标签名和属性完全相同，中间最多隔一个空白文本
     */
    private static Element nextMergeable(Element el) {
        if (!MERGEABLE.contains(el.normalName())) {
            return null;
        }
        Node next = el.nextSibling();
        if (next instanceof TextNode && ((TextNode) next).isBlank()) {
            next = next.nextSibling();
        }
        if (!(next instanceof Element)) {
            return null;
        }
        Element candidate = (Element) next;
        if (!candidate.normalName().equals(el.normalName()) || !candidate.attributes().equals(el.attributes())) {
            return null;
        }
        return candidate;
    }
}

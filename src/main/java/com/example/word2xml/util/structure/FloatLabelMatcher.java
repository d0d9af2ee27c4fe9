package com.example.word2xml.util.structure;

import com.example.word2xml.util.structure.dto.FloatKind;
import com.example.word2xml.util.style.LabelTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 图表标签识别
 *
 * 标签词干来自 labels.json（Figure / Fig. / Table ...），允许复数形式（Figures、Figs.）。
 * 编号形如 3、2.1、1-4、3a
 */
public class FloatLabelMatcher {

    private static final String NUMBER = "(\\d+(?:[.\\-]\\d+)*[a-z]?)(?![\\w])";

    /** 范围端点：可选的前缀（"2." "4-"）加末段整数 */
    private static final Pattern RANGE_END = Pattern.compile("^(.*[.\\-])?(\\d{1,4})$");

    /** 一个范围最多展开的编号数 */
    static final int MAX_RANGE = 50;

    /** 词干（小写、去掉末尾句点） -> 类型 */
    private final Map<String, FloatKind> stems = new LinkedHashMap<>();
    private final Pattern labelPattern;
    private final Pattern leadingPattern;
    private final Pattern connectorPattern;
    private final Set<String> rangeConnectors = new HashSet<>();

    public FloatLabelMatcher(LabelTable labels) {
        List<String> all = new ArrayList<>();
        for (String stem : labels.getFigure()) {
            register(stem, FloatKind.FIGURE, all);
        }
        for (String stem : labels.getTable()) {
            register(stem, FloatKind.TABLE, all);
        }
        // 长词干优先（Figure 先于 Fig）
        all.sort(Comparator.comparingInt(String::length).reversed());
        StringBuilder alternatives = new StringBuilder();
        for (String stem : all) {
            if (alternatives.length() > 0) {
                alternatives.append('|');
            }
            alternatives.append(Pattern.quote(stem)).append("s?\\.?");
        }
        String stemGroup = all.isEmpty() ? "(?!)" : alternatives.toString();
        this.labelPattern = Pattern.compile("(?i)(?:(" + stemGroup + ")\\s*)?" + NUMBER);
        this.leadingPattern = Pattern.compile("(?i)^\\s*((" + stemGroup + ")\\s*" + NUMBER + ")");

        List<String> connectors = new ArrayList<>();
        for (String c : labels.getConnectors()) {
            connectors.add(connectorRegex(c));
        }
        for (String c : labels.getRangeConnectors()) {
            connectors.add(connectorRegex(c));
            if (!c.trim().isEmpty()) {
                rangeConnectors.add(c.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.connectorPattern = connectors.isEmpty()
                ? Pattern.compile("(?!)")
                : Pattern.compile("(?i)\\s*(?:" + String.join("|", connectors) + ")\\s*");
    }

    private void register(String stem, FloatKind kind, List<String> all) {
        String base = stem.trim();
        while (base.endsWith(".")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.isEmpty()) {
            stems.put(base.toLowerCase(Locale.ROOT), kind);
            all.add(base);
        }
    }

    private static String connectorRegex(String connector) {
        String c = connector.trim();
        if (c.isEmpty()) {
            return "(?!)";
        }
        if (Character.isLetter(c.charAt(0))) {
            return "\\b" + Pattern.quote(c) + "\\b";
        }
        return Pattern.quote(c);
    }

    /**
     * 标签匹配结果
     */
    public static class LabelMatch {
        private final FloatKind kind;
        private final String number;
        private final int start;
        private final int end;

        LabelMatch(FloatKind kind, String number, int start, int end) {
            this.kind = kind;
            this.number = number;
            this.start = start;
            this.end = end;
        }

        /** 标签词干对应的类型；没有词干时为 null */
        public FloatKind getKind() { return kind; }

        /** 编号（小写） */
        public String getNumber() { return number; }

        public int getStart() { return start; }

        public int getEnd() { return end; }
    }

    /**
     * 识别题注开头的标签（必须带词干），如 "Figure 2.1 Growth curve"
     *
     * @return 匹配结果；开头不是标签返回 null
     */
    public LabelMatch leading(String text) {
        Matcher m = leadingPattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        return new LabelMatch(kindOf(m.group(2)), m.group(3).toLowerCase(Locale.ROOT), m.start(1), m.end(1));
    }

    /**
     * 在文本中查找第一个标签（词干可省略）
     */
    public LabelMatch find(String text) {
        Matcher m = labelPattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        return new LabelMatch(m.group(1) == null ? null : kindOf(m.group(1)),
                m.group(2).toLowerCase(Locale.ROOT), m.start(), m.end());
    }

    /**
     * 按连接词（and、&amp;、逗号、to、范围破折号等）切分引用文本
     *
     * @return 交替排列的片段：偶数下标为引用部分，奇数下标为连接词原文
     */
    public List<String> split(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = connectorPattern.matcher(text);
        int pos = 0;
        while (m.find()) {
            if (m.end() == m.start()) {
                continue;
            }
            out.add(text.substring(pos, m.start()));
            out.add(m.group());
            pos = m.end();
        }
        out.add(text.substring(pos));
        return out;
    }

    /**
     * split 得到的连接词是否表示范围（to、through、短破折号等）
     */
    public boolean isRange(String connector) {
        return rangeConnectors.contains(connector.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * 范围两端之间的编号（不含两端），如 3 与 6 得到 4、5，2.1 与 2.4 得到 2.2、2.3。
     * 前缀不同、末段不是整数、倒序或跨度超过 {@link #MAX_RANGE} 时返回空列表
     */
    static List<String> between(String from, String to) {
        List<String> out = new ArrayList<>();
        Matcher a = RANGE_END.matcher(from);
        Matcher b = RANGE_END.matcher(to);
        if (!a.matches() || !b.matches()) {
            return out;
        }
        String prefix = a.group(1) == null ? "" : a.group(1);
        String otherPrefix = b.group(1) == null ? "" : b.group(1);
        if (!prefix.equals(otherPrefix)) {
            return out;
        }
        int first = Integer.parseInt(a.group(2));
        int last = Integer.parseInt(b.group(2));
        if (last <= first || last - first > MAX_RANGE) {
            return out;
        }
        for (int n = first + 1; n < last; n++) {
            out.add(prefix + n);
        }
        return out;
    }

    private FloatKind kindOf(String stemText) {
        String s = stemText.trim().toLowerCase(Locale.ROOT);
        while (s.endsWith(".")) {
            s = s.substring(0, s.length() - 1);
        }
        FloatKind kind = stems.get(s);
        if (kind == null && s.endsWith("s")) {
            kind = stems.get(s.substring(0, s.length() - 1));
        }
        return kind;
    }
}

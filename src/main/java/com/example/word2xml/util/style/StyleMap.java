package com.example.word2xml.util.style;

import com.example.word2xml.util.wml.dto.FormatFlag;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 样式ID -> 语义标签映射表
 *
 * 以数据形式提供（style-map.json），按出版社可替换：
 * - paragraphStyles：按顺序匹配的段落样式规则（正则，忽略大小写，第1个分组为级别）
 * - characterStyles：字符样式 -> 语义内联名
 * - characterFlags：字符样式 -> 格式标记（如 Strong -> BOLD）
 * - ignoredCharacterStyles：不产生包装标签的字符样式
 * - cellShading：单元格底纹颜色 -> 对齐方式
 * - stripPrefixes：匹配前先去掉的样式前缀（如 EOC-）
 *
 * 加载后只读，可在多次转换之间共享
 */
public class StyleMap {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @JsonProperty("paragraphStyles")
    private List<ParagraphRule> paragraphStyles = new ArrayList<>();

    @JsonProperty("characterStyles")
    private Map<String, String> characterStyles = new LinkedHashMap<>();

    @JsonProperty("characterFlags")
    private Map<String, FormatFlag> characterFlags = new LinkedHashMap<>();

    @JsonProperty("ignoredCharacterStyles")
    private List<String> ignoredCharacterStyles = new ArrayList<>();

    @JsonProperty("cellShading")
    private Map<String, String> cellShading = new LinkedHashMap<>();

    @JsonProperty("stripPrefixes")
    private List<String> stripPrefixes = new ArrayList<>();

    @JsonIgnore
    private final Map<String, String> characterStylesLower = new LinkedHashMap<>();

    @JsonIgnore
    private final Map<String, FormatFlag> characterFlagsLower = new LinkedHashMap<>();

    public static StyleMap load(InputStream in) throws IOException {
        StyleMap map = JSON_MAPPER.readValue(in, StyleMap.class);
        map.compile();
        return map;
    }

    private void compile() {
        for (ParagraphRule rule : paragraphStyles) {
            rule.compile();
        }
        for (Map.Entry<String, String> e : characterStyles.entrySet()) {
            characterStylesLower.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        for (Map.Entry<String, FormatFlag> e : characterFlags.entrySet()) {
            characterFlagsLower.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        Map<String, String> upper = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : cellShading.entrySet()) {
            upper.put(e.getKey().toUpperCase(Locale.ROOT), e.getValue());
        }
        cellShading = upper;
    }

    /**
     * 匹配段落样式
     *
     * @param styleId 规范化后的样式ID，可为 null
     * @return 匹配结果；没有规则命中时返回 null
     */
    public StyleMatch matchParagraph(String styleId) {
        if (styleId == null || styleId.isEmpty()) {
            return null;
        }
        String id = styleId;
        for (String prefix : stripPrefixes) {
            if (id.regionMatches(true, 0, prefix, 0, prefix.length())) {
                id = id.substring(prefix.length());
                break;
            }
        }
        for (ParagraphRule rule : paragraphStyles) {
            StyleMatch match = rule.match(id);
            if (match != null) {
                return match;
            }
        }
        return null;
    }

    /**
     * 字符样式对应的语义内联名；未登记返回 null
     */
    public String characterStyle(String styleId) {
        return styleId == null ? null : characterStylesLower.get(styleId.toLowerCase(Locale.ROOT));
    }

    public FormatFlag characterFlag(String styleId) {
        return styleId == null ? null : characterFlagsLower.get(styleId.toLowerCase(Locale.ROOT));
    }

    public boolean isIgnoredCharacterStyle(String styleId) {
        if (styleId == null) {
            return true;
        }
        for (String ignored : ignoredCharacterStyles) {
            if (ignored.equalsIgnoreCase(styleId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 底纹颜色对应的对齐方式（decimal / center / left / right）；未登记返回 null
     */
    public String shadingAlignment(String fill) {
        return fill == null ? null : cellShading.get(fill.toUpperCase(Locale.ROOT));
    }

    public List<ParagraphRule> getParagraphStyles() {
        return Collections.unmodifiableList(paragraphStyles);
    }

    /**
     * 段落样式规则
     */
    public static class ParagraphRule {

        @JsonProperty("pattern")
        private String pattern;

        @JsonProperty("role")
        private ParagraphRole role;

        /** 固定级别；为 null 时取正则第1个分组 */
        @JsonProperty("level")
        private Integer level;

        @JsonProperty("listType")
        private ListType listType;

        /** 普通正文样式：输出时不保留 content-type */
        @JsonProperty("plain")
        private boolean plain;

        @JsonIgnore
        private Pattern compiled;

        public ParagraphRule() {
        }

        public ParagraphRule(String pattern, ParagraphRole role, Integer level, ListType listType, boolean plain) {
            this.pattern = pattern;
            this.role = role;
            this.level = level;
            this.listType = listType;
            this.plain = plain;
            compile();
        }

        void compile() {
            this.compiled = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        }

        StyleMatch match(String styleId) {
            Matcher m = compiled.matcher(styleId);
            if (!m.matches()) {
                return null;
            }
            int resolvedLevel = level != null ? level : 0;
            if (level == null && m.groupCount() >= 1 && m.group(1) != null) {
                try {
                    resolvedLevel = Integer.parseInt(m.group(1));
                } catch (NumberFormatException e) {
                    resolvedLevel = 0;
                }
            }
            return new StyleMatch(role, resolvedLevel, listType, plain);
        }

        public String getPattern() { return pattern; }
        public ParagraphRole getRole() { return role; }
    }

    /**
     * 段落样式匹配结果
     */
    public static class StyleMatch {
        private final ParagraphRole role;
        private final int level;
        private final ListType listType;
        private final boolean plain;

        public StyleMatch(ParagraphRole role, int level, ListType listType, boolean plain) {
            this.role = role;
            this.level = level;
            this.listType = listType;
            this.plain = plain;
        }

        public ParagraphRole getRole() { return role; }
        public int getLevel() { return level; }
        public ListType getListType() { return listType; }
        public boolean isPlain() { return plain; }
    }
}

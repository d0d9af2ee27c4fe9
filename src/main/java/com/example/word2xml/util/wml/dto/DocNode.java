package com.example.word2xml.util.wml.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 规范化后的文档节点
 *
 * 说明：
 * - 树为单一所有权结构，子节点只属于父节点，不保存父引用
 * - styleClass 为样式ID（已经过规范化，数字开头的ID会加前缀）
 * - flags 只对 RUN 有意义
 * - attributes 保存各类型特有的属性，见下方常量
 */
public class DocNode {

    // 段落属性
    public static final String ATTR_LIST_LEVEL = "listLevel";
    public static final String ATTR_NUM_FORMAT = "numFormat";
    public static final String ATTR_OUTLINE_LEVEL = "outlineLevel";
    public static final String ATTR_JUSTIFY = "jc";

    // 表格属性
    public static final String ATTR_GRID_WIDTHS = "gridWidths";
    public static final String ATTR_GRID_COL = "gridCol";
    public static final String ATTR_GRID_SPAN = "gridSpan";
    public static final String ATTR_VMERGE = "vMerge";
    public static final String ATTR_HEADER_ROW = "headerRow";
    public static final String ATTR_NO_BOTTOM_BORDER = "noBottomBorder";
    public static final String ATTR_NO_RIGHT_BORDER = "noRightBorder";
    public static final String ATTR_SHADING = "shading";

    // 批注、链接、域、书签
    public static final String ATTR_ID = "id";
    public static final String ATTR_EDGE = "edge";
    public static final String ATTR_AUTHOR = "author";
    public static final String ATTR_ANCHOR = "anchor";
    public static final String ATTR_TARGET = "target";
    public static final String ATTR_INSTR = "instr";
    public static final String ATTR_NAME = "name";

    public static final String EDGE_START = "start";
    public static final String EDGE_END = "end";

    private final NodeType type;
    private String styleClass;
    private final EnumSet<FormatFlag> flags = EnumSet.noneOf(FormatFlag.class);
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final List<DocNode> children = new ArrayList<>();
    private String text;

    public DocNode(NodeType type) {
        this.type = type;
    }

    public static DocNode text(String value) {
        DocNode node = new DocNode(NodeType.TEXT);
        node.text = value == null ? "" : value;
        return node;
    }

    public static DocNode paragraph(String styleClass) {
        DocNode node = new DocNode(NodeType.PARAGRAPH);
        node.styleClass = styleClass;
        return node;
    }

    public static DocNode run(String styleClass, Set<FormatFlag> flags, String value) {
        DocNode node = new DocNode(NodeType.RUN);
        node.styleClass = styleClass;
        if (flags != null) {
            node.flags.addAll(flags);
        }
        if (value != null) {
            node.children.add(text(value));
        }
        return node;
    }

    public NodeType getType() { return type; }

    public String getStyleClass() { return styleClass; }
    public void setStyleClass(String styleClass) { this.styleClass = styleClass; }

    public Set<FormatFlag> getFlags() { return flags; }

    public boolean hasFlag(FormatFlag flag) { return flags.contains(flag); }

    public Map<String, String> getAttributes() { return Collections.unmodifiableMap(attributes); }

    public String attr(String key) { return attributes.get(key); }

    public int intAttr(String key, int defaultValue) {
        String value = attributes.get(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public DocNode attr(String key, String value) {
        if (value == null) {
            attributes.remove(key);
        } else {
            attributes.put(key, value);
        }
        return this;
    }

    public boolean hasAttr(String key) { return attributes.containsKey(key); }

    public List<DocNode> getChildren() { return children; }

    public DocNode add(DocNode child) {
        if (child != null) {
            children.add(child);
        }
        return this;
    }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public boolean is(NodeType other) { return type == other; }

    /**
     * 递归拼接纯文本（BREAK 记为换行）
     */
    public String plainText() {
        if (type == NodeType.TEXT) {
            return text == null ? "" : text;
        }
        if (type == NodeType.BREAK) {
            return "\n";
        }
        StringBuilder sb = new StringBuilder();
        for (DocNode child : children) {
            sb.append(child.plainText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        if (type == NodeType.TEXT) {
            return "TEXT[" + text + "]";
        }
        return type + (styleClass != null ? "(" + styleClass + ")" : "") + flags + attributes + children;
    }
}

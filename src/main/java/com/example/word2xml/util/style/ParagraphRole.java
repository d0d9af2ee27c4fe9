package com.example.word2xml.util.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 段落语义角色（样式映射表的取值）
 */
public enum ParagraphRole {
    HEADING("heading"),
    LIST_ITEM("list-item"),
    REFERENCE("reference"),
    FIGURE_CAPTION("figure-caption"),
    TABLE_CAPTION("table-caption"),
    TABLE_SOURCE("table-source"),
    TABLE_COLUMN_HEAD("table-column-head"),
    CHAPTER_NUMBER("chapter-number"),
    CHAPTER_TITLE("chapter-title"),
    CHAPTER_AUTHOR("chapter-author"),
    PART_NUMBER("part-number"),
    PART_TITLE("part-title"),
    KEY_TERM("key-term"),
    /** 占位段落：内容为空时也保留 */
    MARKER("marker"),
    PARA("para");

    private final String value;

    ParagraphRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ParagraphRole fromValue(String value) {
        for (ParagraphRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("未知的段落角色: " + value);
    }
}

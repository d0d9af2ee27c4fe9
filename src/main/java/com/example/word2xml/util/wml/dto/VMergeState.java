package com.example.word2xml.util.wml.dto;

/**
 * 单元格纵向合并状态（w:vMerge）
 */
public enum VMergeState {
    NONE,
    RESTART,
    CONTINUE;

    public static VMergeState fromAttribute(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        try {
            return valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}

package com.example.word2xml.util.structure.dto;

/**
 * 浮动体放置状态：PENDING -> PLACED_INLINE（移到首次引用段落之后）或 APPENDED（无引用，放到参考文献之后）
 */
public enum FloatState {
    PENDING("pending"),
    PLACED_INLINE("placed-inline"),
    APPENDED("appended");

    private final String value;

    FloatState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

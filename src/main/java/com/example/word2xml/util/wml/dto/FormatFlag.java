package com.example.word2xml.util.wml.dto;

/**
 * Run 级格式标记
 *
 * 枚举顺序即内联标签的嵌套顺序（外层 → 内层），InlineStyleTable 依赖此顺序
 */
public enum FormatFlag {
    SUPERSCRIPT,
    SUBSCRIPT,
    BOLD,
    ITALIC,
    UNDERLINE,
    STRIKE,
    SMALL_CAPS
}

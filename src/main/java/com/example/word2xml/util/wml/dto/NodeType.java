package com.example.word2xml.util.wml.dto;

/**
 * 规范化文档树的节点类型
 */
public enum NodeType {
    DOCUMENT,
    PARAGRAPH,
    RUN,
    TABLE,
    ROW,
    CELL,
    /** 批注范围标记（start/end 成对出现，id 对应） */
    COMMENT_RANGE,
    HYPERLINK,
    /** 域代码：instr 属性保存指令，子节点为域结果 */
    FIELD,
    BOOKMARK,
    TEXT,
    BREAK
}

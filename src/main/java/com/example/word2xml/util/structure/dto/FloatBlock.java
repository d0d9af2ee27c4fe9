package com.example.word2xml.util.structure.dto;

import org.jsoup.nodes.Element;

/**
 * 浮动体（图 / 表）
 *
 * 状态只能前进一次：PENDING -> PLACED_INLINE 或 PENDING -> APPENDED
 */
public class FloatBlock {

    private final String id;
    private final FloatKind kind;
    private final String label;
    /** 标签中的编号（小写，如 "2.1"、"3a"），用于引用匹配 */
    private final String number;
    private final Element element;
    private FloatState state = FloatState.PENDING;

    public FloatBlock(String id, FloatKind kind, String label, String number, Element element) {
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.number = number;
        this.element = element;
    }

    public String getId() { return id; }
    public FloatKind getKind() { return kind; }
    public String getLabel() { return label; }
    public String getNumber() { return number; }
    public Element getElement() { return element; }
    public FloatState getState() { return state; }

    /**
     * 状态迁移
     *
     * @throws IllegalStateException 已放置过的浮动体再次放置
     */
    public void place(FloatState target) {
        if (state != FloatState.PENDING || target == FloatState.PENDING) {
            throw new IllegalStateException("浮动体 " + id + " 状态不能从 " + state + " 变为 " + target);
        }
        this.state = target;
    }
}

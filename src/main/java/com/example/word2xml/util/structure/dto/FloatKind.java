package com.example.word2xml.util.structure.dto;

/**
 * 浮动体类型
 */
public enum FloatKind {
    FIGURE("fig", "fig"),
    TABLE("table-wrap", "table");

    private final String elementName;
    private final String refType;

    FloatKind(String elementName, String refType) {
        this.elementName = elementName;
        this.refType = refType;
    }

    public String getElementName() { return elementName; }

    /** xref/@ref-type */
    public String getRefType() { return refType; }
}

package com.example.word2xml.util.structure.dto;

/**
 * 参考文献分类（mixed-citation/@publication-type）
 */
public enum PublicationType {
    WEB("web"),
    ARTICLE("article"),
    BOOK("book"),
    OTHER("other");

    private final String value;

    PublicationType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}

package com.example.word2xml.util.wml.dto;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 待转换的源文档
 *
 * documentXml 为 word/document.xml 原文；其余映射来自 docx 包中的其它部件，
 * 调用方只提供 document.xml 时均为空
 */
public class SourceDocument {

    private final String name;
    private final String documentXml;

    /** 超链接关系：rId -> URL */
    private final Map<String, String> hyperlinkTargets = new HashMap<>();

    /** 编号格式："numId:ilvl" -> numFmt（bullet / decimal / lowerLetter ...） */
    private final Map<String, String> numberingFormats = new HashMap<>();

    /** 批注作者：批注ID -> 作者 */
    private final Map<String, String> commentAuthors = new HashMap<>();

    public SourceDocument(String name, String documentXml) {
        this.name = name;
        this.documentXml = documentXml == null ? "" : documentXml;
    }

    public static SourceDocument ofDocumentXml(String name, String documentXml) {
        return new SourceDocument(name, documentXml);
    }

    public String getName() { return name; }

    public String getDocumentXml() { return documentXml; }

    public Map<String, String> getHyperlinkTargets() { return Collections.unmodifiableMap(hyperlinkTargets); }

    public Map<String, String> getNumberingFormats() { return Collections.unmodifiableMap(numberingFormats); }

    public Map<String, String> getCommentAuthors() { return Collections.unmodifiableMap(commentAuthors); }

    public SourceDocument withHyperlink(String relationId, String url) {
        hyperlinkTargets.put(relationId, url);
        return this;
    }

    public SourceDocument withNumberingFormat(String numId, int ilvl, String numFmt) {
        numberingFormats.put(numId + ":" + ilvl, numFmt);
        return this;
    }

    public SourceDocument withCommentAuthor(String commentId, String author) {
        commentAuthors.put(commentId, author);
        return this;
    }

    public String numberingFormat(String numId, int ilvl) {
        return numberingFormats.get(numId + ":" + ilvl);
    }
}

package com.example.word2xml.util.style;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语言标签表（labels.json）
 *
 * 章、摘要、关键词、参考文献等标题文字，以及图表引用的标签词干
 */
public class LabelTable {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @JsonProperty("chapter")
    private String chapter = "Chapter";

    @JsonProperty("part")
    private String part = "Part";

    @JsonProperty("abstract")
    private String abstractLabel = "Abstract";

    @JsonProperty("keywords")
    private String keywords = "Keywords";

    @JsonProperty("references")
    private String references = "References";

    /** 图标签词干，第一个为规范形式 */
    @JsonProperty("figure")
    private List<String> figure = new ArrayList<>();

    @JsonProperty("table")
    private List<String> table = new ArrayList<>();

    /** 引用中的连接词（and、&amp;、to 等） */
    @JsonProperty("connectors")
    private List<String> connectors = new ArrayList<>();

    /** 范围连接词（"3 to 5"、"3–5"） */
    @JsonProperty("rangeConnectors")
    private List<String> rangeConnectors = new ArrayList<>();

    public static LabelTable load(InputStream in) throws IOException {
        return JSON_MAPPER.readValue(in, LabelTable.class);
    }

    public String getChapter() { return chapter; }
    public String getPart() { return part; }
    public String getAbstractLabel() { return abstractLabel; }
    public String getKeywords() { return keywords; }
    public String getReferences() { return references; }
    public List<String> getFigure() { return Collections.unmodifiableList(figure); }
    public List<String> getTable() { return Collections.unmodifiableList(table); }
    public List<String> getConnectors() { return Collections.unmodifiableList(connectors); }
    public List<String> getRangeConnectors() { return Collections.unmodifiableList(rangeConnectors); }
}

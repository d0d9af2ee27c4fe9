package com.example.word2xml.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单次转换的统计报告
 *
 * 只记录结果，不影响转换；同一输入多次转换得到的报告完全相同
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversionReport {

    @JsonProperty("document")
    private String document;

    @JsonProperty("section_count")
    private int sectionCount;

    @JsonProperty("list_count")
    private int listCount;

    @JsonProperty("table_count")
    private int tableCount;

    @JsonProperty("merge_fallback_count")
    private int mergeFallbackCount;

    @JsonProperty("reference_types")
    private final Map<String, Integer> referenceTypes = new LinkedHashMap<>();

    @JsonProperty("citations_resolved")
    private int citationsResolved;

    @JsonProperty("unresolved_citations")
    private final List<String> unresolvedCitations = new ArrayList<>();

    @JsonProperty("float_states")
    private final Map<String, Integer> floatStates = new LinkedHashMap<>();

    @JsonProperty("anomalies")
    private final List<String> anomalies = new ArrayList<>();

    public String getDocument() { return document; }
    public void setDocument(String document) { this.document = document; }

    public int getSectionCount() { return sectionCount; }
    public void setSectionCount(int sectionCount) { this.sectionCount = sectionCount; }

    public int getListCount() { return listCount; }
    public void setListCount(int listCount) { this.listCount = listCount; }

    public int getTableCount() { return tableCount; }
    public void incrementTableCount() { tableCount++; }

    public int getMergeFallbackCount() { return mergeFallbackCount; }
    public void incrementMergeFallbackCount() { mergeFallbackCount++; }

    public Map<String, Integer> getReferenceTypes() { return referenceTypes; }

    public void countReferenceType(String type) {
        referenceTypes.merge(type, 1, Integer::sum);
    }

    public int getCitationsResolved() { return citationsResolved; }
    public void incrementCitationsResolved() { citationsResolved++; }

    public List<String> getUnresolvedCitations() { return unresolvedCitations; }

    public void addUnresolvedCitation(String text) {
        unresolvedCitations.add(text);
    }

    public Map<String, Integer> getFloatStates() { return floatStates; }

    public void countFloatState(String state) {
        floatStates.merge(state, 1, Integer::sum);
    }

    public List<String> getAnomalies() { return anomalies; }

    public void addAnomaly(String message) {
        anomalies.add(message);
    }
}

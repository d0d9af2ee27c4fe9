package com.example.word2xml.util.structure.dto;

import java.util.Collections;
import java.util.List;

/**
 * 文中引用标记
 *
 * 解析结果只有两种：唯一的参考文献ID，或明确的未解析状态（不会被丢弃）
 */
public class CitationMarker {

    /**
     * 未解析原因
     */
    public enum Unresolved {
        NO_MATCH("no-match"),
        AMBIGUOUS("ambiguous");

        private final String value;

        Unresolved(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private final String rawText;
    private final List<String> tokens;
    private final String resolvedId;
    private final Unresolved unresolved;

    private CitationMarker(String rawText, List<String> tokens, String resolvedId, Unresolved unresolved) {
        this.rawText = rawText;
        this.tokens = Collections.unmodifiableList(tokens);
        this.resolvedId = resolvedId;
        this.unresolved = unresolved;
    }

    public static CitationMarker resolved(String rawText, List<String> tokens, String id) {
        return new CitationMarker(rawText, tokens, id, null);
    }

    public static CitationMarker unresolved(String rawText, List<String> tokens, Unresolved reason) {
        return new CitationMarker(rawText, tokens, null, reason);
    }

    public String getRawText() { return rawText; }

    public List<String> getTokens() { return tokens; }

    /** 归一化匹配键 */
    public String getKey() { return String.join("|", tokens); }

    public String getResolvedId() { return resolvedId; }

    public Unresolved getUnresolved() { return unresolved; }

    public boolean isResolved() { return resolvedId != null; }

    @Override
    public String toString() {
        return rawText + " -> " + (isResolved() ? resolvedId : unresolved.getValue());
    }
}

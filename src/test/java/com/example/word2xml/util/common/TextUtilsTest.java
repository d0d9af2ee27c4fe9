package com.example.word2xml.util.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextUtils")
class TextUtilsTest {

    @Test
    @DisplayName("should drop connectors and punctuation from citation tokens")
    void shouldTokenize_whenConnectorsPresent() {
        assertThat(TextUtils.matchTokens("Smith and Jones, 2020")).containsExactly("smith", "jones", "2020");
        assertThat(TextUtils.matchTokens("Smith et al. 2020")).containsExactly("smith", "2020");
        assertThat(TextUtils.matchKey("Smith & Jones (2020)")).isEqualTo("smith|jones|2020");
    }

    @Test
    @DisplayName("should return no tokens for blank input")
    void shouldReturnEmpty_whenBlank() {
        assertThat(TextUtils.matchTokens(null)).isEmpty();
        assertThat(TextUtils.matchTokens("  ")).isEmpty();
        assertThat(TextUtils.matchKey("")).isEmpty();
    }

    @Test
    @DisplayName("should require the first token at the start and the rest in order")
    void shouldMatchTokensInOrder_onlyFromStart() {
        String text = "smith|j|jones|k|2020|growth";

        assertThat(TextUtils.tokensInOrder(text, Arrays.asList("smith", "jones", "2020"))).isTrue();
        assertThat(TextUtils.tokensInOrder(text, Arrays.asList("jones", "2020"))).isFalse();
        assertThat(TextUtils.tokensInOrder(text, Arrays.asList("smith", "2020", "jones"))).isFalse();
        assertThat(TextUtils.tokensInOrder(text, Collections.<String>emptyList())).isFalse();
    }

    @Test
    @DisplayName("should normalize zero-width characters, special spaces and dashes")
    void shouldNormalizeSpecialCharacters() {
        assertThat(TextUtils.collapseWhitespace("  a \u200B b\u00A0c  ")).isEqualTo("a b c");
        assertThat(TextUtils.normalizeDashes("1\u20132\u20143")).isEqualTo("1-2-3");
        assertThat(TextUtils.matchTokens("pp. 1\u201310")).containsExactly("pp", "1", "10");
    }

    @Test
    @DisplayName("should truncate long text for logging")
    void shouldTruncate_whenLongerThanLimit() {
        assertThat(TextUtils.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(TextUtils.truncate("abc", 3)).isEqualTo("abc");
        assertThat(TextUtils.truncate(null, 3)).isEmpty();
    }
}

package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.WmlFixtures;
import com.example.word2xml.util.structure.dto.FloatKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FloatLabelMatcher")
class FloatLabelMatcherTest {

    private final FloatLabelMatcher matcher = new FloatLabelMatcher(WmlFixtures.labels());

    @Test
    @DisplayName("should recognise a caption label with a dotted number")
    void shouldMatchLeadingLabel_whenCaptionStartsWithStem() {
        FloatLabelMatcher.LabelMatch m = matcher.leading("Figure 2.1 Growth curve");

        assertThat(m.getKind()).isEqualTo(FloatKind.FIGURE);
        assertThat(m.getNumber()).isEqualTo("2.1");
        assertThat(m.getStart()).isZero();
        assertThat(m.getEnd()).isEqualTo("Figure 2.1".length());
    }

    @Test
    @DisplayName("should accept abbreviated and plural stems")
    void shouldMatchAbbreviatedStem() {
        assertThat(matcher.leading("Fig. 3: Roots").getKind()).isEqualTo(FloatKind.FIGURE);
        assertThat(matcher.leading("Tables 4 and 5").getKind()).isEqualTo(FloatKind.TABLE);
        assertThat(matcher.leading("Growth curve")).isNull();
    }

    @Test
    @DisplayName("should find bare numbers without a stem")
    void shouldFindNumber_whenStemMissing() {
        FloatLabelMatcher.LabelMatch m = matcher.find("5b");

        assertThat(m.getKind()).isNull();
        assertThat(m.getNumber()).isEqualTo("5b");
        assertThat(matcher.find("Table 2A").getNumber()).isEqualTo("2a");
    }

    @Test
    @DisplayName("should split compound references on connectors")
    void shouldSplitOnConnectors() {
        assertThat(matcher.split("Figures 3 and 5")).containsExactly("Figures 3", " and ", "5");
        assertThat(matcher.split("Table 1, 2 & 4")).containsExactly("Table 1", ", ", "2", " & ", "4");
        assertThat(matcher.split("Figure 7")).containsExactly("Figure 7");
    }

    @Test
    @DisplayName("should recognise range connectors only")
    void shouldDetectRangeConnector() {
        assertThat(matcher.isRange("\u2013")).isTrue();
        assertThat(matcher.isRange(" to ")).isTrue();
        assertThat(matcher.isRange(" and ")).isFalse();
        assertThat(matcher.isRange(", ")).isFalse();
    }

    @Test
    @DisplayName("should list the numbers strictly inside a range")
    void shouldExpandNumbersBetweenRangeEnds() {
        assertThat(FloatLabelMatcher.between("3", "6")).containsExactly("4", "5");
        assertThat(FloatLabelMatcher.between("2.1", "2.4")).containsExactly("2.2", "2.3");
        assertThat(FloatLabelMatcher.between("2.1", "3.4")).isEmpty();
        assertThat(FloatLabelMatcher.between("5", "2")).isEmpty();
        assertThat(FloatLabelMatcher.between("3a", "5")).isEmpty();
        assertThat(FloatLabelMatcher.between("1", "1000")).isEmpty();
    }
}

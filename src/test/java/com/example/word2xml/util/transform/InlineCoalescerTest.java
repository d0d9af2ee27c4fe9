package com.example.word2xml.util.transform;

import static org.assertj.core.api.Assertions.assertThat;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InlineCoalescer")
class InlineCoalescerTest {

    private static Element parse(String xml) {
        return Jsoup.parse(xml, "", Parser.xmlParser()).child(0);
    }

    @Test
    @DisplayName("should merge adjacent identical wrappers and absorb blank text between them")
    void shouldMergeAdjacentWrappers() {
        Element p = parse("<p><bold>a</bold> <bold>b</bold><bold><italic>c</italic></bold>d</p>");

        InlineCoalescer.Result result = InlineCoalescer.coalesce(p);

        assertThat(p.getElementsByTag("bold")).hasSize(1);
        assertThat(p.child(0).text()).isEqualTo("a bc");
        assertThat(result.getMerges()).isEqualTo(2);
    }

    @Test
    @DisplayName("should merge nested wrappers exposed by an outer merge")
    void shouldMergeNested_whenOuterMergeExposesPairs() {
        Element p = parse("<p><bold><italic>a</italic></bold><bold><italic>b</italic></bold></p>");

        InlineCoalescer.Result result = InlineCoalescer.coalesce(p);

        assertThat(p.html()).isEqualTo("<bold><italic>ab</italic></bold>");
        assertThat(result.getMerges()).isEqualTo(2);
    }

    @Test
    @DisplayName("should not merge wrappers with different attributes")
    void shouldKeepApart_whenAttributesDiffer() {
        Element p = parse("<p><styled-content style-type=\"x\">a</styled-content><styled-content style-type=\"y\">b</styled-content></p>");

        InlineCoalescer.Result result = InlineCoalescer.coalesce(p);

        assertThat(p.children()).hasSize(2);
        assertThat(result.getMerges()).isZero();
        assertThat(result.getIterations()).isEqualTo(1);
    }

    @Test
    @DisplayName("should stay within the iteration bound")
    void shouldTerminateWithinBound() {
        StringBuilder xml = new StringBuilder("<p>");
        for (int i = 0; i < 50; i++) {
            xml.append("<bold><italic><sup>").append(i).append("</sup></italic></bold>");
        }
        xml.append("</p>");
        Element p = parse(xml.toString());
        int elements = p.getAllElements().size();

        InlineCoalescer.Result result = InlineCoalescer.coalesce(p);

        assertThat(result.getInitialMeasure()).isEqualTo(49);
        assertThat(result.getIterations()).isLessThanOrEqualTo(elements + 1);
        assertThat(InlineCoalescer.countMergeablePairs(p)).isZero();
        assertThat(p.getElementsByTag("sup")).hasSize(1);
    }
}

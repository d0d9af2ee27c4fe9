package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KeyTermLinker")
class KeyTermLinkerTest {

    @Test
    @DisplayName("should link bold occurrences of key terms including simple plurals")
    void shouldLinkBoldTerms() {
        // Given
        Element doc = Jsoup.parse("<doc>"
                + "<sec><title><bold>Osmosis</bold></title>"
                + "<p>About <bold>osmosis</bold>, <bold>Diffusions</bold> and <bold>other</bold> things.</p></sec>"
                + "<p role=\"key-term\">Osmosis</p><p role=\"key-term\">Diffusion</p>"
                + "</doc>", "", Parser.xmlParser()).child(0);
        ConversionContext ctx = new ConversionContext("terms");

        // When
        Map<String, String> terms = KeyTermLinker.buildLists(doc, ctx);
        int linked = KeyTermLinker.link(doc, terms, ctx);

        // Then
        assertThat(terms).containsEntry("osmosis", "term1").containsEntry("diffusion", "term2");
        Element list = doc.selectFirst("list");
        assertThat(list.attr("specific-use")).isEqualTo(KeyTermLinker.KEY_TERMS);
        assertThat(list.select("list-item > p")).extracting(Element::id).containsExactly("term1", "term2");
        assertThat(list.select("p[role]")).isEmpty();

        assertThat(linked).isEqualTo(2);
        assertThat(doc.select("sec > p bold > xref")).extracting(el -> el.attr("rid")).containsExactly("term1", "term2");
        assertThat(doc.select("title xref")).isEmpty();
        assertThat(doc.select("xref[ref-type=keyterm]").first().text()).isEqualTo("osmosis");
    }

    @Test
    @DisplayName("should do nothing without a key term list")
    void shouldNotLink_whenNoTerms() {
        Element doc = Jsoup.parse("<doc><p><bold>word</bold></p></doc>", "", Parser.xmlParser()).child(0);
        ConversionContext ctx = new ConversionContext("terms");

        int linked = KeyTermLinker.link(doc, KeyTermLinker.buildLists(doc, ctx), ctx);

        assertThat(linked).isZero();
        assertThat(doc.select("xref")).isEmpty();
    }
}

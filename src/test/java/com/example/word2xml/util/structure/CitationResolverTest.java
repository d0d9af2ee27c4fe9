package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.structure.dto.BibliographyEntry;
import com.example.word2xml.util.structure.dto.BibliographyEntry.Field;
import com.example.word2xml.util.structure.dto.BibliographyEntry.PersonName;
import com.example.word2xml.util.structure.dto.CitationMarker;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CitationResolver")
class CitationResolverTest {

    private List<BibliographyEntry> entries;

    private static BibliographyEntry entry(String id, String year, String text, PersonName... authors) {
        return new BibliographyEntry(id, Arrays.asList(authors),
                Collections.singletonMap(Field.YEAR, year), TextUtils.matchKey(text));
    }

    @BeforeEach
    void setUp() {
        entries = new ArrayList<>();
        entries.add(entry("bid_1_1", "2020", "Smith, J., & Jones, K. (2020). Growth of things. Journal, 3(2), 1-10.",
                new PersonName("Smith", "J.", null), new PersonName("Jones", "K.", null)));
        entries.add(entry("bid_1_2", "2020", "Smith, A. (2020). Another book. Press.",
                new PersonName("Smith", "A.", null)));
    }

    @Test
    @DisplayName("should resolve a citation with a single candidate")
    void shouldResolve_whenOneEntryMatches() {
        // When
        CitationMarker marker = CitationResolver.match("Smith and Jones, 2020", entries);

        // Then
        assertThat(marker.isResolved()).isTrue();
        assertThat(marker.getResolvedId()).isEqualTo("bid_1_1");
        assertThat(marker.getKey()).isEqualTo("smith|jones|2020");
    }

    @Test
    @DisplayName("should break ties by exact author and year")
    void shouldPreferExactAuthorYear_whenSeveralCandidates() {
        CitationMarker marker = CitationResolver.match("Smith, 2020", entries);

        assertThat(marker.getResolvedId()).isEqualTo("bid_1_2");
    }

    @Test
    @DisplayName("should report ambiguity when more than one entry matches exactly")
    void shouldBeAmbiguous_whenTwoExactMatches() {
        entries.add(entry("bid_1_3", "2020", "Smith, B. (2020). Third work.", new PersonName("Smith", "B.", null)));

        CitationMarker marker = CitationResolver.match("Smith, 2020", entries);

        assertThat(marker.isResolved()).isFalse();
        assertThat(marker.getUnresolved()).isEqualTo(CitationMarker.Unresolved.AMBIGUOUS);
    }

    @Test
    @DisplayName("should report no match for unknown authors")
    void shouldBeNoMatch_whenNoEntryMatches() {
        CitationMarker marker = CitationResolver.match("Unknown, 1999", entries);

        assertThat(marker.getUnresolved()).isEqualTo(CitationMarker.Unresolved.NO_MATCH);
        assertThat(CitationResolver.match("", entries).getUnresolved()).isEqualTo(CitationMarker.Unresolved.NO_MATCH);
    }

    @Test
    @DisplayName("should give the same answer for the same input")
    void shouldBeDeterministic() {
        CitationMarker first = CitationResolver.match("Smith, 2020", entries);
        CitationMarker second = CitationResolver.match("Smith, 2020", entries);

        assertThat(second.getResolvedId()).isEqualTo(first.getResolvedId());
        assertThat(second.getKey()).isEqualTo(first.getKey());
    }

    @Test
    @DisplayName("should use the organisation name for corporate authors")
    void shouldUseCollab_forAuthorYearTokens() {
        BibliographyEntry who = entry("bid_1_9", "2019", "World Health Organization (2019). Report.",
                new PersonName(null, null, "World Health Organization"));

        assertThat(CitationResolver.authorYearTokens(who)).containsExactly("world", "health", "organization", "2019");
    }

    @Test
    @DisplayName("should split grouped citations and rewrite each marker")
    void shouldRewriteMarkers_whenResolvingDocument() {
        // Given
        Element p = Jsoup.parse("<p>See <citebib>Smith and Jones, 2020; Unknown, 1999</citebib>.</p>", "",
                Parser.xmlParser()).child(0);
        ConversionContext ctx = new ConversionContext("citations");

        // When
        int resolved = CitationResolver.resolve(p, entries, ctx);

        // Then
        assertThat(resolved).isEqualTo(1);
        assertThat(p.getElementsByTag("citebib")).isEmpty();
        Element xref = p.selectFirst("xref");
        assertThat(xref.attr("ref-type")).isEqualTo("bibr");
        assertThat(xref.attr("rid")).isEqualTo("bid_1_1");
        assertThat(xref.text()).isEqualTo("Smith and Jones, 2020");
        Element unresolved = p.selectFirst("named-content");
        assertThat(unresolved.attr("content-type")).isEqualTo("unresolved-bibr");
        assertThat(unresolved.attr("specific-use")).isEqualTo("no-match");
        assertThat(unresolved.text()).isEqualTo("Unknown, 1999");
        assertThat(p.text()).isEqualTo("See Smith and Jones, 2020; Unknown, 1999.");
        assertThat(ctx.getReport().getCitationsResolved()).isEqualTo(1);
        assertThat(ctx.getReport().getUnresolvedCitations()).containsExactly("Unknown, 1999");
    }
}

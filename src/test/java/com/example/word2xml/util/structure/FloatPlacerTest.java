package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.structure.dto.FloatKind;
import com.example.word2xml.util.structure.dto.FloatState;
import java.util.Arrays;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FloatPlacer")
class FloatPlacerTest {

    private static final String BODY = "<body>"
            + "<sec id=\"s1\"><title>Intro <xref ref-type=\"fig\" rid=\"fig1_3\">Figure 3</xref></title>"
            + "<p id=\"p1\">See <xref ref-type=\"fig\" rid=\"fig1_2\">Figure 2</xref>.</p>"
            + "<p id=\"p2\">Also <xref ref-type=\"fig\" rid=\"fig1_1\">Figure 1</xref> and "
            + "<xref ref-type=\"fig\" rid=\"fig1_2\">Figure 2</xref>.</p>"
            + "</sec>"
            + "<table-wrap id=\"tab1_1\"><label>Table 1</label></table-wrap>"
            + "<fig id=\"fig1_1\"><label>Figure 1</label><caption><title>Data from "
            + "<xref ref-type=\"table\" rid=\"tab1_1\">Table 1</xref></title></caption></fig>"
            + "<fig id=\"fig1_2\"><label>Figure 2</label></fig>"
            + "<fig id=\"fig1_3\"><label>Figure 3</label></fig>"
            + "<ref-list><ref id=\"bid_1_1\"><mixed-citation>See "
            + "<xref ref-type=\"fig\" rid=\"fig1_3\">Figure 3</xref></mixed-citation></ref></ref-list>"
            + "<p id=\"tail\">End</p>"
            + "</body>";

    private Element body;
    private List<FloatBlock> floats;
    private ConversionContext ctx;

    @BeforeEach
    void setUp() {
        body = Jsoup.parse(BODY, "", Parser.xmlParser()).child(0);
        floats = Arrays.asList(
                block("tab1_1", FloatKind.TABLE),
                block("fig1_1", FloatKind.FIGURE),
                block("fig1_2", FloatKind.FIGURE),
                block("fig1_3", FloatKind.FIGURE));
        ctx = new ConversionContext("floats");
    }

    private FloatBlock block(String id, FloatKind kind) {
        Element el = body.getElementById(id);
        return new FloatBlock(id, kind, el.selectFirst("label").text(), id.substring(id.length() - 1), el);
    }

    @Test
    @DisplayName("should place each float after the first block that cites it")
    void shouldPlaceAfterFirstCitingBlock() {
        // When
        FloatPlacer.place(body, floats, ctx);

        // Then
        Element sec = body.getElementById("s1");
        assertThat(sec.children()).extracting(Element::id)
                .containsExactly("", "p1", "fig1_2", "p2", "fig1_1", "tab1_1");
        assertThat(floats.get(0).getState()).isEqualTo(FloatState.PLACED_INLINE);
        assertThat(floats.get(2).getState()).isEqualTo(FloatState.PLACED_INLINE);
    }

    @Test
    @DisplayName("should ignore citations in titles and reference lists and append those floats after the references")
    void shouldAppendUncitedFloats_afterLastReferenceList() {
        FloatPlacer.place(body, floats, ctx);

        assertThat(body.children()).extracting(Element::normalName)
                .containsExactly("sec", "ref-list", "fig", "p");
        assertThat(body.child(2).id()).isEqualTo("fig1_3");
        assertThat(floats.get(3).getState()).isEqualTo(FloatState.APPENDED);
        assertThat(ctx.getReport().getFloatStates()).containsEntry("placed-inline", 3).containsEntry("appended", 1);
    }

    @Test
    @DisplayName("should append to the end of the body when there is no reference list")
    void shouldAppendToBody_whenNoReferenceList() {
        body.selectFirst("ref-list").remove();

        FloatPlacer.place(body, floats, ctx);

        assertThat(body.children().last().id()).isEqualTo("fig1_3");
    }

    @Test
    @DisplayName("should place every float exactly once")
    void shouldNotDuplicateFloats() {
        FloatPlacer.place(body, floats, ctx);

        for (FloatBlock block : floats) {
            assertThat(body.select("#" + block.getId())).hasSize(1);
            assertThat(block.getState()).isNotEqualTo(FloatState.PENDING);
        }
    }

    @Test
    @DisplayName("should treat every id of a range reference as a citation")
    void shouldPlaceFloat_whenCitedOnlyInsideRange() {
        // Given
        Element rangeBody = Jsoup.parse("<body><p id=\"p1\">See <xref ref-type=\"fig\" rid=\"fig1_1\">Figures 1</xref>"
                + "\u2013<xref ref-type=\"fig\" rid=\"fig1_2 fig1_3\">3</xref>.</p><p id=\"p2\">More</p>"
                + "<fig id=\"fig1_1\"/><fig id=\"fig1_2\"/><fig id=\"fig1_3\"/></body>", "", Parser.xmlParser()).child(0);
        List<FloatBlock> rangeFloats = Arrays.asList(
                new FloatBlock("fig1_1", FloatKind.FIGURE, "Figure 1", "1", rangeBody.getElementById("fig1_1")),
                new FloatBlock("fig1_2", FloatKind.FIGURE, "Figure 2", "2", rangeBody.getElementById("fig1_2")),
                new FloatBlock("fig1_3", FloatKind.FIGURE, "Figure 3", "3", rangeBody.getElementById("fig1_3")));

        // When
        FloatPlacer.place(rangeBody, rangeFloats, ctx);

        // Then
        assertThat(rangeBody.children()).extracting(Element::id)
                .containsExactly("p1", "fig1_1", "fig1_2", "fig1_3", "p2");
        for (FloatBlock block : rangeFloats) {
            assertThat(block.getState()).isEqualTo(FloatState.PLACED_INLINE);
        }
    }
}

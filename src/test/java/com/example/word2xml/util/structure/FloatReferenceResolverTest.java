package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.WmlFixtures;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.structure.dto.FloatKind;
import java.util.Arrays;
import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FloatReferenceResolver")
class FloatReferenceResolverTest {

    private final FloatLabelMatcher matcher = new FloatLabelMatcher(WmlFixtures.labels());

    private List<FloatBlock> floats;
    private ConversionContext ctx;

    @BeforeEach
    void setUp() {
        floats = Arrays.asList(
                block("fig1_1", FloatKind.FIGURE, "1"),
                block("fig1_2", FloatKind.FIGURE, "2"),
                block("fig1_3", FloatKind.FIGURE, "3"),
                block("fig1_4", FloatKind.FIGURE, "4"),
                block("tab1_1", FloatKind.TABLE, "1"));
        ctx = new ConversionContext("float-refs");
    }

    private static FloatBlock block(String id, FloatKind kind, String number) {
        String label = (kind == FloatKind.FIGURE ? "Figure " : "Table ") + number;
        return new FloatBlock(id, kind, label, number, new Element(kind.getElementName()).attr("id", id));
    }

    private static Element parse(String content) {
        Document doc = Jsoup.parse("<p>" + content + "</p>", "", Parser.xmlParser());
        doc.outputSettings().prettyPrint(false);
        return doc.child(0);
    }

    private Element paragraph(String content) {
        Element p = parse(content);
        FloatReferenceResolver.resolve(p, floats, matcher, ctx);
        return p;
    }

    @Test
    @DisplayName("should split a compound figure citation into one xref per label")
    void shouldEmitTwoXrefs_whenCitationNamesTwoFigures() {
        // Given
        String content = "See <figure-citation>Figures 1 and 2</figure-citation>.";

        // When
        Element p = paragraph(content);

        // Then
        assertThat(p.html()).isEqualTo("See <xref ref-type=\"fig\" rid=\"fig1_1\">Figures 1</xref> and "
                + "<xref ref-type=\"fig\" rid=\"fig1_2\">2</xref>.");
        assertThat(p.getElementsByTag("figure-citation")).isEmpty();
    }

    @Test
    @DisplayName("should let a bare number inherit the stem of the previous part")
    void shouldInheritPreviousStem_whenPartHasNoStem() {
        // Given: 字符样式是表格引用，但第二段应沿用前一段的 Figure
        Element p = paragraph("<table-citation>Figure 3 and 1</table-citation>");

        // Then
        assertThat(p.select("xref")).extracting(el -> el.attr("rid")).containsExactly("fig1_3", "fig1_1");
    }

    @Test
    @DisplayName("should use the character style kind for a leading bare number")
    void shouldUseCitationKind_whenFirstPartHasNoStem() {
        Element p = paragraph("<table-citation>1</table-citation>");

        Element xref = p.selectFirst("xref");
        assertThat(xref.attr("ref-type")).isEqualTo("table");
        assertThat(xref.attr("rid")).isEqualTo("tab1_1");
    }

    @Test
    @DisplayName("should fall back to the bare label when a lettered sub-figure is not a float")
    void shouldResolveToBaseFigure_whenLetterSuffixUnknown() {
        Element p = paragraph("<figure-citation>Figure 3a</figure-citation>");

        Element xref = p.selectFirst("xref");
        assertThat(xref.attr("rid")).isEqualTo("fig1_3");
        assertThat(xref.text()).isEqualTo("Figure 3a");
    }

    @Test
    @DisplayName("should switch kind mid-citation when a part carries its own stem")
    void shouldResolveMixedKinds_whenFigureAndTableCited() {
        Element p = paragraph("<figure-citation>Figure 2 and Table 1</figure-citation>");

        assertThat(p.select("xref")).extracting(el -> el.attr("ref-type") + ":" + el.attr("rid"))
                .containsExactly("fig:fig1_2", "table:tab1_1");
    }

    @Test
    @DisplayName("should tag unresolved figure and table citations for review")
    void shouldMarkUnresolved_whenNoFloatMatches() {
        // When
        Element p = paragraph("<figure-citation>Figure 9</figure-citation> and <table-citation>Table 7</table-citation>");

        // Then
        assertThat(p.select("xref")).isEmpty();
        assertThat(p.select("named-content")).extracting(el -> el.attr("content-type"))
                .containsExactly("unresolved-fig", "unresolved-table");
        assertThat(p.select("named-content").first().text()).isEqualTo("Figure 9");
        assertThat(ctx.getReport().getUnresolvedCitations()).containsExactly("Figure 9", "Table 7");
    }

    @Test
    @DisplayName("should list the figures inside a numeric range on the range end")
    void shouldExpandRange_whenCitationUsesEnDash() {
        // When
        Element p = paragraph("<figure-citation>Figures 1\u20134</figure-citation>");

        // Then
        assertThat(p.select("xref")).extracting(el -> el.attr("rid"))
                .containsExactly("fig1_1", "fig1_2 fig1_3 fig1_4");
        assertThat(p.text()).isEqualTo("Figures 1\u20134");
    }

    @Test
    @DisplayName("should not expand a plain list of labels")
    void shouldNotExpand_whenConnectorIsNotRange() {
        Element p = paragraph("<figure-citation>Figures 1 and 4</figure-citation>");

        assertThat(p.select("xref")).extracting(el -> el.attr("rid")).containsExactly("fig1_1", "fig1_4");
    }

    @Test
    @DisplayName("should count every float a citation resolves to")
    void shouldReturnResolvedCount() {
        Element p = parse("<figure-citation>Figures 1 to 3</figure-citation>");

        int resolved = FloatReferenceResolver.resolve(p, floats, matcher, ctx);

        assertThat(resolved).isEqualTo(3);
    }
}

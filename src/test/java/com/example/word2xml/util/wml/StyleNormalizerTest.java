package com.example.word2xml.util.wml;

import static com.example.word2xml.util.WmlFixtures.document;
import static com.example.word2xml.util.WmlFixtures.p;
import static com.example.word2xml.util.WmlFixtures.r;
import static com.example.word2xml.util.WmlFixtures.table;
import static com.example.word2xml.util.WmlFixtures.tc;
import static com.example.word2xml.util.WmlFixtures.tcContinue;
import static com.example.word2xml.util.WmlFixtures.tcRestart;
import static com.example.word2xml.util.WmlFixtures.tcSpan;
import static com.example.word2xml.util.WmlFixtures.tr;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.wml.dto.DocNode;
import com.example.word2xml.util.wml.dto.NodeType;
import com.example.word2xml.util.wml.dto.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("StyleNormalizer")
class StyleNormalizerTest {

    private DocNode normalize(String xml) {
        SourceDocument source = SourceDocument.ofDocumentXml("test", xml);
        return StyleNormalizer.normalize(WmlReader.parse(source), source, new ConversionContext("test"));
    }

    @Test
    @DisplayName("should drop tracked deletions without residue")
    void shouldDropDeletedText_whenTrackedDeletionPresent() {
        // Given
        String xml = document(p(null,
                r("kept "),
                "<w:del w:id=\"1\" w:author=\"A\"><w:r><w:delText>removed</w:delText></w:r></w:del>",
                "<w:ins w:id=\"2\" w:author=\"A\">" + r("inserted") + "</w:ins>"));

        // When
        DocNode root = normalize(xml);

        // Then
        assertThat(root.getChildren()).hasSize(1);
        assertThat(root.getChildren().get(0).plainText()).isEqualTo("kept inserted");
    }

    @Test
    @DisplayName("should promote children of smart tags")
    void shouldPromoteChildren_whenSmartTagWrapsRuns() {
        String xml = document(p(null, "<w:smartTag w:element=\"place\">" + r("Paris") + "</w:smartTag>", r(" today")));

        DocNode para = normalize(xml).getChildren().get(0);

        assertThat(para.getChildren()).allMatch(n -> n.is(NodeType.RUN));
        assertThat(para.plainText()).isEqualTo("Paris today");
    }

    @Test
    @DisplayName("should prefix style ids that start with a digit")
    void shouldPrefixStyleId_whenStartsWithDigit() {
        DocNode root = normalize(document(p("1Heading", r("x")), p("Heading1", r("y"))));

        assertThat(root.getChildren().get(0).getStyleClass()).isEqualTo("A1Heading");
        assertThat(root.getChildren().get(1).getStyleClass()).isEqualTo("Heading1");
        assertThat(StyleNormalizer.normalizeStyleId("A1Heading")).isEqualTo("A1Heading");
    }

    @Test
    @DisplayName("should record positional grid column including spans")
    void shouldAssignGridColumns_whenPrecedingCellSpans() {
        String xml = document(table(new int[]{100, 100, 100}, tr(tcSpan(2, "a"), tc("b"))));

        DocNode row = normalize(xml).getChildren().get(0).getChildren().get(0);

        assertThat(row.getChildren()).hasSize(2);
        assertThat(row.getChildren().get(0).attr(DocNode.ATTR_GRID_COL)).isEqualTo("0");
        assertThat(row.getChildren().get(0).attr(DocNode.ATTR_GRID_SPAN)).isEqualTo("2");
        assertThat(row.getChildren().get(1).attr(DocNode.ATTR_GRID_COL)).isEqualTo("2");
    }

    @Test
    @DisplayName("should treat bare vMerge as continuation")
    void shouldMarkContinuation_whenVMergeHasNoValue() {
        String xml = document(table(new int[]{100}, tr(tcRestart("a")), tr(tcContinue())));

        DocNode table = normalize(xml).getChildren().get(0);

        assertThat(table.attr(DocNode.ATTR_GRID_WIDTHS)).isEqualTo("100");
        assertThat(table.getChildren().get(0).getChildren().get(0).attr(DocNode.ATTR_VMERGE)).isEqualTo("RESTART");
        assertThat(table.getChildren().get(1).getChildren().get(0).attr(DocNode.ATTR_VMERGE)).isEqualTo("CONTINUE");
    }

    @Test
    @DisplayName("should fold complex fields into one field node")
    void shouldFoldComplexField_whenBeginSeparateEnd() {
        String xml = document(p(null,
                "<w:r><w:fldChar w:fldCharType=\"begin\"/></w:r>",
                "<w:r><w:instrText xml:space=\"preserve\"> REF fig1 \\h </w:instrText></w:r>",
                "<w:r><w:fldChar w:fldCharType=\"separate\"/></w:r>",
                r("Figure 1"),
                "<w:r><w:fldChar w:fldCharType=\"end\"/></w:r>"));

        DocNode para = normalize(xml).getChildren().get(0);

        assertThat(para.getChildren()).hasSize(1);
        DocNode field = para.getChildren().get(0);
        assertThat(field.getType()).isEqualTo(NodeType.FIELD);
        assertThat(field.attr(DocNode.ATTR_INSTR)).isEqualTo("REF fig1 \\h");
        assertThat(field.plainText()).isEqualTo("Figure 1");
    }
}

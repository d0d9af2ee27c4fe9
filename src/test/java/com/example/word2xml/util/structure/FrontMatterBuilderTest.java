package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.WmlFixtures;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("FrontMatterBuilder")
class FrontMatterBuilderTest {

    private ConversionContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new ConversionContext("front-matter");
    }

    private static Element doc(String body) {
        return Jsoup.parse("<doc>" + body + "</doc>", "", Parser.xmlParser()).child(0);
    }

    @Test
    @DisplayName("should collect chapter label, title, authors, abstract and keywords")
    void shouldBuildChapterMeta_whenFrontMatterPresent() {
        // Given
        Element doc = doc("<p role=\"chapter-number\">Chapter 3</p>"
                + "<p role=\"chapter-title\"><bold>Growth</bold></p>"
                + "<p role=\"chapter-author\">Jane Smith and John Doe</p>"
                + "<p role=\"para\">Abstract</p>"
                + "<p role=\"para\">This chapter covers growth.</p>"
                + "<p role=\"para\">Keywords: growth, change, plants.</p>"
                + "<p role=\"para\">Body</p>");

        // When
        FrontMatterBuilder.FrontMatter fm = FrontMatterBuilder.extract(doc, WmlFixtures.labels(), ctx);

        // Then
        assertThat(ctx.getChapterNumber()).isEqualTo("3");
        Element meta = fm.getChapterMeta();
        assertThat(meta.select("title-group > label").text()).isEqualTo("Chapter 3");
        assertThat(meta.select("title-group > title").html()).isEqualTo("Growth");
        assertThat(meta.select("contrib-group > contrib")).hasSize(2);
        assertThat(meta.select("contrib surname")).extracting(Element::text).containsExactly("Smith", "Doe");
        assertThat(meta.select("contrib given-names")).extracting(Element::text).containsExactly("Jane", "John");
        assertThat(meta.select("abstract > title").text()).isEqualTo("Abstract");
        assertThat(meta.select("abstract > p").text()).isEqualTo("This chapter covers growth.");
        assertThat(meta.select("kwd-group > kwd")).extracting(Element::text).containsExactly("growth", "change", "plants");
        assertThat(doc.children()).hasSize(1);
        assertThat(doc.child(0).text()).isEqualTo("Body");
        assertThat(fm.getPartId()).isNull();
    }

    @Test
    @DisplayName("should use the digits of a free-form chapter label")
    void shouldFallBackToDigits_whenLabelNotRecognised() {
        Element doc = doc("<p role=\"chapter-number\">Unit 12</p>");

        FrontMatterBuilder.extract(doc, WmlFixtures.labels(), ctx);

        assertThat(ctx.getChapterNumber()).isEqualTo("12");
        assertThat(ctx.nextSectionId(1)).isEqualTo("ch12lev1sec1");
    }

    @Test
    @DisplayName("should build part metadata when the chapter opens a part")
    void shouldBuildPart_whenPartNumberPresent() {
        Element doc = doc("<p role=\"part-number\">Part 2</p><p role=\"part-title\">Plants</p>"
                + "<p role=\"para\">Body</p>");

        FrontMatterBuilder.FrontMatter fm = FrontMatterBuilder.extract(doc, WmlFixtures.labels(), ctx);

        assertThat(fm.getPartId()).isEqualTo("pt2");
        assertThat(fm.getPartMeta().select("label").text()).isEqualTo("Part 2");
        assertThat(fm.getPartMeta().select("title").text()).isEqualTo("Plants");
        assertThat(fm.getChapterMeta()).isNull();
        assertThat(ctx.getChapterNumber()).isEqualTo("1");
    }

    @Test
    @DisplayName("should treat the last word of each author as the surname")
    void shouldSplitContributors() {
        Element group = FrontMatterBuilder.contributors("A. Lee, B. Chan & Plato");

        assertThat(group.select("surname")).extracting(Element::text).containsExactly("Lee", "Chan", "Plato");
        assertThat(group.select("given-names")).extracting(Element::text).containsExactly("A.", "B.");
    }
}

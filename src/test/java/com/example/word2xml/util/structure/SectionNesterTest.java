package com.example.word2xml.util.structure;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.word2xml.util.ConversionContext;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SectionNester")
class SectionNesterTest {

    private static String heading(int level, String text) {
        return "<p role=\"heading\" level=\"" + level + "\">" + text + "</p>";
    }

    private static String para(String text) {
        return "<p role=\"para\">" + text + "</p>";
    }

    private static Element doc(String... blocks) {
        return Jsoup.parse("<doc>" + String.join("", blocks) + "</doc>", "", Parser.xmlParser()).child(0);
    }

    private static int level(Element sec) {
        return Integer.parseInt(sec.attr("disp-level").substring("level".length()));
    }

    @Test
    @DisplayName("should nest sections by heading level")
    void shouldNestSections_whenHeadingsDescend() {
        // Given
        Element doc = doc(para("intro"), heading(1, "<bold>A</bold>"), para("a"), heading(2, "A.1"), para("a1"),
                heading(1, "B"), para("b"));

        // When
        int created = SectionNester.nest(doc, new ConversionContext("sections"));

        // Then
        assertThat(created).isEqualTo(3);
        assertThat(doc.children()).extracting(Element::normalName).containsExactly("p", "sec", "sec");
        Element a = doc.child(1);
        assertThat(a.id()).isEqualTo("ch1lev1sec1");
        assertThat(a.child(0).normalName()).isEqualTo("title");
        assertThat(a.child(0).html()).isEqualTo("A");
        assertThat(a.select("> sec").first().id()).isEqualTo("ch1lev2sec2");
        assertThat(a.select("> sec > p").text()).isEqualTo("a1");
        assertThat(doc.child(2).id()).isEqualTo("ch1lev1sec3");
        assertThat(doc.child(2).select("> p").text()).isEqualTo("b");
    }

    @Test
    @DisplayName("should keep every child section deeper than its parent even when levels jump")
    void shouldProduceStrictTree_whenLevelsJump() {
        Element doc = doc(heading(1, "A"), heading(3, "A.x"), heading(2, "A.1"), heading(4, "A.1.x"),
                heading(2, "A.2"), heading(1, "B"), heading(3, "B.x"));

        ConversionContext ctx = new ConversionContext("sections");
        SectionNester.nest(doc, ctx);

        for (Element sec : doc.select("sec")) {
            Element parent = sec.parent();
            if ("sec".equals(parent.normalName())) {
                assertThat(level(sec)).isGreaterThan(level(parent));
            }
        }
        assertThat(doc.select("> sec")).hasSize(2);
        assertThat(doc.select("> sec").first().select("> sec")).extracting(el -> el.child(0).text())
                .containsExactly("A.x", "A.1", "A.2");
        assertThat(doc.select("p")).isEmpty();
        assertThat(ctx.getReport().getAnomalies()).hasSize(3);
    }

    @Test
    @DisplayName("should leave content untouched when there are no headings")
    void shouldDoNothing_whenNoHeadings() {
        Element doc = doc(para("one"), para("two"));

        int created = SectionNester.nest(doc, new ConversionContext("sections"));

        assertThat(created).isZero();
        assertThat(doc.children()).hasSize(2);
    }
}

package com.example.word2xml.service;

import static com.example.word2xml.util.WmlFixtures.document;
import static com.example.word2xml.util.WmlFixtures.p;
import static com.example.word2xml.util.WmlFixtures.r;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.word2xml.util.ConversionReport;
import com.example.word2xml.util.WmlFixtures;
import com.example.word2xml.util.WordToXmlConverter;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConversionService")
class ConversionServiceTest {

    @TempDir
    Path tempDir;

    private ConversionService service;

    @BeforeEach
    void setUp() {
        service = new ConversionService(new WordToXmlConverter(WmlFixtures.styleMap(), WmlFixtures.labels(), false));
    }

    private Path writeDocumentXml(String name, String xml) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, xml.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    @DisplayName("should write output next to the input when no output path is given")
    void shouldWriteBesideInput_whenOutputMissing() throws IOException {
        // Given
        Path input = writeDocumentXml("chapter.wml",
                document(p("Heading1", r("Intro")), p("Normal", r("Body text"))));

        // When
        ConversionReport report = service.convert(input, null);

        // Then
        Path output = tempDir.resolve("chapter.xml");
        assertThat(output).exists();
        String xml = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertThat(xml).startsWith(WordToXmlConverter.XML_DECLARATION);
        assertThat(report.getDocument()).isEqualTo("chapter");
        assertThat(report.getSectionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should create missing output directories")
    void shouldCreateParentDirectories() throws IOException {
        Path input = writeDocumentXml("document.xml", document(p("Normal", r("Body text"))));
        Path output = tempDir.resolve("out/nested/result.xml");

        service.convert(input, output);

        String xml = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertThat(xml).contains("<book").contains("Body text");
    }

    @Test
    @DisplayName("should convert docx packages")
    void shouldConvertDocx() throws IOException {
        Path docx = tempDir.resolve("lesson.docx");
        try (XWPFDocument doc = new XWPFDocument(); OutputStream out = Files.newOutputStream(docx)) {
            doc.createParagraph().createRun().setText("From a package");
            doc.write(out);
        }

        ConversionReport report = service.convert(docx, null);

        Path output = tempDir.resolve("lesson.xml");
        assertThat(output).exists();
        assertThat(new String(Files.readAllBytes(output), StandardCharsets.UTF_8)).contains("From a package");
        assertThat(report.getDocument()).isEqualTo("lesson");
    }

    @Test
    @DisplayName("should fail when the input does not exist")
    void shouldThrow_whenInputMissing() {
        assertThatThrownBy(() -> service.convert(tempDir.resolve("nope.docx"), null))
                .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    @DisplayName("should convert document.xml text in memory")
    void shouldConvertXmlInMemory() {
        WordToXmlConverter.Result result = service.convertXml("memory", document(p("Normal", r("In memory"))));

        assertThat(result.getXml()).contains("In memory");
        assertThat(result.getReport().getDocument()).isEqualTo("memory");
    }
}

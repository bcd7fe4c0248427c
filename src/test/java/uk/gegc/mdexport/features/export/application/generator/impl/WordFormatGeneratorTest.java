package uk.gegc.mdexport.features.export.application.generator.impl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.testsupport.ExportTestFixtures;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WordFormatGenerator Tests")
class WordFormatGeneratorTest {

    private WordFormatGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new WordFormatGenerator(ExportTestFixtures.generatorSupport());
    }

    @Test
    @DisplayName("generate: Office namespaces, .doc name and msword content type")
    void generate_wordEnvelope() {
        // When
        GeneratedDocument document = generator.generate(ExportTestFixtures.context(
                ExportTestFixtures.options(ExportFormat.WORD, "Quarterly Report"), "# Q3\n\nNumbers", RenderTarget.PRINT));

        // Then
        assertThat(document.filename()).isEqualTo("Quarterly_Report.doc");
        assertThat(document.contentType()).isEqualTo("application/msword");
        assertThat(document.markup()).contains("xmlns:w=\"urn:schemas-microsoft-com:office:word\"");
        assertThat(document.markup()).contains("<div class=\"Section1\">");
        assertThat(document.markup()).contains("<h1 id=\"q3\">Q3</h1>");
    }

    @Test
    @DisplayName("generate: body text is black on white for any theme")
    void generate_blackOnWhite() {
        // Given
        ExportOptions d = ExportTestFixtures.options(ExportFormat.WORD, "Report");
        ExportOptions options = new ExportOptions(d.format(), d.title(), d.author(), null, d.pageSize(),
                d.orientation(), 12, "Arial", "dark", false, false, true, null, null);

        // When
        String html = generator.generate(ExportTestFixtures.context(options, "text", RenderTarget.PRINT)).markup();

        // Then
        assertThat(html).contains("color:#000000;background-color:#ffffff;");
    }

    @Test
    @DisplayName("generate: tables get Word attributes and emoji are wrapped")
    void generate_tablesAndEmoji() {
        // Given
        String markdown = "| a | b |\n|---|---|\n| ✅ | 🚀 |";

        // When
        String html = generator.generate(ExportTestFixtures.context(
                ExportTestFixtures.options(ExportFormat.WORD, "Report"), markdown, RenderTarget.PRINT)).markup();

        // Then
        Document doc = Jsoup.parse(html);
        Element table = doc.selectFirst("table");
        assertThat(table).isNotNull();
        assertThat(table.attr("border")).isEqualTo("1");
        assertThat(table.attr("cellpadding")).isEqualTo("8");
        assertThat(doc.select("span.emoji-literal")).hasSize(1);
        assertThat(doc.select("span.emoji-preserve")).hasSize(1);
    }

    @Test
    @DisplayName("generate: watermark has no protection script")
    void generate_watermarkWithoutScript() {
        // Given
        ExportOptions d = ExportTestFixtures.options(ExportFormat.WORD, "Report");
        ExportOptions options = new ExportOptions(d.format(), d.title(), d.author(), null, d.pageSize(),
                d.orientation(), 12, "Arial", "default", false, false, true, "DRAFT", null);

        // When
        Document doc = Jsoup.parse(generator.generate(
                ExportTestFixtures.context(options, "text", RenderTarget.PRINT)).markup());

        // Then
        assertThat(doc.select(".wm-layer")).hasSize(7);
        assertThat(doc.select("script")).isEmpty();
    }

    @Test
    @DisplayName("cleanForWord: keeps heading ids and anchor links")
    void cleanForWord_keepsAnchors() {
        String cleaned = generator.cleanForWord("<h2 id=\"a\" onclick=\"x()\">A</h2><a href=\"#a\">go</a>");

        assertThat(cleaned).contains("<h2 id=\"a\">A</h2>").contains("<a href=\"#a\">go</a>");
    }
}

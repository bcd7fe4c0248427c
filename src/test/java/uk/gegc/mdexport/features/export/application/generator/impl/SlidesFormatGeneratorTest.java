package uk.gegc.mdexport.features.export.application.generator.impl;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mdexport.features.export.application.slides.SlideSegmenter;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;
import uk.gegc.mdexport.testsupport.ExportTestFixtures;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SlidesFormatGenerator Tests")
class SlidesFormatGeneratorTest {

    private SlidesFormatGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SlidesFormatGenerator(ExportTestFixtures.generatorSupport(), new SlideSegmenter());
    }

    @Test
    @DisplayName("generate: one slide per heading plus title and closing slides")
    void generate_slideCount() {
        // When
        GeneratedDocument document = generator.generate(ExportTestFixtures.context(
                ExportTestFixtures.options(ExportFormat.SLIDES, "Deck"),
                "# One\n\ntext\n\n## Two\n\n- a\n- b",
                RenderTarget.SCREEN));

        // Then
        Document doc = Jsoup.parse(document.markup());
        assertThat(doc.select("section.slide")).hasSize(4);
        assertThat(doc.select("section.title-slide.active h1").text()).isEqualTo("Deck");
        assertThat(doc.select("section.closing-slide")).hasSize(1);
        assertThat(doc.select("#total-slides").text()).isEqualTo("4");
        assertThat(doc.title()).isEqualTo("Deck - Presentation");
        assertThat(document.filename()).isEqualTo("Deck-presentation.html");
    }

    @Test
    @DisplayName("generate: navigation controls and script are included")
    void generate_navigation() {
        // When
        String html = generator.generate(ExportTestFixtures.context(
                ExportTestFixtures.options(ExportFormat.SLIDES, "Deck"), "plain text", RenderTarget.SCREEN)).markup();

        // Then
        Document doc = Jsoup.parse(html);
        assertThat(doc.select("button[data-action]")).hasSize(3);
        assertThat(doc.select("section.slide")).hasSize(3);
        assertThat(doc.select("script")).isNotEmpty();
    }

    @Test
    @DisplayName("gradient: uses host primary and accent when both are hex colors")
    void gradient_hostColors() {
        ThemeDescriptor host = new ThemeDescriptor("ocean", null, null, "#0ea5e9", "#22c55e", null, null);
        ThemeDescriptor invalid = new ThemeDescriptor("ocean", null, null, "var(--primary)", "#22c55e", null, null);

        assertThat(SlidesFormatGenerator.gradient(host)).isEqualTo("linear-gradient(135deg, #0ea5e9 0%, #22c55e 100%)");
        assertThat(SlidesFormatGenerator.gradient(invalid)).isEqualTo(SlidesFormatGenerator.DEFAULT_GRADIENT);
        assertThat(SlidesFormatGenerator.gradient(null)).isEqualTo(SlidesFormatGenerator.DEFAULT_GRADIENT);
    }
}

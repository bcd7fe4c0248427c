package uk.gegc.mdexport.features.export.application.generator.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.export.domain.model.PageOrientation;
import uk.gegc.mdexport.features.export.domain.model.PageSize;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.testsupport.ExportTestFixtures;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PrintFormatGenerator Tests")
class PrintFormatGeneratorTest {

    private PrintFormatGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new PrintFormatGenerator(ExportTestFixtures.generatorSupport());
    }

    @Test
    @DisplayName("generate: dark theme still prints black on white")
    void generate_darkTheme_blackOnWhite() {
        // Given
        ExportOptions options = withTheme(ExportTestFixtures.options(ExportFormat.PRINT, "Report"), "dark");

        // When
        String html = generator.generate(ExportTestFixtures.context(options, "# Hi", RenderTarget.PRINT)).markup();

        // Then
        assertThat(html).contains("color:#000000;background-color:#ffffff;");
    }

    @Test
    @DisplayName("generate: page rule follows size, orientation and page numbers")
    void generate_pageRule() {
        // Given
        ExportOptions options = new ExportOptions(ExportFormat.PRINT, "Report", "Me", null, PageSize.LETTER,
                PageOrientation.LANDSCAPE, 12, "Arial", "default", false, true, true, null, null);

        // When
        String html = generator.generate(ExportTestFixtures.context(options, "text", RenderTarget.PRINT)).markup();

        // Then
        assertThat(html).contains("@page{size:11in 8.5in;margin:1in;");
        assertThat(html).contains("counter(pages)");
    }

    @Test
    @DisplayName("generate: document opens the print dialog once loaded")
    void generate_printScript() {
        // When
        GeneratedDocument document = generator.generate(ExportTestFixtures.context(
                ExportTestFixtures.options(ExportFormat.PRINT, "Report"), "text", RenderTarget.PRINT));

        // Then
        assertThat(document.markup()).contains("window.print();").contains("}, 500);");
        assertThat(document.filename()).isEqualTo("Report.html");
    }

    @Test
    @DisplayName("generate: escaped title and author in the header")
    void generate_header() {
        // Given
        ExportOptions options = new ExportOptions(ExportFormat.PRINT, "R&D <plan>", "O'Neil", "Notes", PageSize.A4,
                PageOrientation.PORTRAIT, 12, "Arial", "default", false, false, true, null, null);

        // When
        String html = generator.generate(ExportTestFixtures.context(options, "text", RenderTarget.PRINT)).markup();

        // Then
        assertThat(html).contains("<div class=\"document-title\">R&amp;D &lt;plan&gt;</div>");
        assertThat(html).contains("<div class=\"document-author\">by O&#39;Neil</div>");
        assertThat(html).contains("<div class=\"document-description\">Notes</div>");
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "p{color:red}</style><script>alert(1)</script>",
            "p{color:red}</</stylestyle><script>alert(1)</script>",
            "p{color:red}</STYLE ><script>alert(1)</script>",
            "p{color:red}<!--</style><script>alert(1)</script>-->"
    })
    @DisplayName("generate: custom CSS cannot close the style element")
    void generate_customCss(String customCss) {
        // Given
        ExportOptions d = ExportTestFixtures.options(ExportFormat.PRINT, "Report");
        ExportOptions options = new ExportOptions(d.format(), d.title(), d.author(), null, d.pageSize(),
                d.orientation(), 12, "Arial", "default", false, false, true, null, customCss);

        // When
        String html = generator.generate(ExportTestFixtures.context(options, "text", RenderTarget.PRINT)).markup();

        // Then
        assertThat(html).contains("p{color:red}");
        assertThat(html).doesNotContain("<script>alert(1)");
        assertThat(html.toLowerCase()).containsOnlyOnce("</style");
    }

    private static ExportOptions withTheme(ExportOptions o, String theme) {
        return new ExportOptions(o.format(), o.title(), o.author(), o.description(), o.pageSize(), o.orientation(),
                o.fontSize(), o.fontFamily(), theme, o.includeToc(), o.includePageNumbers(), o.headerFooter(),
                o.watermarkText(), o.customCss());
    }
}

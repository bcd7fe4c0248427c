package uk.gegc.mdexport.features.export.application.generator;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import uk.gegc.mdexport.features.export.application.generator.impl.EbookFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.impl.PrintFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.impl.SlidesFormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.impl.WordFormatGenerator;
import uk.gegc.mdexport.features.export.application.slides.SlideSegmenter;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.testsupport.ExportTestFixtures;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Format generators: shared document guarantees")
class FormatGeneratorsTest {

    private static final String TITLE = "Q&A <i>Report</i> \"2025\"";
    private static final String AUTHOR = "Jane <b>Doe</b> & \"Co\"";

    static Stream<Arguments> generatorsAndHeaderFooter() {
        GeneratorSupport support = ExportTestFixtures.generatorSupport();
        List<FormatGenerator> generators = List.of(
                new PrintFormatGenerator(support),
                new WordFormatGenerator(support),
                new EbookFormatGenerator(support),
                new SlidesFormatGenerator(support, new SlideSegmenter())
        );
        return generators.stream()
                .flatMap(generator -> Stream.of(
                        Arguments.of(generator, true),
                        Arguments.of(generator, false)));
    }

    @ParameterizedTest(name = "{0} headerFooter={1}")
    @MethodSource("generatorsAndHeaderFooter")
    @DisplayName("generate: title and author always present and escaped")
    void generate_titleAndAuthorEscaped(FormatGenerator generator, boolean headerFooter) {
        // Given
        ExportFormat format = Stream.of(ExportFormat.values()).filter(generator::supports).findFirst().orElseThrow();
        ExportOptions d = ExportTestFixtures.options(format, TITLE);
        ExportOptions options = new ExportOptions(format, TITLE, AUTHOR, null, d.pageSize(), d.orientation(),
                12, "Arial", "default", true, true, headerFooter, null, null);

        // When
        String html = generator.generate(
                ExportTestFixtures.context(options, "# Heading\n\nSome text", generator.renderTarget())).markup();

        // Then
        Document doc = Jsoup.parse(html);
        assertThat(doc.title()).contains(TITLE);
        assertThat(doc.select("meta[name=author]").attr("content")).isEqualTo(AUTHOR);
        assertThat(doc.select("b, i")).isEmpty();
        assertThat(html).doesNotContain(TITLE).doesNotContain(AUTHOR);
    }
}

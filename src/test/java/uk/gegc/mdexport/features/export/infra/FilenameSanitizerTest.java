package uk.gegc.mdexport.features.export.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilenameSanitizer Tests")
class FilenameSanitizerTest {

    private final FilenameSanitizer sanitizer = new FilenameSanitizer();

    @Test
    @DisplayName("sanitize: strips reserved characters and appends the extension")
    void sanitize_reservedCharacters() {
        // When
        String result = sanitizer.sanitize("My/Report:2024", ".doc");

        // Then
        assertThat(result).doesNotContain("/").doesNotContain(":");
        assertThat(result).endsWith(".doc");
        assertThat(result).hasSizeLessThanOrEqualTo(104);
        assertThat(result).isEqualTo("MyReport2024.doc");
    }

    @Test
    @DisplayName("sanitize: whitespace becomes underscores")
    void sanitize_whitespace() {
        assertThat(sanitizer.sanitize("  Quarterly   plan  ", ".html")).isEqualTo("Quarterly_plan.html");
    }

    @Test
    @DisplayName("sanitize: long names are cut to 100 characters before the extension")
    void sanitize_truncates() {
        // When
        String result = sanitizer.sanitize("a".repeat(150), ".html");

        // Then
        assertThat(result).hasSize(FilenameSanitizer.MAX_BASE_LENGTH + ".html".length());
    }

    @Test
    @DisplayName("sanitize: empty results fall back to document")
    void sanitize_emptyFallback() {
        assertThat(sanitizer.sanitize("???", ".doc")).isEqualTo("document.doc");
        assertThat(sanitizer.sanitize(null, ".html")).isEqualTo("document.html");
    }

    @Test
    @DisplayName("sanitize: extension is not doubled")
    void sanitize_existingExtension() {
        assertThat(sanitizer.sanitize("notes.HTML", ".html")).isEqualTo("notes.HTML");
    }
}

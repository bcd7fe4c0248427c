package uk.gegc.mdexport.features.export.application;

import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mdexport.features.export.domain.exception.ExportErrorKind;
import uk.gegc.mdexport.features.export.domain.exception.ExportValidationException;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.PageOrientation;
import uk.gegc.mdexport.features.export.domain.model.PageSize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExportOptionsValidator Tests")
class ExportOptionsValidatorTest {

    private static ValidatorFactory factory;
    private static ExportOptionsValidator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = new ExportOptionsValidator(factory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("validate: defaults are valid")
    void validate_defaults_ok() {
        assertThatCode(() -> validator.validate(ExportOptions.defaults("Report"))).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("validate: font size 30 and empty title are reported together")
    void validate_multipleViolations_oneException() {
        // Given
        ExportOptions options = new ExportOptions(ExportFormat.EBOOK, "", "Author", null, PageSize.A4,
                PageOrientation.PORTRAIT, 30, "Arial", "default", true, true, true, null, null);

        // When / Then
        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(ExportValidationException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ExportErrorKind.VALIDATION);
                    assertThat(e.getViolations()).containsExactly(
                            "fontSize: must be between 8 and 24",
                            "title: must not be blank"
                    );
                });
    }

    @Test
    @DisplayName("validate: missing format, page size and orientation are rejected")
    void validate_missingEnums() {
        // Given
        ExportOptions options = new ExportOptions(null, "T", "A", null, null, null, 12,
                "Arial", "default", false, false, false, null, null);

        // When / Then
        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(ExportValidationException.class)
                .hasMessageContaining("format: is required")
                .hasMessageContaining("orientation: is required")
                .hasMessageContaining("pageSize: is required");
    }

    @Test
    @DisplayName("validate: null options are rejected")
    void validate_null() {
        assertThatThrownBy(() -> validator.validate(null))
                .isInstanceOf(ExportValidationException.class)
                .hasMessageContaining("options: must not be null");
    }
}

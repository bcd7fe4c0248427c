package uk.gegc.mdexport.features.export.domain.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Presentation options for a single export.
 * Validated by {@code ExportOptionsValidator}; all violations are reported together.
 */
public record ExportOptions(
    @NotNull(message = "is required")
    ExportFormat format,

    @NotBlank(message = "must not be blank")
    String title,

    @NotBlank(message = "must not be blank")
    String author,

    String description,

    @NotNull(message = "is required")
    PageSize pageSize,

    @NotNull(message = "is required")
    PageOrientation orientation,

    @Min(value = 8, message = "must be between 8 and 24")
    @Max(value = 24, message = "must be between 8 and 24")
    int fontSize,

    String fontFamily,
    String themeName,
    boolean includeToc,
    boolean includePageNumbers,
    boolean headerFooter,
    String watermarkText,
    String customCss
) {
    public static final String DEFAULT_AUTHOR = "Document Author";
    public static final String DEFAULT_FONT_FAMILY = "Arial";
    public static final int DEFAULT_FONT_SIZE = 12;

    public ExportOptions {
        description = description == null ? "" : description;
        customCss = customCss == null ? "" : customCss;
    }

    /**
     * Defaults used by the editor: print format, A4 portrait, 12pt Arial, default theme,
     * TOC, page numbers and header/footer on.
     */
    public static ExportOptions defaults(String title) {
        return new ExportOptions(
                ExportFormat.PRINT,
                title,
                DEFAULT_AUTHOR,
                "",
                PageSize.A4,
                PageOrientation.PORTRAIT,
                DEFAULT_FONT_SIZE,
                DEFAULT_FONT_FAMILY,
                "default",
                true,
                true,
                true,
                null,
                ""
        );
    }

    public boolean hasWatermark() {
        return watermarkText != null && !watermarkText.isBlank();
    }

    public boolean hasDescription() {
        return !description.isBlank();
    }

    public ExportOptions withFormat(ExportFormat newFormat) {
        return new ExportOptions(newFormat, title, author, description, pageSize, orientation, fontSize,
                fontFamily, themeName, includeToc, includePageNumbers, headerFooter, watermarkText, customCss);
    }
}

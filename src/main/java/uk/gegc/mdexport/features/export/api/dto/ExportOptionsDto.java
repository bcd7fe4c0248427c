package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.PageOrientation;
import uk.gegc.mdexport.features.export.domain.model.PageSize;

/**
 * Export options as sent by the editor. Every field is optional; missing values take the editor defaults.
 * Range checks happen in the export service so that all violations are reported together.
 */
@Schema(name = "ExportOptions", description = "Presentation options for one export")
public record ExportOptionsDto(
    @Schema(description = "Target format", example = "EBOOK")
    ExportFormat format,

    @Schema(description = "Document title; defaults to the file name without its .md extension")
    String title,

    @Schema(description = "Document author", example = "Document Author")
    String author,

    String description,

    @Schema(description = "Page size", example = "A4")
    PageSize pageSize,

    @Schema(description = "Page orientation", example = "PORTRAIT")
    PageOrientation orientation,

    @Schema(description = "Base font size in points, 8 to 24", example = "12")
    Integer fontSize,

    @Schema(description = "CSS font family", example = "Arial")
    String fontFamily,

    @Schema(description = "Theme name", example = "default")
    String theme,

    Boolean includeTableOfContents,
    Boolean includePageNumbers,
    Boolean headerFooter,

    @Schema(description = "Watermark text; blank disables the watermark")
    String watermark,

    @Schema(description = "Extra CSS appended to the document styles")
    String customCss
) {

    public ExportOptions toOptions(String defaultTitle) {
        ExportOptions defaults = ExportOptions.defaults(defaultTitle);
        return new ExportOptions(
                format != null ? format : defaults.format(),
                title != null ? title : defaults.title(),
                author != null ? author : defaults.author(),
                description,
                pageSize != null ? pageSize : defaults.pageSize(),
                orientation != null ? orientation : defaults.orientation(),
                fontSize != null ? fontSize : defaults.fontSize(),
                fontFamily != null ? fontFamily : defaults.fontFamily(),
                theme != null ? theme : defaults.themeName(),
                includeTableOfContents != null ? includeTableOfContents : defaults.includeToc(),
                includePageNumbers != null ? includePageNumbers : defaults.includePageNumbers(),
                headerFooter != null ? headerFooter : defaults.headerFooter(),
                watermark,
                customCss
        );
    }
}

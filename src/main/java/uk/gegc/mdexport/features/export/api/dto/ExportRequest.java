package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

import java.util.Locale;

@Schema(name = "ExportRequest", description = "Markdown document plus export options")
public record ExportRequest(
    @Schema(description = "Markdown source", example = "# Title\n\nHello **world**")
    @NotNull(message = "Markdown is required")
    String markdown,

    @Schema(description = "Name of the markdown file in the editor", example = "notes.md")
    String fileName,

    ExportOptionsDto options,
    ThemeDescriptorDto theme,
    EnvironmentDto environment
) {
    static final String MARKDOWN_EXTENSION = ".md";

    public ExportOptions toOptions() {
        ExportOptionsDto source = options != null ? options : emptyOptions();
        return source.toOptions(defaultTitle());
    }

    public ThemeDescriptor toDescriptor() {
        return theme != null ? theme.toDescriptor() : null;
    }

    public ThemeContext toDeclaredContext() {
        return environment != null ? environment.toContext() : ThemeContext.empty();
    }

    /**
     * File name without its {@code .md} extension, or an empty string.
     */
    String defaultTitle() {
        if (fileName == null) {
            return "";
        }
        String name = fileName.trim();
        if (name.toLowerCase(Locale.ROOT).endsWith(MARKDOWN_EXTENSION)) {
            name = name.substring(0, name.length() - MARKDOWN_EXTENSION.length());
        }
        return name;
    }

    private static ExportOptionsDto emptyOptions() {
        return new ExportOptionsDto(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }
}

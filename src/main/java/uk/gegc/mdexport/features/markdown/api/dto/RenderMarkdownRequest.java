package uk.gegc.mdexport.features.markdown.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(name = "RenderMarkdownRequest", description = "Markdown to convert to HTML")
public record RenderMarkdownRequest(
    @Schema(description = "Markdown source", example = "# Title\n\nHello **world**")
    @NotNull(message = "Markdown is required")
    String markdown,

    @Schema(description = "Prepend a table of contents built from the headings")
    Boolean includeToc
) {
    public boolean tocRequested() {
        return Boolean.TRUE.equals(includeToc);
    }
}

package uk.gegc.mdexport.features.markdown.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "RenderedMarkdownDto", description = "HTML produced from markdown, with outline and size figures")
public record RenderedMarkdownDto(
    @Schema(description = "HTML fragment")
    String html,

    @Schema(description = "Headings in document order")
    List<HeadingDto> headings,

    @Schema(description = "Word count of the source", example = "420")
    int wordCount,

    @Schema(description = "Estimated reading time in minutes", example = "3")
    int readingTimeMinutes,

    @Schema(description = "True when the simplified fallback converter produced the HTML")
    boolean degraded
) {
}

package uk.gegc.mdexport.features.markdown.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.mdexport.features.markdown.api.dto.HeadingDto;
import uk.gegc.mdexport.features.markdown.api.dto.RenderMarkdownRequest;
import uk.gegc.mdexport.features.markdown.api.dto.RenderedMarkdownDto;
import uk.gegc.mdexport.features.markdown.application.MarkdownConversionService;
import uk.gegc.mdexport.features.markdown.application.TableOfContentsBuilder;
import uk.gegc.mdexport.features.markdown.domain.ConvertedMarkdown;

@Tag(name = "Markdown", description = "Markdown to HTML conversion")
@RestController
@RequestMapping("/api/v1/markdown")
@RequiredArgsConstructor
@Validated
public class MarkdownController {

    private final MarkdownConversionService conversionService;
    private final TableOfContentsBuilder tocBuilder;

    @Operation(
            summary = "Render markdown",
            description = "Converts markdown to sanitized HTML. Raw HTML in the source is escaped. "
                    + "Falls back to a simplified converter if the full converter fails."
    )
    @PostMapping("/render")
    public ResponseEntity<RenderedMarkdownDto> render(@RequestBody @Valid RenderMarkdownRequest request) {
        ConvertedMarkdown converted = conversionService.convert(request.markdown());
        String html = request.tocRequested()
                ? tocBuilder.build(converted.metadata().headings()) + converted.html()
                : converted.html();

        return ResponseEntity.ok(new RenderedMarkdownDto(
                html,
                converted.metadata().headings().stream().map(HeadingDto::from).toList(),
                converted.metadata().wordCount(),
                converted.metadata().readingTimeMinutes(),
                converted.degraded()
        ));
    }
}

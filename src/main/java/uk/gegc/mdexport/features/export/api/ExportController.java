package uk.gegc.mdexport.features.export.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.mdexport.features.export.api.dto.ExportFormatOptionDto;
import uk.gegc.mdexport.features.export.api.dto.ExportRequest;
import uk.gegc.mdexport.features.export.api.dto.ThemeOptionDto;
import uk.gegc.mdexport.features.export.application.DocumentExportService;
import uk.gegc.mdexport.features.export.application.ExportCommand;
import uk.gegc.mdexport.features.export.application.ExportProgressListener;
import uk.gegc.mdexport.features.export.domain.model.ExportFile;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOutcome;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.mdexport.features.export.infra.ResponseExportHost;
import uk.gegc.mdexport.features.theme.application.ThemeCatalog;
import uk.gegc.mdexport.features.theme.infra.RequestThemeContextSource;

import java.io.ByteArrayInputStream;
import java.util.Arrays;
import java.util.List;

@Tag(name = "Exports", description = "Export markdown documents as print, Word, e-book or slide documents")
@RestController
@RequestMapping("/api/v1/exports")
@RequiredArgsConstructor
@Validated
public class ExportController {

    public static final String EXPORT_MESSAGE_HEADER = "X-Export-Message";

    private final DocumentExportService exportService;
    private final ExportMediaTypeResolver mediaTypeResolver;
    private final ThemeCatalog themeCatalog;

    @Operation(
            summary = "Export a markdown document",
            description = "PRINT answers the print window document inline; it opens the print dialog once loaded. "
                    + "WORD, EBOOK and SLIDES answer a file download. The success message is returned in the "
                    + EXPORT_MESSAGE_HEADER + " header."
    )
    @PostMapping
    public ResponseEntity<Resource> export(@RequestBody @Valid ExportRequest request, HttpServletRequest httpRequest) {
        ResponseExportHost host = new ResponseExportHost();
        ExportOutcome outcome = exportService.export(toCommand(request, httpRequest), host, ExportProgressListener.NONE);
        GeneratedDocument document = outcome.artifactOrThrow();

        if (outcome.format() == ExportFormat.PRINT) {
            return inline(document)
                    .header(EXPORT_MESSAGE_HEADER, outcome.message())
                    .body(new InputStreamResource(new ByteArrayInputStream(document.bytes())));
        }

        ExportFile exportFile = host.download().orElseGet(() -> ExportFile.of(document));
        InputStreamResource resource = new InputStreamResource(exportFile.contentSupplier().get());

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFile.contentType()))
                .contentLength(exportFile.contentLength())
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + exportFile.filename() + "\"")
                .header(EXPORT_MESSAGE_HEADER, outcome.message())
                .body(resource);
    }

    @Operation(
            summary = "Preview an export",
            description = "Generates the document for any format and answers it inline, without delivery."
    )
    @PostMapping("/preview")
    public ResponseEntity<Resource> preview(@RequestBody @Valid ExportRequest request, HttpServletRequest httpRequest) {
        GeneratedDocument document = exportService.preview(toCommand(request, httpRequest));
        return inline(document).body(new InputStreamResource(new ByteArrayInputStream(document.bytes())));
    }

    @Operation(summary = "List export formats")
    @GetMapping("/formats")
    public ResponseEntity<List<ExportFormatOptionDto>> formats() {
        List<ExportFormatOptionDto> formats = Arrays.stream(ExportFormat.values())
                .map(format -> new ExportFormatOptionDto(
                        format,
                        format.label(),
                        format.description(),
                        mediaTypeResolver.fileExtensionFor(format),
                        mediaTypeResolver.contentTypeFor(format)))
                .toList();
        return ResponseEntity.ok(formats);
    }

    @Operation(summary = "List export themes")
    @GetMapping("/themes")
    public ResponseEntity<List<ThemeOptionDto>> themes() {
        List<ThemeOptionDto> themes = themeCatalog.all().entrySet().stream()
                .map(entry -> ThemeOptionDto.from(entry.getKey(), entry.getValue()))
                .toList();
        return ResponseEntity.ok(themes);
    }

    private ExportCommand toCommand(ExportRequest request, HttpServletRequest httpRequest) {
        return new ExportCommand(
                request.markdown(),
                request.toOptions(),
                request.toDescriptor(),
                new RequestThemeContextSource(httpRequest, request.toDeclaredContext()).detect()
        );
    }

    private static ResponseEntity.BodyBuilder inline(GeneratedDocument document) {
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(document.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + document.filename() + "\"");
    }
}

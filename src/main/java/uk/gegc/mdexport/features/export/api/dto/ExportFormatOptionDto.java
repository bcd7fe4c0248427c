package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;

@Schema(name = "ExportFormatOption", description = "One selectable export format")
public record ExportFormatOptionDto(
    ExportFormat value,
    String label,
    String description,
    String extension,
    String contentType
) {
}

package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

@Schema(name = "ThemeDescriptor", description = "Theme of the host application")
public record ThemeDescriptorDto(
    @Schema(example = "dark") String id,
    @Schema(example = "#0f172a") String background,
    @Schema(example = "#e2e8f0") String text,
    @Schema(example = "#6366f1") String primary,
    @Schema(example = "#ec4899") String accent,
    String surface,
    String gradient
) {
    public ThemeDescriptor toDescriptor() {
        return new ThemeDescriptor(id, background, text, primary, accent, surface, gradient);
    }
}

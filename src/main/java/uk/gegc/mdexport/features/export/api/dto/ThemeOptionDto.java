package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mdexport.features.theme.domain.model.ThemeConfig;

@Schema(name = "ThemeOption", description = "One built-in export theme")
public record ThemeOptionDto(
    String value,
    String name,
    String primaryColor,
    String backgroundColor,
    String accentColor
) {
    public static ThemeOptionDto from(String value, ThemeConfig config) {
        return new ThemeOptionDto(value, config.name(), config.primaryColor(), config.backgroundColor(), config.accentColor());
    }
}

package uk.gegc.mdexport.features.export.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;

import java.util.List;
import java.util.Set;

@Schema(name = "Environment", description = "Dark/light signals observed by the client")
public record EnvironmentDto(
    @Schema(description = "Id of the active host theme")
    String hostThemeId,

    @Schema(description = "Value of the host document's data-theme attribute", example = "dark")
    String dataTheme,

    @Schema(description = "Classes on the host document body")
    List<String> bodyClasses,

    @Schema(description = "OS level prefers-color-scheme", example = "light")
    String prefersColorScheme,

    @Schema(description = "Stored user preference: dark, light or system", example = "system")
    String storedPreference
) {
    public ThemeContext toContext() {
        return new ThemeContext(
                hostThemeId,
                dataTheme,
                bodyClasses == null ? Set.of() : Set.copyOf(bodyClasses),
                prefersColorScheme,
                storedPreference
        );
    }
}

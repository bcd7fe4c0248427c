package uk.gegc.mdexport.features.theme.domain.model;

/**
 * Named export palette.
 *
 * @param name            display name
 * @param primaryColor    body text color
 * @param backgroundColor page background
 * @param accentColor     headings, links, borders and table headers
 */
public record ThemeConfig(
    String name,
    String primaryColor,
    String backgroundColor,
    String accentColor
) {
    public ThemeConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Theme name cannot be null or blank");
        }
        if (primaryColor == null || backgroundColor == null || accentColor == null) {
            throw new IllegalArgumentException("Theme colors cannot be null");
        }
    }
}

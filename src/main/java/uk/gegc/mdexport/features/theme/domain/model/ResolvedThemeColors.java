package uk.gegc.mdexport.features.theme.domain.model;

/**
 * Concrete colors handed to the format generators.
 */
public record ResolvedThemeColors(
    String titleColor,
    String bodyTextColor,
    String authorColor,
    String borderColor,
    String tableHeaderColor,
    String tableHeaderTextColor,
    String backgroundColor,
    String accentColor,
    boolean dark
) {
}

package uk.gegc.mdexport.features.theme.domain.model;

/**
 * Theme of the host application the export was triggered from.
 * Every field is optional; {@code gradient} is the host's own notation and is informational only.
 */
public record ThemeDescriptor(
    String id,
    String background,
    String text,
    String primary,
    String accent,
    String surface,
    String gradient
) {
    public boolean isDark() {
        return "dark".equalsIgnoreCase(id);
    }
}

package uk.gegc.mdexport.features.theme.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum ColorScheme {
    LIGHT,
    DARK;

    /**
     * Parses a host signal such as {@code "dark"} or {@code "light"}.
     * Anything else (including {@code "system"}) casts no vote.
     */
    public static Optional<ColorScheme> fromSignal(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "dark" -> Optional.of(DARK);
            case "light" -> Optional.of(LIGHT);
            default -> Optional.empty();
        };
    }
}

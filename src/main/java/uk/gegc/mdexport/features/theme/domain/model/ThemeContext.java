package uk.gegc.mdexport.features.theme.domain.model;

import java.util.Set;

/**
 * Detected signals describing the host environment.
 *
 * @param hostThemeId        id of the host application theme, if known
 * @param hostDataTheme      value of the host document's {@code data-theme} attribute
 * @param hostClasses        classes on the host document body
 * @param prefersColorScheme OS level {@code prefers-color-scheme}
 * @param storedPreference   preference stored by the user ({@code dark}, {@code light} or {@code system})
 */
public record ThemeContext(
    String hostThemeId,
    String hostDataTheme,
    Set<String> hostClasses,
    String prefersColorScheme,
    String storedPreference
) {
    public ThemeContext {
        hostClasses = hostClasses == null ? Set.of() : Set.copyOf(hostClasses);
    }

    public static ThemeContext empty() {
        return new ThemeContext(null, null, Set.of(), null, null);
    }
}

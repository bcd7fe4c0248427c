package uk.gegc.mdexport.features.theme.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.theme.domain.model.ColorScheme;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;
import uk.gegc.mdexport.features.theme.domain.model.ThemeConfig;
import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static uk.gegc.mdexport.features.theme.domain.util.ColorContrast.contrastRatio;
import static uk.gegc.mdexport.features.theme.domain.util.ColorContrast.luminance;

/**
 * Maps a theme name plus detected host signals to concrete colors.
 *
 * <p>Pure: the same inputs always give the same colors. All environment probing happens in
 * a {@link ThemeContextSource} before this class is called.
 *
 * <p>Dark/light precedence for {@link RenderTarget#SCREEN}, first vote wins:
 * <ol>
 *   <li>theme name {@code dark}</li>
 *   <li>theme background luminance below 0.5 (lighter backgrounds do not vote)</li>
 *   <li>host signals: descriptor id, {@code data-theme}, body classes</li>
 *   <li>OS {@code prefers-color-scheme}</li>
 *   <li>stored user preference</li>
 * </ol>
 * Nothing voting means light.
 */
@Component
@RequiredArgsConstructor
public class ThemeResolver {

    static final String BLACK = "#000000";
    static final String WHITE = "#ffffff";
    static final String DARK_SURFACE = "#1f2937";
    static final String LIGHT_TEXT_ON_DARK = "#e5e7eb";
    static final String MUTED_TEXT_ON_LIGHT = "#374151";
    static final String HIGH_CONTRAST_ACCENT_LIGHT = "#1d4ed8";
    static final String HIGH_CONTRAST_ACCENT_DARK = "#93c5fd";

    private static final double DARK_BACKGROUND_LUMINANCE = 0.5;
    private static final double MIN_TEXT_CONTRAST = 4.5;
    private static final double MIN_ACCENT_CONTRAST = 3.0;
    private static final Set<String> DARK_CLASSES = Set.of("dark", "theme-dark");
    private static final Set<String> LIGHT_CLASSES = Set.of("light", "theme-light");

    private final ThemeCatalog catalog;

    public ResolvedThemeColors resolve(String themeName,
                                       RenderTarget target,
                                       ThemeDescriptor descriptor,
                                       ThemeContext context) {
        ThemeConfig theme = catalog.find(themeName);
        if (target == RenderTarget.PRINT) {
            return resolveForPrint(theme);
        }
        ColorScheme scheme = decideScheme(themeName, theme, descriptor, context);
        return resolveForScreen(theme, scheme == ColorScheme.DARK);
    }

    public ColorScheme decideScheme(String themeName,
                                    ThemeConfig theme,
                                    ThemeDescriptor descriptor,
                                    ThemeContext context) {
        if (themeName != null && ThemeCatalog.DARK_THEME.equals(themeName.trim().toLowerCase(Locale.ROOT))) {
            return ColorScheme.DARK;
        }
        if (luminance(theme.backgroundColor()) < DARK_BACKGROUND_LUMINANCE) {
            return ColorScheme.DARK;
        }
        ThemeContext ctx = context != null ? context : ThemeContext.empty();
        return hostSignal(descriptor, ctx)
                .or(() -> ColorScheme.fromSignal(ctx.prefersColorScheme()))
                .or(() -> ColorScheme.fromSignal(ctx.storedPreference()))
                .orElse(ColorScheme.LIGHT);
    }

    private Optional<ColorScheme> hostSignal(ThemeDescriptor descriptor, ThemeContext ctx) {
        if (descriptor != null && descriptor.isDark()) {
            return Optional.of(ColorScheme.DARK);
        }
        if (ctx.hostThemeId() != null && ThemeCatalog.DARK_THEME.equalsIgnoreCase(ctx.hostThemeId().trim())) {
            return Optional.of(ColorScheme.DARK);
        }
        Optional<ColorScheme> dataTheme = ColorScheme.fromSignal(ctx.hostDataTheme());
        if (dataTheme.isPresent()) {
            return dataTheme;
        }
        return classVote(ctx.hostClasses());
    }

    /**
     * A dark class wins over a light class on the same body.
     */
    private static Optional<ColorScheme> classVote(Set<String> hostClasses) {
        Set<String> normalized = hostClasses.stream()
                .map(cls -> cls.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        if (normalized.stream().anyMatch(DARK_CLASSES::contains)) {
            return Optional.of(ColorScheme.DARK);
        }
        if (normalized.stream().anyMatch(LIGHT_CLASSES::contains)) {
            return Optional.of(ColorScheme.LIGHT);
        }
        return Optional.empty();
    }

    private ResolvedThemeColors resolveForPrint(ThemeConfig theme) {
        String accent = readableAccent(theme.accentColor(), WHITE, false);
        String author = readableText(theme.primaryColor(), WHITE, MUTED_TEXT_ON_LIGHT);
        return new ResolvedThemeColors(
                accent,
                BLACK,
                author,
                accent,
                accent,
                textOn(accent),
                WHITE,
                accent,
                false
        );
    }

    private ResolvedThemeColors resolveForScreen(ThemeConfig theme, boolean dark) {
        boolean themeBackgroundIsDark = luminance(theme.backgroundColor()) < DARK_BACKGROUND_LUMINANCE;
        String background;
        if (dark) {
            background = themeBackgroundIsDark ? theme.backgroundColor() : DARK_SURFACE;
        } else {
            background = themeBackgroundIsDark ? WHITE : theme.backgroundColor();
        }

        String body = readableText(theme.primaryColor(), background, dark ? LIGHT_TEXT_ON_DARK : BLACK);
        String author = dark
                ? readableText(LIGHT_TEXT_ON_DARK, background, WHITE)
                : readableText(theme.primaryColor(), background, MUTED_TEXT_ON_LIGHT);
        String accent = readableAccent(theme.accentColor(), background, dark);

        return new ResolvedThemeColors(
                accent,
                body,
                author,
                accent,
                accent,
                textOn(accent),
                background,
                accent,
                dark
        );
    }

    private static String readableText(String candidate, String background, String fallback) {
        return contrastRatio(candidate, background) >= MIN_TEXT_CONTRAST ? candidate : fallback;
    }

    private static String readableAccent(String accent, String background, boolean dark) {
        if (contrastRatio(accent, background) >= MIN_ACCENT_CONTRAST) {
            return accent;
        }
        return dark ? HIGH_CONTRAST_ACCENT_DARK : HIGH_CONTRAST_ACCENT_LIGHT;
    }

    private static String textOn(String background) {
        return contrastRatio(WHITE, background) >= contrastRatio(BLACK, background) ? WHITE : BLACK;
    }
}

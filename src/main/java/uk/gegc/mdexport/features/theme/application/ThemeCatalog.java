package uk.gegc.mdexport.features.theme.application;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.theme.domain.model.ThemeConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in export palettes, looked up by name with a {@code default} fallback.
 */
@Component
public class ThemeCatalog {

    public static final String DEFAULT_THEME = "default";
    public static final String DARK_THEME = "dark";

    private final Map<String, ThemeConfig> themes;

    public ThemeCatalog() {
        Map<String, ThemeConfig> map = new LinkedHashMap<>();
        map.put(DEFAULT_THEME, new ThemeConfig("Default", "#000000", "#ffffff", "#0066cc"));
        map.put("professional", new ThemeConfig("Professional", "#2c3e50", "#ffffff", "#3498db"));
        map.put("modern", new ThemeConfig("Modern", "#1a1a1a", "#fafafa", "#6366f1"));
        map.put("academic", new ThemeConfig("Academic", "#2d3748", "#ffffff", "#805ad5"));
        map.put(DARK_THEME, new ThemeConfig("Dark", "#e5e7eb", "#1f2937", "#60a5fa"));
        this.themes = Collections.unmodifiableMap(map);
    }

    public ThemeConfig find(String name) {
        if (name == null) {
            return themes.get(DEFAULT_THEME);
        }
        return themes.getOrDefault(normalize(name), themes.get(DEFAULT_THEME));
    }

    /**
     * Themes keyed by lookup name, in declaration order.
     */
    public Map<String, ThemeConfig> all() {
        return themes;
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}

package uk.gegc.mdexport.shared.util;

import java.util.regex.Pattern;

/**
 * Neutralises user-supplied values that end up inside a {@code <style>} block.
 */
public final class CssValues {

    private static final Pattern FONT_FAMILY_UNSAFE = Pattern.compile("[^A-Za-z0-9 \\-]");
    private static final String ESCAPED_LESS_THAN = "\\3C ";
    private static final String DEFAULT_FONT = "Arial";

    private CssValues() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Keeps letters, digits, spaces and dashes so the family can be quoted safely.
     */
    public static String fontFamily(String family) {
        if (family == null) {
            return DEFAULT_FONT;
        }
        String cleaned = FONT_FAMILY_UNSAFE.matcher(family).replaceAll("").trim();
        return cleaned.isEmpty() ? DEFAULT_FONT : cleaned;
    }

    /**
     * Custom CSS may not open or close any tag. Every {@code <} becomes the CSS escape {@code \3C },
     * which the HTML parser never reads as markup.
     */
    public static String customCss(String css) {
        if (css == null || css.isBlank()) {
            return "";
        }
        return css.replace("<", ESCAPED_LESS_THAN);
    }
}

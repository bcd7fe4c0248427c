package uk.gegc.mdexport.features.theme.domain.util;

import java.util.regex.Pattern;

/**
 * WCAG 2.x relative luminance and contrast ratio for hex colors.
 */
public final class ColorContrast {

    private static final Pattern HEX_COLOR = Pattern.compile("^#([0-9a-fA-F]{3}|[0-9a-fA-F]{6})$");

    private ColorContrast() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static boolean isHexColor(String value) {
        return value != null && HEX_COLOR.matcher(value.trim()).matches();
    }

    /**
     * Relative luminance in [0, 1].
     *
     * @throws IllegalArgumentException when the value is not {@code #rgb} or {@code #rrggbb}
     */
    public static double luminance(String hex) {
        int[] rgb = parse(hex);
        return 0.2126 * channel(rgb[0]) + 0.7152 * channel(rgb[1]) + 0.0722 * channel(rgb[2]);
    }

    /**
     * Contrast ratio in [1, 21].
     */
    public static double contrastRatio(String foreground, String background) {
        double l1 = luminance(foreground);
        double l2 = luminance(background);
        double lighter = Math.max(l1, l2);
        double darker = Math.min(l1, l2);
        return (lighter + 0.05) / (darker + 0.05);
    }

    private static double channel(int value) {
        double c = value / 255.0;
        return c <= 0.03928 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static int[] parse(String hex) {
        if (!isHexColor(hex)) {
            throw new IllegalArgumentException("Not a hex color: " + hex);
        }
        String digits = hex.trim().substring(1);
        if (digits.length() == 3) {
            digits = "" + digits.charAt(0) + digits.charAt(0)
                    + digits.charAt(1) + digits.charAt(1)
                    + digits.charAt(2) + digits.charAt(2);
        }
        return new int[]{
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16)
        };
    }
}

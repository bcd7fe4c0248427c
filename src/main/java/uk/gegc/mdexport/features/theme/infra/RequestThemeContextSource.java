package uk.gegc.mdexport.features.theme.infra;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import uk.gegc.mdexport.features.theme.application.ThemeContextSource;
import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;

/**
 * Reads theme signals for one HTTP request.
 * Values declared by the client win; the {@code Sec-CH-Prefers-Color-Scheme} client hint and the
 * {@code theme} cookie fill the gaps.
 */
public class RequestThemeContextSource implements ThemeContextSource {

    static final String PREFERS_COLOR_SCHEME_HEADER = "Sec-CH-Prefers-Color-Scheme";
    static final String STORED_PREFERENCE_COOKIE = "theme";

    private final HttpServletRequest request;
    private final ThemeContext declared;

    public RequestThemeContextSource(HttpServletRequest request, ThemeContext declared) {
        this.request = request;
        this.declared = declared != null ? declared : ThemeContext.empty();
    }

    @Override
    public ThemeContext detect() {
        String prefers = declared.prefersColorScheme();
        if (isBlank(prefers) && request != null) {
            prefers = unquote(request.getHeader(PREFERS_COLOR_SCHEME_HEADER));
        }
        String stored = declared.storedPreference();
        if (isBlank(stored)) {
            stored = cookieValue();
        }
        return new ThemeContext(
                declared.hostThemeId(),
                declared.hostDataTheme(),
                declared.hostClasses(),
                prefers,
                stored
        );
    }

    private String cookieValue() {
        if (request == null || request.getCookies() == null) {
            return null;
        }
        for (Cookie cookie : request.getCookies()) {
            if (STORED_PREFERENCE_COOKIE.equals(cookie.getName())) {
                return cookie.getValue();
            }
        }
        return null;
    }

    // Client hints are sent as structured-field strings: "dark"
    private static String unquote(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}

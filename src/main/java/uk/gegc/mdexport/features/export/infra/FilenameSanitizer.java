package uk.gegc.mdexport.features.export.infra;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns a user-supplied title into a file name that is safe on common file systems.
 */
@Component
public class FilenameSanitizer {

    static final int MAX_BASE_LENGTH = 100;
    static final String EMPTY_NAME = "document";

    private static final Pattern RESERVED = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_.\\-]");

    /**
     * @param name      base name, may be null
     * @param extension extension including the dot, e.g. {@code ".doc"}
     * @return sanitized name, at most 100 characters plus the extension
     */
    public String sanitize(String name, String extension) {
        String base = name == null ? "" : name.trim();
        base = RESERVED.matcher(base).replaceAll("");
        base = WHITESPACE.matcher(base).replaceAll("_");
        base = DISALLOWED.matcher(base).replaceAll("");
        if (base.length() > MAX_BASE_LENGTH) {
            base = base.substring(0, MAX_BASE_LENGTH);
        }
        if (base.isEmpty()) {
            base = EMPTY_NAME;
        }
        if (extension == null || extension.isEmpty()) {
            return base;
        }
        return base.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT))
                ? base
                : base + extension;
    }
}

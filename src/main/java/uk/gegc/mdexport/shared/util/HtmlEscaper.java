package uk.gegc.mdexport.shared.util;

/**
 * Escapes user-supplied text before it is interpolated into generated markup.
 */
public final class HtmlEscaper {

    private HtmlEscaper() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String escape(String s) {
        if (s == null) return "";
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;")
                .replace("'", "&#39;");
    }
}

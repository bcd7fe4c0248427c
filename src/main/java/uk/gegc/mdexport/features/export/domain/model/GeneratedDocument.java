package uk.gegc.mdexport.features.export.domain.model;

import java.nio.charset.StandardCharsets;

/**
 * A complete document produced by one generator call.
 */
public record GeneratedDocument(
    ExportFormat format,
    String filename,
    String contentType,
    String markup
) {
    public GeneratedDocument {
        if (format == null) {
            throw new IllegalArgumentException("Format cannot be null");
        }
        if (markup == null || markup.isEmpty()) {
            throw new IllegalArgumentException("Markup cannot be null or empty");
        }
    }

    public byte[] bytes() {
        return markup.getBytes(StandardCharsets.UTF_8);
    }
}

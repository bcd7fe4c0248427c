package uk.gegc.mdexport.features.export.domain.model;

import uk.gegc.mdexport.features.export.domain.exception.ExportException;

/**
 * Result of one export: the user-facing message plus either the artifact or the error.
 */
public record ExportOutcome(
    boolean success,
    ExportFormat format,
    String message,
    GeneratedDocument artifact,
    ExportException error
) {
    public static ExportOutcome succeeded(ExportFormat format, String message, GeneratedDocument artifact) {
        return new ExportOutcome(true, format, message, artifact, null);
    }

    public static ExportOutcome failed(ExportFormat format, ExportException error) {
        return new ExportOutcome(false, format, error.getMessage(), null, error);
    }

    /**
     * Returns the artifact of a successful export, or rethrows the recorded error.
     */
    public GeneratedDocument artifactOrThrow() {
        if (!success) {
            throw error;
        }
        return artifact;
    }
}

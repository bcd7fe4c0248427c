package uk.gegc.mdexport.features.export.domain.exception;

/**
 * Unexpected failure while assembling a document.
 */
public class GenerationException extends ExportException {

    public static final String GENERIC_MESSAGE = "Export failed. Please try again.";

    public GenerationException(String message, Throwable cause) {
        super(ExportErrorKind.GENERATION, message == null || message.isBlank() ? GENERIC_MESSAGE : message, cause);
    }

    public GenerationException(Throwable cause) {
        this(GENERIC_MESSAGE, cause);
    }
}

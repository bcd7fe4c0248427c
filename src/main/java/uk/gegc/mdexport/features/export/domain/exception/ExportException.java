package uk.gegc.mdexport.features.export.domain.exception;

/**
 * Base class of all export failures. The message is user-facing.
 */
public abstract class ExportException extends RuntimeException {

    private final ExportErrorKind kind;

    protected ExportException(ExportErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ExportException(ExportErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ExportErrorKind getKind() {
        return kind;
    }
}

package uk.gegc.mdexport.features.markdown.domain;

/**
 * Exception thrown when a markdown converter cannot process its input.
 */
public class MarkdownConversionException extends Exception {

    public MarkdownConversionException(String message) {
        super(message);
    }

    public MarkdownConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}

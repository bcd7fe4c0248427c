package uk.gegc.mdexport.features.export.domain.exception;

public class EmptyContentException extends ExportException {

    public EmptyContentException() {
        super(ExportErrorKind.EMPTY_CONTENT, "Document is empty. Add some content before exporting.");
    }
}

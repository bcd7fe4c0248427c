package uk.gegc.mdexport.features.export.domain.exception;

public enum ExportErrorKind {
    EMPTY_CONTENT,
    VALIDATION,
    POPUP_BLOCKED,
    GENERATION
}

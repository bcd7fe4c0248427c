package uk.gegc.mdexport.features.export.domain.model;

public enum SlideKind {
    TITLE,
    CONTENT
}

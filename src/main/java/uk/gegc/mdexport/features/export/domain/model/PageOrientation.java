package uk.gegc.mdexport.features.export.domain.model;

public enum PageOrientation {
    PORTRAIT,
    LANDSCAPE
}

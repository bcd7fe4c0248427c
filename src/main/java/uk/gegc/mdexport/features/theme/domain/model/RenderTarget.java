package uk.gegc.mdexport.features.theme.domain.model;

/**
 * Where the resolved colors will be looked at.
 */
public enum RenderTarget {
    /**
     * Paper or a word processor: always black text on white.
     */
    PRINT,

    /**
     * A browser or e-reader: honours dark/light signals.
     */
    SCREEN
}

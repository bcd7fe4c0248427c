package uk.gegc.mdexport.features.markdown.domain;

/**
 * Kind of a top-level markdown block.
 */
public enum BlockType {
    HEADING,
    PARAGRAPH,
    LIST,
    CODE,
    QUOTE,
    TABLE,
    RULE,
    HTML
}

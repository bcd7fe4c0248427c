package uk.gegc.mdexport.features.markdown.domain;

public record HeadingEntry(int level, String text, String id) {
}

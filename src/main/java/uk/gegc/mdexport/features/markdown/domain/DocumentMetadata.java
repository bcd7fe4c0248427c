package uk.gegc.mdexport.features.markdown.domain;

import java.util.List;

/**
 * Outline and size figures for a converted document.
 *
 * @param headings           headings in document order
 * @param wordCount          words in the markdown source, punctuation ignored
 * @param readingTimeMinutes {@code ceil(wordCount / wordsPerMinute)}
 */
public record DocumentMetadata(
    List<HeadingEntry> headings,
    int wordCount,
    int readingTimeMinutes
) {
    public DocumentMetadata {
        headings = headings == null ? List.of() : List.copyOf(headings);
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(List.of(), 0, 0);
    }
}

package uk.gegc.mdexport.features.export.domain.model;

import uk.gegc.mdexport.features.markdown.domain.ContentBlock;

import java.util.List;

/**
 * One slide of a deck. Title slides carry no content blocks.
 *
 * @param number  1-based position in the deck; the title slide is always 1
 * @param kind    title or content slide
 * @param title   never blank
 * @param content blocks shown under the title, in document order
 */
public record SlideRecord(
    int number,
    SlideKind kind,
    String title,
    List<ContentBlock> content
) {
    public SlideRecord {
        if (number < 1) {
            throw new IllegalArgumentException("Slide number must be positive");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Slide title cannot be null or blank");
        }
        content = content == null ? List.of() : List.copyOf(content);
    }
}

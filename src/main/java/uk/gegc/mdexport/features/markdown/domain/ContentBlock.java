package uk.gegc.mdexport.features.markdown.domain;

/**
 * One top-level block of converted markdown.
 *
 * @param type  block kind
 * @param level heading level (1-6) for {@link BlockType#HEADING}, otherwise 0
 * @param text  plain text content, used for slide titles and outlines
 * @param html  rendered HTML of the block
 */
public record ContentBlock(
    BlockType type,
    int level,
    String text,
    String html
) {
    public ContentBlock {
        if (type == null) {
            throw new IllegalArgumentException("Block type cannot be null");
        }
        if (type == BlockType.HEADING && (level < 1 || level > 6)) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6");
        }
        text = text == null ? "" : text;
        html = html == null ? "" : html;
    }

    public static ContentBlock heading(int level, String text, String html) {
        return new ContentBlock(BlockType.HEADING, level, text, html);
    }

    public static ContentBlock of(BlockType type, String text, String html) {
        return new ContentBlock(type, 0, text, html);
    }

    public boolean isHeading(int maxLevel) {
        return type == BlockType.HEADING && level <= maxLevel;
    }
}

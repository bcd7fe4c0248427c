package uk.gegc.mdexport.features.markdown.domain;

import java.util.List;

/**
 * Markdown converted for export.
 *
 * @param html     the full HTML fragment (all blocks joined)
 * @param blocks   top-level blocks in document order; the slide segmenter works on these
 * @param metadata headings, word count and reading time
 * @param degraded true when the regex fallback produced the output
 */
public record ConvertedMarkdown(
    String html,
    List<ContentBlock> blocks,
    DocumentMetadata metadata,
    boolean degraded
) {
    public ConvertedMarkdown {
        html = html == null ? "" : html;
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
    }
}

package uk.gegc.mdexport.features.markdown.domain;

import java.util.List;

/**
 * Raw output of a single {@code MarkdownConverter}.
 */
public record RenderedMarkdown(List<ContentBlock> blocks, List<HeadingEntry> headings) {

    public RenderedMarkdown {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        headings = headings == null ? List.of() : List.copyOf(headings);
    }
}

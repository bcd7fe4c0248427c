package uk.gegc.mdexport.features.markdown.domain;

/**
 * Converts markdown source into HTML blocks.
 * Implementations are tried in {@link org.springframework.core.annotation.Order} order
 * until one succeeds.
 */
public interface MarkdownConverter {

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Converts markdown to HTML blocks and collects the heading outline.
     *
     * @param markdown markdown source, never null
     * @return blocks and headings in document order
     * @throws MarkdownConversionException if the converter cannot process the input
     */
    RenderedMarkdown render(String markdown) throws MarkdownConversionException;
}

package uk.gegc.mdexport.features.markdown.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mdexport.features.markdown.config.MarkdownProperties;
import uk.gegc.mdexport.features.markdown.domain.ContentBlock;
import uk.gegc.mdexport.features.markdown.domain.ConvertedMarkdown;
import uk.gegc.mdexport.features.markdown.domain.DocumentMetadata;
import uk.gegc.mdexport.features.markdown.domain.MarkdownConversionException;
import uk.gegc.mdexport.features.markdown.domain.MarkdownConverter;
import uk.gegc.mdexport.features.markdown.domain.RenderedMarkdown;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts markdown to HTML using the first converter that succeeds.
 * Converters are injected in order, the full GFM converter first and the regex fallback last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MarkdownConversionService {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final List<MarkdownConverter> converters;
    private final MarkdownProperties properties;

    /**
     * Converts markdown to an HTML fragment with block structure and metadata.
     *
     * @param markdown markdown source; null is treated as empty
     * @return converted markdown
     * @throws IllegalStateException if no converter could process the input
     */
    public ConvertedMarkdown convert(String markdown) {
        String source = markdown == null ? "" : markdown;
        log.debug("Converting markdown ({} chars)", source.length());

        for (int i = 0; i < converters.size(); i++) {
            MarkdownConverter converter = converters.get(i);
            try {
                RenderedMarkdown rendered = converter.render(source);
                boolean degraded = i > 0;
                if (degraded) {
                    log.warn("Markdown converted with fallback converter '{}'", converter.name());
                }
                return assemble(source, rendered, degraded);
            } catch (MarkdownConversionException e) {
                log.warn("Markdown converter '{}' failed, trying next: {}", converter.name(), e.getMessage());
            }
        }
        throw new IllegalStateException("No markdown converter could process the document");
    }

    /**
     * Counts words the way the reading time estimate expects: punctuation is dropped,
     * then the text is split on whitespace.
     */
    public static int countWords(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            return 0;
        }
        String stripped = NON_WORD.matcher(markdown).replaceAll("").trim();
        if (stripped.isEmpty()) {
            return 0;
        }
        return (int) Arrays.stream(WHITESPACE.split(stripped))
                .filter(word -> !word.isEmpty())
                .count();
    }

    private ConvertedMarkdown assemble(String source, RenderedMarkdown rendered, boolean degraded) {
        String html = rendered.blocks().stream()
                .map(ContentBlock::html)
                .collect(Collectors.joining());
        int words = countWords(source);
        int minutes = (int) Math.ceil((double) words / properties.getWordsPerMinute());
        DocumentMetadata metadata = new DocumentMetadata(rendered.headings(), words, minutes);
        return new ConvertedMarkdown(html, rendered.blocks(), metadata, degraded);
    }
}

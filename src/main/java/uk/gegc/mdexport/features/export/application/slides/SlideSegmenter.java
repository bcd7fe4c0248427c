package uk.gegc.mdexport.features.export.application.slides;

import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.domain.model.SlideKind;
import uk.gegc.mdexport.features.export.domain.model.SlideRecord;
import uk.gegc.mdexport.features.markdown.domain.ContentBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits converted markdown into slides at level-1 and level-2 headings.
 *
 * <p>The first record is always a synthesized title slide. Blocks before the first
 * splitting heading are dropped. Without any splitting heading all blocks go to a
 * single {@value #CATCH_ALL_TITLE} slide.
 */
@Component
public class SlideSegmenter {

    static final int MAX_SPLIT_LEVEL = 2;
    static final String CATCH_ALL_TITLE = "Overview";

    public List<SlideRecord> toSlides(List<ContentBlock> blocks, String deckTitle) {
        List<SlideRecord> slides = new ArrayList<>();
        slides.add(new SlideRecord(1, SlideKind.TITLE, deckTitle, List.of()));

        List<ContentBlock> source = blocks == null ? List.of() : blocks;
        boolean anyHeading = source.stream().anyMatch(block -> block.isHeading(MAX_SPLIT_LEVEL));
        if (!anyHeading) {
            slides.add(new SlideRecord(2, SlideKind.CONTENT, CATCH_ALL_TITLE, source));
            return slides;
        }

        String currentTitle = null;
        List<ContentBlock> current = null;
        for (ContentBlock block : source) {
            if (block.isHeading(MAX_SPLIT_LEVEL)) {
                if (current != null) {
                    slides.add(contentSlide(slides.size() + 1, currentTitle, current));
                }
                currentTitle = block.text();
                current = new ArrayList<>();
            } else if (current != null) {
                current.add(block);
            }
        }
        slides.add(contentSlide(slides.size() + 1, currentTitle, current));
        return slides;
    }

    private static SlideRecord contentSlide(int number, String heading, List<ContentBlock> content) {
        String title = heading == null || heading.isBlank() ? "Slide " + number : heading.trim();
        return new SlideRecord(number, SlideKind.CONTENT, title, content);
    }
}

package uk.gegc.mdexport.features.export.application.generator;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.mdexport.features.export.application.emoji.EmojiPreservationEncoder;
import uk.gegc.mdexport.features.export.application.watermark.WatermarkInjector;
import uk.gegc.mdexport.features.export.config.ExportProperties;
import uk.gegc.mdexport.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.mdexport.features.export.infra.FilenameSanitizer;
import uk.gegc.mdexport.features.markdown.application.TableOfContentsBuilder;

/**
 * Collaborators shared by every format generator.
 */
@Component
@Getter
@RequiredArgsConstructor
public class GeneratorSupport {

    private final WatermarkInjector watermarkInjector;
    private final EmojiPreservationEncoder emojiEncoder;
    private final TableOfContentsBuilder tocBuilder;
    private final FilenameSanitizer filenameSanitizer;
    private final ExportMediaTypeResolver mediaTypeResolver;
    private final ExportProperties properties;
}

package uk.gegc.mdexport.features.export.application.generator;

import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.markdown.domain.ConvertedMarkdown;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;
import uk.gegc.mdexport.features.theme.domain.model.ThemeConfig;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

import java.time.ZonedDateTime;

/**
 * Everything a generator needs for one document.
 *
 * @param options      validated export options
 * @param content      converted markdown
 * @param theme        the named export theme
 * @param colors       colors resolved for the generator's render target
 * @param descriptor   host application theme, may be null
 * @param baseFileName unsanitized file name without extension
 * @param generatedAt  generation time from the application clock
 */
public record GenerationContext(
    ExportOptions options,
    ConvertedMarkdown content,
    ThemeConfig theme,
    ResolvedThemeColors colors,
    ThemeDescriptor descriptor,
    String baseFileName,
    ZonedDateTime generatedAt
) {
}

package uk.gegc.mdexport.features.export.application.generator;

import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.theme.domain.model.RenderTarget;

/**
 * SPI for turning converted markdown into one complete document of a single format.
 */
public interface FormatGenerator {

    boolean supports(ExportFormat format);

    /**
     * Target the theme colors must be resolved for.
     */
    RenderTarget renderTarget();

    String buildStyles(GenerationContext context);

    String buildHeader(GenerationContext context);

    String buildBody(GenerationContext context);

    String buildFooter(GenerationContext context);

    /**
     * Assembles the full document, including watermark layers when the options ask for them.
     */
    GeneratedDocument generate(GenerationContext context);
}

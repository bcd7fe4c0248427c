package uk.gegc.mdexport.features.export.application;

import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.theme.domain.model.ThemeContext;
import uk.gegc.mdexport.features.theme.domain.model.ThemeDescriptor;

/**
 * One export request.
 *
 * @param markdown     markdown source
 * @param options      export options, validated by the service
 * @param descriptor   host application theme, may be null
 * @param themeContext detected host environment, may be null
 */
public record ExportCommand(
    String markdown,
    ExportOptions options,
    ThemeDescriptor descriptor,
    ThemeContext themeContext
) {
    public ExportCommand {
        themeContext = themeContext == null ? ThemeContext.empty() : themeContext;
    }

    public ExportCommand withOptions(ExportOptions newOptions) {
        return new ExportCommand(markdown, newOptions, descriptor, themeContext);
    }
}

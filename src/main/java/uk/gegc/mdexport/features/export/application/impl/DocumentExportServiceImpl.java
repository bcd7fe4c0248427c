package uk.gegc.mdexport.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mdexport.features.export.application.DocumentExportService;
import uk.gegc.mdexport.features.export.application.ExportCommand;
import uk.gegc.mdexport.features.export.application.ExportHost;
import uk.gegc.mdexport.features.export.application.ExportMetricsService;
import uk.gegc.mdexport.features.export.application.ExportOptionsValidator;
import uk.gegc.mdexport.features.export.application.ExportProgressListener;
import uk.gegc.mdexport.features.export.application.ExportProgressTracker;
import uk.gegc.mdexport.features.export.application.generator.FormatGenerator;
import uk.gegc.mdexport.features.export.application.generator.GenerationContext;
import uk.gegc.mdexport.features.export.config.ExportProperties;
import uk.gegc.mdexport.features.export.domain.exception.EmptyContentException;
import uk.gegc.mdexport.features.export.domain.exception.ExportErrorKind;
import uk.gegc.mdexport.features.export.domain.exception.ExportException;
import uk.gegc.mdexport.features.export.domain.exception.GenerationException;
import uk.gegc.mdexport.features.export.domain.exception.PopupBlockedException;
import uk.gegc.mdexport.features.export.domain.model.ExportFile;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportOptions;
import uk.gegc.mdexport.features.export.domain.model.ExportOutcome;
import uk.gegc.mdexport.features.export.domain.model.ExportStage;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;
import uk.gegc.mdexport.features.export.domain.model.PrintJob;
import uk.gegc.mdexport.features.markdown.application.MarkdownConversionService;
import uk.gegc.mdexport.features.markdown.domain.ConvertedMarkdown;
import uk.gegc.mdexport.features.theme.application.ThemeCatalog;
import uk.gegc.mdexport.features.theme.application.ThemeResolver;
import uk.gegc.mdexport.features.theme.domain.model.ResolvedThemeColors;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentExportServiceImpl implements DocumentExportService {

    private final MarkdownConversionService conversionService;
    private final ThemeCatalog themeCatalog;
    private final ThemeResolver themeResolver;
    private final List<FormatGenerator> generators;
    private final ExportOptionsValidator optionsValidator;
    private final ExportMetricsService metricsService;
    private final ExportProperties properties;
    private final Clock clock;

    @Override
    public ExportOutcome export(ExportCommand command, ExportHost host, ExportProgressListener listener) {
        Instant startTime = clock.instant();
        ExportFormat format = command.options() != null ? command.options().format() : null;
        ExportProgressTracker progress = new ExportProgressTracker(format, listener);

        try {
            requireContent(command.markdown());
            optionsValidator.validate(command.options());

            progress.advance(ExportStage.INITIALIZING);
            ConvertedMarkdown content = conversionService.convert(command.markdown());
            progress.advance(ExportStage.PROCESSING);

            GeneratedDocument document = generate(command, content);
            progress.advance(ExportStage.GENERATING);

            if (format == ExportFormat.PRINT) {
                PrintJob job = new PrintJob(document, Duration.ofMillis(properties.getPrintSettleDelayMs()));
                if (!host.openPrintWindow(job)) {
                    throw new PopupBlockedException();
                }
                progress.advance(ExportStage.STYLING);
                progress.advance(ExportStage.FINALIZING);
            } else {
                progress.advance(ExportStage.FINALIZING);
                host.deliverDownload(ExportFile.of(document));
            }
            progress.advance(ExportStage.COMPLETE);

            long durationMs = Duration.between(startTime, clock.instant()).toMillis();
            metricsService.incrementCompleted(format);
            metricsService.recordDuration(format, durationMs);
            log.info("Document export completed: format={}, filename={}, bytes={}, degraded={}, durationMs={}",
                    format, document.filename(), document.bytes().length, content.degraded(), durationMs);

            return ExportOutcome.succeeded(format, format.successMessage(), document);
        } catch (ExportException e) {
            return failure(format, e);
        } catch (RuntimeException e) {
            return failure(format, new GenerationException(e));
        } finally {
            progress.reset();
        }
    }

    @Override
    public GeneratedDocument preview(ExportCommand command) {
        requireContent(command.markdown());
        optionsValidator.validate(command.options());
        try {
            return generate(command, conversionService.convert(command.markdown()));
        } catch (ExportException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Preview generation failed: format={}", command.options().format(), e);
            throw new GenerationException(e);
        }
    }

    private GeneratedDocument generate(ExportCommand command, ConvertedMarkdown content) {
        ExportOptions options = command.options();
        FormatGenerator generator = resolveGenerator(options.format());

        String themeName = options.themeName() != null && !options.themeName().isBlank()
                ? options.themeName()
                : properties.getDefaultTheme();
        ResolvedThemeColors colors = themeResolver.resolve(
                themeName, generator.renderTarget(), command.descriptor(), command.themeContext());
        String baseFileName = options.title() != null && !options.title().isBlank()
                ? options.title().trim()
                : properties.getFallbackFileName();

        GenerationContext context = new GenerationContext(
                options,
                content,
                themeCatalog.find(themeName),
                colors,
                command.descriptor(),
                baseFileName,
                ZonedDateTime.now(clock)
        );
        return generator.generate(context);
    }

    private FormatGenerator resolveGenerator(ExportFormat format) {
        return generators.stream()
                .filter(generator -> generator.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported export format: " + format));
    }

    private static void requireContent(String markdown) {
        if (markdown == null || markdown.isBlank()) {
            throw new EmptyContentException();
        }
    }

    private ExportOutcome failure(ExportFormat format, ExportException error) {
        if (error.getKind() == ExportErrorKind.GENERATION) {
            log.error("Document export failed: format={}", format, error.getCause() != null ? error.getCause() : error);
        } else {
            log.warn("Document export rejected: format={}, kind={}, reason={}", format, error.getKind(), error.getMessage());
        }
        metricsService.incrementFailed(format, error.getKind());
        return ExportOutcome.failed(format, error);
    }
}

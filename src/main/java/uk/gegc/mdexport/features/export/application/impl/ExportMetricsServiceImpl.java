package uk.gegc.mdexport.features.export.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.mdexport.features.export.application.ExportMetricsService;
import uk.gegc.mdexport.features.export.domain.exception.ExportErrorKind;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-backed export metrics, tagged by format.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportMetricsServiceImpl implements ExportMetricsService {

    static final String COMPLETED = "exports.completed";
    static final String FAILED = "exports.failed";
    static final String DURATION = "exports.duration";

    private final MeterRegistry meterRegistry;

    @Override
    public void incrementCompleted(ExportFormat format) {
        log.debug("METRIC: {} format={}", COMPLETED, format);
        Counter.builder(COMPLETED)
                .description("Number of exports delivered to the host")
                .tag("format", tagValue(format))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementFailed(ExportFormat format, ExportErrorKind kind) {
        log.debug("METRIC: {} format={} kind={}", FAILED, format, kind);
        Counter.builder(FAILED)
                .description("Number of exports that ended with an error")
                .tag("format", tagValue(format))
                .tag("kind", kind.name())
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordDuration(ExportFormat format, long durationMs) {
        Timer.builder(DURATION)
                .description("Time from request to delivered artifact")
                .tag("format", tagValue(format))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    private static String tagValue(ExportFormat format) {
        return format != null ? format.name() : "UNKNOWN";
    }
}

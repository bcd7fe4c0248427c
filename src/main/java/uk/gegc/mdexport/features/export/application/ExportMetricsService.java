package uk.gegc.mdexport.features.export.application;

import uk.gegc.mdexport.features.export.domain.exception.ExportErrorKind;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;

/**
 * Service for emitting export metrics.
 */
public interface ExportMetricsService {

    void incrementCompleted(ExportFormat format);

    void incrementFailed(ExportFormat format, ExportErrorKind kind);

    void recordDuration(ExportFormat format, long durationMs);
}

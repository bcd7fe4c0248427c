package uk.gegc.mdexport.features.export.application;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportStage;
import uk.gegc.mdexport.features.export.domain.model.ExportState;

/**
 * Progress of a single export call. Not shared between calls.
 */
@Slf4j
public class ExportProgressTracker {

    private final ExportFormat format;
    private final ExportProgressListener listener;
    private ExportState state = ExportState.IDLE;

    public ExportProgressTracker(ExportFormat format, ExportProgressListener listener) {
        this.format = format;
        this.listener = listener != null ? listener : ExportProgressListener.NONE;
    }

    public void advance(ExportStage stage) {
        if (state.exporting() && stage.progress() <= state.progress()) {
            throw new IllegalStateException("Export progress cannot move from " + state.progress() + " to " + stage.progress());
        }
        log.debug("Export progress: format={}, stage={}, progress={}", format, stage, stage.progress());
        publish(ExportState.at(stage));
    }

    /**
     * Returns to idle. No-op when no stage was reported.
     */
    public void reset() {
        if (state.exporting()) {
            publish(ExportState.IDLE);
        }
    }

    public ExportState current() {
        return state;
    }

    private void publish(ExportState next) {
        state = next;
        listener.onStateChanged(next);
    }
}

package uk.gegc.mdexport.features.export.domain.model;

/**
 * Busy flag and progress percentage observed by the host.
 */
public record ExportState(boolean exporting, int progress) {

    public static final ExportState IDLE = new ExportState(false, 0);

    public ExportState {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be between 0 and 100");
        }
    }

    public static ExportState at(ExportStage stage) {
        return new ExportState(true, stage.progress());
    }
}

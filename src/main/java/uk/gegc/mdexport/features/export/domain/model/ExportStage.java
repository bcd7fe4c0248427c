package uk.gegc.mdexport.features.export.domain.model;

/**
 * Progress milestones of one export. {@link #STYLING} is only reported for print.
 */
public enum ExportStage {
    INITIALIZING(10),
    PROCESSING(30),
    GENERATING(50),
    STYLING(70),
    FINALIZING(90),
    COMPLETE(100);

    private final int progress;

    ExportStage(int progress) {
        this.progress = progress;
    }

    public int progress() {
        return progress;
    }
}

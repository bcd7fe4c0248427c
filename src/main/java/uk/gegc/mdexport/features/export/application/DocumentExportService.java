package uk.gegc.mdexport.features.export.application;

import uk.gegc.mdexport.features.export.domain.model.ExportOutcome;
import uk.gegc.mdexport.features.export.domain.model.GeneratedDocument;

public interface DocumentExportService {

    /**
     * Runs one export and hands the result to the host.
     * Never throws for export failures; they are reported in the outcome and the
     * listener always ends in the idle state.
     */
    ExportOutcome export(ExportCommand command, ExportHost host, ExportProgressListener listener);

    /**
     * Validates and generates the document without progress tracking or delivery.
     */
    GeneratedDocument preview(ExportCommand command);
}

package uk.gegc.mdexport.features.export.application;

import uk.gegc.mdexport.features.export.domain.model.ExportFile;
import uk.gegc.mdexport.features.export.domain.model.PrintJob;

/**
 * The application an export is delivered to.
 */
public interface ExportHost {

    /**
     * Opens a window showing the print document.
     *
     * @return false when the window could not be opened, e.g. because pop-ups are blocked
     */
    boolean openPrintWindow(PrintJob job);

    /**
     * Hands a finished file to the user.
     */
    void deliverDownload(ExportFile file);
}

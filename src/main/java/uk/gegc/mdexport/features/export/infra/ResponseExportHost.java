package uk.gegc.mdexport.features.export.infra;

import uk.gegc.mdexport.features.export.application.ExportHost;
import uk.gegc.mdexport.features.export.domain.model.ExportFile;
import uk.gegc.mdexport.features.export.domain.model.PrintJob;

import java.util.Optional;

/**
 * Host for exports triggered over HTTP: the response body plays the part of the print window
 * or the download, so the print window always opens. One instance per request.
 */
public class ResponseExportHost implements ExportHost {

    private PrintJob printJob;
    private ExportFile download;

    @Override
    public boolean openPrintWindow(PrintJob job) {
        this.printJob = job;
        return true;
    }

    @Override
    public void deliverDownload(ExportFile file) {
        this.download = file;
    }

    public Optional<PrintJob> printJob() {
        return Optional.ofNullable(printJob);
    }

    public Optional<ExportFile> download() {
        return Optional.ofNullable(download);
    }
}

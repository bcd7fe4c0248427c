package uk.gegc.mdexport.features.export.domain.exception;

public class PopupBlockedException extends ExportException {

    public PopupBlockedException() {
        super(ExportErrorKind.POPUP_BLOCKED, "Print window could not be opened. Allow pop-ups for this site and try again.");
    }
}

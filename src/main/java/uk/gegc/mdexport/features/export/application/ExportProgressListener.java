package uk.gegc.mdexport.features.export.application;

import uk.gegc.mdexport.features.export.domain.model.ExportState;

@FunctionalInterface
public interface ExportProgressListener {

    ExportProgressListener NONE = state -> { };

    void onStateChanged(ExportState state);
}

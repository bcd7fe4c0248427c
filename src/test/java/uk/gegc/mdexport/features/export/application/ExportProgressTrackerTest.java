package uk.gegc.mdexport.features.export.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.mdexport.features.export.domain.model.ExportFormat;
import uk.gegc.mdexport.features.export.domain.model.ExportStage;
import uk.gegc.mdexport.features.export.domain.model.ExportState;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ExportProgressTracker Tests")
class ExportProgressTrackerTest {

    @Test
    @DisplayName("advance: publishes each stage and reset returns to idle")
    void advance_thenReset() {
        // Given
        List<ExportState> states = new ArrayList<>();
        ExportProgressTracker tracker = new ExportProgressTracker(ExportFormat.EBOOK, states::add);

        // When
        tracker.advance(ExportStage.INITIALIZING);
        tracker.advance(ExportStage.COMPLETE);
        tracker.reset();

        // Then
        assertThat(states).containsExactly(
                new ExportState(true, 10),
                new ExportState(true, 100),
                ExportState.IDLE
        );
        assertThat(tracker.current()).isEqualTo(ExportState.IDLE);
    }

    @Test
    @DisplayName("advance: going backwards is rejected")
    void advance_backwards_throws() {
        ExportProgressTracker tracker = new ExportProgressTracker(ExportFormat.PRINT, ExportProgressListener.NONE);
        tracker.advance(ExportStage.GENERATING);

        assertThatThrownBy(() -> tracker.advance(ExportStage.PROCESSING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("reset: does nothing when no stage was reported")
    void reset_idle_noEvent() {
        List<ExportState> states = new ArrayList<>();
        ExportProgressTracker tracker = new ExportProgressTracker(ExportFormat.WORD, states::add);

        tracker.reset();

        assertThat(states).isEmpty();
    }
}

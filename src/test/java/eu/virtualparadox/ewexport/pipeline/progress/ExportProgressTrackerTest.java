package eu.virtualparadox.ewexport.pipeline.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExportProgressTrackerTest {

    private ExportProgressTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ExportProgressTracker();
    }

    @Test
    void testIdle() {
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(0, 100));
    }

    @Test
    void testSingleBatch() {
        tracker.addBatch(4);
        tracker.step();

        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(25, 25));

        tracker.step();
        tracker.step();
        tracker.step();

        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(100, 100));
    }

    @Test
    void testQueuedBatches() {
        tracker.addBatch(2);
        tracker.addBatch(2);

        tracker.step();
        tracker.step();
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(50, 100));

        tracker.finishBatch();
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(50, 0));

        tracker.step();
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(75, 50));
    }

    @Test
    void testStepsBeyondBatchIgnored() {
        tracker.addBatch(1);
        tracker.addBatch(3);

        tracker.step();
        tracker.step();
        tracker.finishBatch();

        // the second batch starts untouched
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(25, 0));
    }

    @Test
    void testFinishBatchEarly() {
        tracker.addBatch(5);
        tracker.addBatch(5);
        tracker.step();

        tracker.finishBatch();

        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(50, 0));
    }

    @Test
    void testEmptyBatch() {
        tracker.addBatch(0);
        tracker.step();

        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(0, 100));
    }

    @Test
    void testEmptyBatchFollowedByBatch() {
        tracker.addBatch(0);
        tracker.addBatch(5);

        tracker.finishBatch();
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(0, 0));

        tracker.step();
        assertThat(tracker.getProgressStatus()).isEqualTo(new ProgressStatus(20, 20));
    }

    @Test
    void testNegativeBatch() {
        assertThatThrownBy(() -> tracker.addBatch(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCallback() {
        final List<String> events = new ArrayList<>();
        tracker.setProgressCallback((total, batch) -> events.add(total + "/" + batch));

        tracker.addBatch(2);
        tracker.step();
        tracker.step();
        tracker.finishBatch();

        assertThat(events).containsExactly("50/50", "100/100", "100/100");
    }
}

package eu.virtualparadox.ewexport.pipeline.progress;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedList;
import java.util.Queue;
import java.util.function.BiConsumer;

/**
 * Tracks export progress across all queued batches and within the running batch.
 *
 * Batches are registered when they are submitted, advanced one song at a time by the export worker
 * and closed by the worker when the job ends.
 */
@Service
@Slf4j
public class ExportProgressTracker {

    /**
     * Batches waiting behind the current one, represented by their song counts.
     */
    private final Queue<Integer> batchQueue = new LinkedList<>();

    /**
     * Total number of songs across all registered batches.
     */
    private int totalSongs = 0;

    /**
     * Songs processed so far, across all batches.
     */
    private int processedSongs = 0;

    private int currentBatchSongs = 0;
    private int currentBatchProcessed = 0;
    private boolean batchActive = false;

    /**
     * Optional callback: gets invoked after each step with (totalPercent, batchPercent).
     */
    @Setter
    private volatile BiConsumer<Integer, Integer> progressCallback;

    /**
     * Registers a batch. Every registered batch, empty ones included, is closed by exactly one
     * {@link #finishBatch()}.
     *
     * @param songCount the number of songs in the batch
     */
    public synchronized void addBatch(final int songCount) {
        if (songCount < 0) {
            throw new IllegalArgumentException("songCount must not be negative: " + songCount);
        }
        batchQueue.add(songCount);
        totalSongs += songCount;

        if (!batchActive) {
            startNextBatch();
        }

        log.info("Added batch with {} songs. Total songs to export: {}", songCount, totalSongs);
    }

    /**
     * Called when one song of the current batch is done, whatever its outcome.
     * Steps beyond the size of the batch are ignored.
     */
    public void step() {
        final ProgressStatus status;
        synchronized (this) {
            if (!batchActive || currentBatchProcessed >= currentBatchSongs) {
                return;
            }

            processedSongs++;
            currentBatchProcessed++;
            status = getProgressStatus();
        }
        fireProgressEvent(status);
    }

    /**
     * Closes the current batch, counting its unprocessed rest as done, and moves on to the next one.
     */
    public void finishBatch() {
        final ProgressStatus status;
        synchronized (this) {
            if (!batchActive) {
                return;
            }
            processedSongs += currentBatchSongs - currentBatchProcessed;
            startNextBatch();
            status = getProgressStatus();
        }
        fireProgressEvent(status);
    }

    public synchronized ProgressStatus getProgressStatus() {
        final int totalPercent =
                totalSongs == 0 ? 0 : (int) ((processedSongs * 100L) / totalSongs);

        final int batchPercent = !batchActive || currentBatchSongs == 0
                ? 100
                : (int) ((currentBatchProcessed * 100L) / currentBatchSongs);

        return new ProgressStatus(totalPercent, batchPercent);
    }

    private void startNextBatch() {
        currentBatchProcessed = 0;
        batchActive = !batchQueue.isEmpty();
        currentBatchSongs = batchActive ? batchQueue.poll() : 0;
    }

    private void fireProgressEvent(final ProgressStatus status) {
        final BiConsumer<Integer, Integer> callback = progressCallback;
        if (callback == null) {
            return;
        }
        callback.accept(status.totalPercent(), status.batchPercent());
    }
}

package eu.virtualparadox.ewexport.pipeline.progress;

/**
 * Progress status of the export queue.
 *
 * @param totalPercent Overall progress percentage over all queued batches (0-100)
 * @param batchPercent Progress percentage for the current batch (0-100)
 */
public record ProgressStatus(int totalPercent, int batchPercent) {

}

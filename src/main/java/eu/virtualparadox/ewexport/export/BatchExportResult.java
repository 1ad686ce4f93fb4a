package eu.virtualparadox.ewexport.export;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch export.
 *
 * @param successes written files, in export order
 * @param failures  one message per failed song
 * @param skipped   one message per song left out on purpose (no lyrics, existing file kept)
 * @param cancelled the batch stopped before all songs were processed
 */
public record BatchExportResult(List<Path> successes,
                                List<String> failures,
                                List<String> skipped,
                                boolean cancelled) {

    public static final int SUMMARY_FAILURE_LIMIT = 5;

    public BatchExportResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
        skipped = List.copyOf(skipped);
    }

    /**
     * Adds songs that were skipped before reaching the exporter.
     */
    public BatchExportResult withSkipped(final List<String> additionallySkipped) {
        final List<String> merged = new ArrayList<>(additionallySkipped);
        merged.addAll(skipped);
        return new BatchExportResult(successes, failures, merged, cancelled);
    }

    /**
     * Short human readable report: counts plus the first few failure messages.
     */
    public String summary() {
        final StringBuilder sb = new StringBuilder();
        sb.append("Exported ").append(successes.size()).append(" song(s)");
        if (!failures.isEmpty()) {
            sb.append(", ").append(failures.size()).append(" failed");
        }
        if (!skipped.isEmpty()) {
            sb.append(", ").append(skipped.size()).append(" skipped");
        }
        if (cancelled) {
            sb.append(", cancelled");
        }
        failures.stream()
                .limit(SUMMARY_FAILURE_LIMIT)
                .forEach(failure -> sb.append('\n').append("- ").append(failure));
        if (failures.size() > SUMMARY_FAILURE_LIMIT) {
            sb.append('\n').append("... and ").append(failures.size() - SUMMARY_FAILURE_LIMIT).append(" more");
        }
        return sb.toString();
    }
}

package eu.virtualparadox.ewexport.export;

import java.nio.file.Path;

/**
 * Result of exporting one song.
 *
 * @param status  what happened
 * @param path    written file, {@code null} unless exported
 * @param message failure or skip reason, or the written path for successes
 */
public record ExportOutcome(EExportStatus status, Path path, String message) {

    public static ExportOutcome exported(final Path path) {
        return new ExportOutcome(EExportStatus.EXPORTED, path, path.toString());
    }

    public static ExportOutcome skipped(final String reason) {
        return new ExportOutcome(EExportStatus.SKIPPED, null, reason);
    }

    public static ExportOutcome failed(final String reason) {
        return new ExportOutcome(EExportStatus.FAILED, null, reason);
    }

    public boolean success() {
        return status == EExportStatus.EXPORTED;
    }
}

package eu.virtualparadox.ewexport.export;

/**
 * Receives batch progress. Called on the exporting thread after every song and once more
 * with {@link #COMPLETE_MESSAGE} when the batch ends.
 */
@FunctionalInterface
public interface ExportProgressListener {

    String COMPLETE_MESSAGE = "Export complete";

    ExportProgressListener NONE = (completed, total, currentTitle) -> {
        // no listener registered
    };

    void onProgress(final int completed, final int total, final String currentTitle);

}

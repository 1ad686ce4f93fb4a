package eu.virtualparadox.ewexport.export;

import java.nio.file.FileSystemException;
import java.nio.file.InvalidPathException;

/**
 * Turns file write errors into messages for the batch report.
 */
public final class WriteErrorClassifier {

    public static final String INVALID_FILENAME_MESSAGE =
            "Invalid characters in filename; the song title contains characters the file system does not accept";

    private static final String INVALID_ARGUMENT = "Invalid argument";

    private WriteErrorClassifier() {
        // static only
    }

    /**
     * @return a friendly message for invalid file names, the raw error text otherwise
     */
    public static String describe(final Exception e) {
        if (isInvalidFilename(e)) {
            return INVALID_FILENAME_MESSAGE;
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public static boolean isInvalidFilename(final Exception e) {
        if (e instanceof InvalidPathException) {
            return true;
        }
        if (e instanceof FileSystemException fse) {
            final String reason = fse.getReason();
            return reason != null && reason.contains(INVALID_ARGUMENT);
        }
        return false;
    }
}

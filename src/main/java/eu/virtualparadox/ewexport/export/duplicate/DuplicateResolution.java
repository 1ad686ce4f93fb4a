package eu.virtualparadox.ewexport.export.duplicate;

import java.nio.file.Path;

/**
 * Where a song ends up after duplicate handling.
 *
 * @param target    file to write, {@code null} when the song is skipped or the batch cancelled
 * @param cancelled the remaining songs of the batch must not be exported
 */
public record DuplicateResolution(Path target, boolean cancelled) {

    private static final DuplicateResolution SKIP = new DuplicateResolution(null, false);
    private static final DuplicateResolution CANCEL = new DuplicateResolution(null, true);

    public static DuplicateResolution write(final Path target) {
        return new DuplicateResolution(target, false);
    }

    public static DuplicateResolution skip() {
        return SKIP;
    }

    public static DuplicateResolution cancel() {
        return CANCEL;
    }

    public boolean shouldWrite() {
        return target != null;
    }
}

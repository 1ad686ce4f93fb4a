package eu.virtualparadox.ewexport.pipeline;

import eu.virtualparadox.ewexport.export.ExportProgressListener;
import eu.virtualparadox.ewexport.export.duplicate.DuplicateResolver;
import eu.virtualparadox.ewexport.song.LyricSource;
import eu.virtualparadox.ewexport.song.SongRecord;
import eu.virtualparadox.ewexport.song.SongSource;

import java.nio.file.Path;
import java.util.List;

/**
 * A batch of songs to export.
 *
 * @param songs          songs in export order
 * @param lyricSource    where the raw RTF bodies come from
 * @param destinationDir output directory, {@code null} for the configured default
 * @param resolver       asked about existing files, may be {@code null}
 * @param listener       progress listener, may be {@code null}
 */
public record ExportRequest(List<SongRecord> songs,
                            LyricSource lyricSource,
                            Path destinationDir,
                            DuplicateResolver resolver,
                            ExportProgressListener listener) {

    public ExportRequest {
        if (lyricSource == null) {
            throw new IllegalArgumentException("lyricSource must not be null");
        }
        songs = List.copyOf(songs);
    }

    public static ExportRequest of(final List<SongRecord> songs, final LyricSource lyricSource, final Path destinationDir) {
        return new ExportRequest(songs, lyricSource, destinationDir, null, null);
    }

    /**
     * The whole catalog of {@code songSource}, in its title order.
     */
    public static ExportRequest allSongs(final SongSource songSource, final LyricSource lyricSource, final Path destinationDir) {
        return of(songSource.listSongs(), lyricSource, destinationDir);
    }
}

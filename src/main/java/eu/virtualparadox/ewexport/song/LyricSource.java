package eu.virtualparadox.ewexport.song;

import java.util.Optional;

/**
 * Read access to the raw RTF lyric bodies, keyed by song id.
 */
public interface LyricSource {

    Optional<String> findLyrics(final long songId);

}

package eu.virtualparadox.ewexport.song;

import java.util.List;

/**
 * Read access to the song catalog of an EasyWorship installation.
 */
public interface SongSource {

    /**
     * @return all songs ordered by title, case-insensitive
     */
    List<SongRecord> listSongs();

}

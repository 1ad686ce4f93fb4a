package eu.virtualparadox.ewexport.lyrics.section;

/**
 * One typed block of a song.
 *
 * @param type    canonical label, optionally with a number suffix, e.g. {@code "Verse 2"}
 * @param content lyric lines joined by {@code \n}, never blank
 */
public record Section(String type, String content) {

    public Section {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Section type must not be blank");
        }
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Section content must not be blank");
        }
    }
}

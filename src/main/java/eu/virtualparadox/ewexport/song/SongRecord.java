package eu.virtualparadox.ewexport.song;

import org.apache.commons.lang3.StringUtils;

/**
 * Song metadata as delivered by the song database.
 *
 * <p>Absent text fields are normalized to the empty string, so consumers never see {@code null}.</p>
 *
 * @param id              database row id of the song
 * @param title           song title, used for the output filename
 * @param author          author / artist credit
 * @param copyright       copyright holder
 * @param administrator   publisher or rights administrator
 * @param referenceNumber CCLI song number, empty when unknown
 * @param tags            free-form tags
 * @param description     notes carried into the document
 */
public record SongRecord(long id,
                         String title,
                         String author,
                         String copyright,
                         String administrator,
                         String referenceNumber,
                         String tags,
                         String description) {

    public SongRecord {
        title = StringUtils.defaultString(title);
        author = StringUtils.defaultString(author);
        copyright = StringUtils.defaultString(copyright);
        administrator = StringUtils.defaultString(administrator);
        referenceNumber = StringUtils.defaultString(referenceNumber);
        tags = StringUtils.defaultString(tags);
        description = StringUtils.defaultString(description);
    }

    public static SongRecord of(final long id, final String title) {
        return new SongRecord(id, title, "", "", "", "", "", "");
    }

    public boolean hasReferenceNumber() {
        return StringUtils.isNotBlank(referenceNumber);
    }
}

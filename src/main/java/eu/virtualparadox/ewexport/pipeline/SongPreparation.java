package eu.virtualparadox.ewexport.pipeline;

import eu.virtualparadox.ewexport.export.ExportItem;
import eu.virtualparadox.ewexport.lyrics.parser.EParseStatus;
import eu.virtualparadox.ewexport.lyrics.parser.ParseResult;
import eu.virtualparadox.ewexport.lyrics.section.DetectionResult;
import eu.virtualparadox.ewexport.song.SongRecord;

/**
 * One song run through parsing, cleaning and section detection.
 *
 * @param song        the song
 * @param parseResult outcome of the RTF reduction
 * @param cleanText   normalized text, empty when parsing produced nothing
 * @param detection   detected sections, empty when parsing produced nothing
 */
public record SongPreparation(SongRecord song,
                              ParseResult parseResult,
                              String cleanText,
                              DetectionResult detection) {

    static final String SKIP_NO_LYRICS = "'%s' has no lyrics";
    static final String SKIP_PARSE_FAILED = "'%s' could not be parsed: %s";

    public static SongPreparation notExportable(final SongRecord song, final ParseResult parseResult) {
        return new SongPreparation(song, parseResult, "", DetectionResult.empty());
    }

    public boolean isExportable() {
        return parseResult.hasContent() && !detection.sections().isEmpty();
    }

    public ExportItem toExportItem() {
        return new ExportItem(song, detection.sections());
    }

    /**
     * @return why the song is left out of an export, for the skipped list
     */
    public String skipReason() {
        if (parseResult.status() == EParseStatus.FAILED) {
            return String.format(SKIP_PARSE_FAILED, song.title(), parseResult.failureReason());
        }
        return String.format(SKIP_NO_LYRICS, song.title());
    }
}

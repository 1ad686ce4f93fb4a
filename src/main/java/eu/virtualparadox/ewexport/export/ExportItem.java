package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.lyrics.section.Section;
import eu.virtualparadox.ewexport.song.SongRecord;

import java.util.List;

/**
 * A song ready for export together with its detected sections.
 */
public record ExportItem(SongRecord song, List<Section> sections) {

    public ExportItem {
        sections = List.copyOf(sections);
    }
}

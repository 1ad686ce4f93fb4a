package eu.virtualparadox.ewexport.lyrics.section;

import java.util.List;

/**
 * Outcome of section detection.
 *
 * @param sections    sections in document order
 * @param hasSections whether real structure was found, as opposed to one implicit verse
 * @param totalLines  number of input lines scanned
 */
public record DetectionResult(List<Section> sections, boolean hasSections, int totalLines) {

    private static final DetectionResult EMPTY = new DetectionResult(List.of(), false, 0);

    public DetectionResult {
        sections = List.copyOf(sections);
    }

    public static DetectionResult empty() {
        return EMPTY;
    }

    public List<String> sectionTypes() {
        return sections.stream().map(Section::type).toList();
    }
}

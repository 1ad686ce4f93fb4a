package eu.virtualparadox.ewexport.lyrics.section;

import eu.virtualparadox.ewexport.lyrics.mapping.SectionLabelFormatter;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingTable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits cleaned lyric text into typed sections.
 *
 * <h2>Marker lines</h2>
 * A line is a marker when, trimmed and lowercased, it
 * <ul>
 *   <li>equals a mapping key ({@code "refräng"}),</li>
 *   <li>is a key followed by optional whitespace and a number ({@code "vers 2"}, {@code "vers2"}),</li>
 *   <li>or starts with a key followed by a colon ({@code "chorus:"}).</li>
 * </ul>
 * Keys are tried longest first. A marker closes the section being collected and opens a new one typed by
 * the mapped label; a number is rendered through the table's number format when numbers are preserved.
 * Text before the first marker becomes a {@code "verse"}. Sections without content are dropped.
 *
 * <h2>Repetition heuristics</h2>
 * In {@link ESectionDetectionMode#ADVANCED} mode, text without markers is split into blank-line separated
 * paragraphs. The paragraph repeated most often (at least twice) is the chorus; when several paragraphs
 * share the highest count, the one appearing first in the text wins. All other paragraphs are verses.
 *
 * <p>Stateless; the mapping table is passed per call.</p>
 */
@Component
@Slf4j
public class SectionDetector {

    public static final String DEFAULT_SECTION_TYPE = "verse";
    public static final String CHORUS_SECTION_TYPE = "chorus";

    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    public DetectionResult detectSections(final String text, final SectionMappingTable mappingTable) {
        return detectSections(text, mappingTable, ESectionDetectionMode.STANDARD);
    }

    /**
     * Detects sections.
     *
     * @param text         cleaned lyric text, may be {@code null}
     * @param mappingTable marker lexicon snapshot
     * @param mode         whether repetition heuristics may be used
     * @return sections in document order, empty for blank text
     */
    public DetectionResult detectSections(final String text,
                                          final SectionMappingTable mappingTable,
                                          final ESectionDetectionMode mode) {
        if (StringUtils.isBlank(text)) {
            return DetectionResult.empty();
        }

        final DetectionResult standard = detectByMarkers(text, mappingTable);
        if (mode != ESectionDetectionMode.ADVANCED || standard.hasSections()) {
            return standard;
        }

        log.debug("No section markers found, applying repetition heuristics");
        final List<Section> heuristic = detectByRepetition(text);
        if (heuristic.isEmpty()) {
            return standard;
        }

        log.debug("Found {} sections using repetition heuristics", heuristic.size());
        return new DetectionResult(heuristic, true, standard.totalLines());
    }

    private DetectionResult detectByMarkers(final String text, final SectionMappingTable mappingTable) {
        final String[] lines = text.split("\n", -1);
        final List<Section> sections = new ArrayList<>();
        final List<String> buffer = new ArrayList<>();
        String currentType = null;

        for (int i = 0; i < lines.length; i++) {
            final MarkerMatch marker = matchMarker(lines[i], mappingTable);
            if (marker != null) {
                flush(sections, currentType, buffer);
                currentType = sectionType(marker, mappingTable);
                buffer.clear();
                log.debug("Found section marker '{}' at line {}", currentType, i + 1);
            } else {
                buffer.add(lines[i]);
            }
        }
        flush(sections, currentType, buffer);

        if (sections.isEmpty()) {
            sections.add(new Section(DEFAULT_SECTION_TYPE, text.strip()));
            log.debug("No section markers found, treating as single verse");
        }

        final boolean hasSections = sections.size() > 1
                || !DEFAULT_SECTION_TYPE.equals(sections.get(0).type());
        return new DetectionResult(sections, hasSections, lines.length);
    }

    private List<Section> detectByRepetition(final String text) {
        final String[] paragraphs = text.split(PARAGRAPH_SEPARATOR, -1);
        if (paragraphs.length < 2) {
            return List.of();
        }

        // insertion order keeps the first-seen paragraph ahead on equal counts
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String paragraph : paragraphs) {
            final String clean = paragraph.strip();
            if (!clean.isEmpty()) {
                counts.merge(clean, 1, Integer::sum);
            }
        }

        String chorus = null;
        int chorusCount = 1;
        for (final Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > chorusCount) {
                chorus = entry.getKey();
                chorusCount = entry.getValue();
            }
        }

        final List<Section> sections = new ArrayList<>();
        for (final String paragraph : paragraphs) {
            final String clean = paragraph.strip();
            if (clean.isEmpty()) {
                continue;
            }
            final String type = clean.equals(chorus) ? CHORUS_SECTION_TYPE : DEFAULT_SECTION_TYPE;
            sections.add(new Section(type, clean));
        }
        return sections;
    }

    /**
     * Returns the marker a line represents, or {@code null} for ordinary lyric lines.
     */
    MarkerMatch matchMarker(final String line, final SectionMappingTable mappingTable) {
        final String clean = line.strip().toLowerCase(Locale.ROOT);
        if (clean.isEmpty()) {
            return null;
        }

        if (mappingTable.containsKey(clean)) {
            return new MarkerMatch(clean, null);
        }

        final String candidate = clean.endsWith(":") ? clean.substring(0, clean.length() - 1).strip() : clean;
        for (final String key : mappingTable.keysLongestFirst()) {
            if (!candidate.startsWith(key)) {
                continue;
            }
            final String remainder = candidate.substring(key.length()).strip();
            if (remainder.isEmpty()) {
                return new MarkerMatch(key, null);
            }
            if (StringUtils.isNumeric(remainder)) {
                return new MarkerMatch(key, remainder);
            }
        }

        for (final String key : mappingTable.keysLongestFirst()) {
            if (clean.startsWith(key + ":")) {
                final String remainder = clean.substring(key.length() + 1).strip();
                return new MarkerMatch(key, StringUtils.isNumeric(remainder) ? remainder : null);
            }
        }

        return null;
    }

    private String sectionType(final MarkerMatch marker, final SectionMappingTable mappingTable) {
        String label = mappingTable.lookup(marker.key).orElse("");
        if (label.isBlank()) {
            label = SectionLabelFormatter.titleCase(marker.key);
        }
        if (marker.hasNumber() && mappingTable.isPreserveNumbers()) {
            return mappingTable.formatNumbered(label, marker.number);
        }
        return label;
    }

    private void flush(final List<Section> sections, final String type, final List<String> buffer) {
        final String content = String.join("\n", buffer).strip();
        if (content.isEmpty()) {
            return;
        }
        sections.add(new Section(type != null ? type : DEFAULT_SECTION_TYPE, content));
    }
}

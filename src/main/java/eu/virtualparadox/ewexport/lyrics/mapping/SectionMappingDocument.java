package eu.virtualparadox.ewexport.lyrics.mapping;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * On-disk shape of the section mapping document.
 *
 * @param version            document version, informational
 * @param sectionMappings    source term to canonical label
 * @param numberMappingRules how numbers next to markers are rendered
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SectionMappingDocument(
        @JsonProperty("version") String version,
        @JsonProperty("section_mappings") Map<String, String> sectionMappings,
        @JsonProperty("number_mapping_rules") NumberRules numberMappingRules) {

    /**
     * @param preserveNumbers keep the number written next to a marker
     * @param format          template, e.g. {@code "{label} {number}"}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NumberRules(
            @JsonProperty("preserve_numbers") Boolean preserveNumbers,
            @JsonProperty("format") String format) {
    }

    public SectionMappingTable toTable() {
        final Map<String, String> mappings = sectionMappings != null ? sectionMappings : Map.of();
        final boolean preserve = numberMappingRules == null
                || numberMappingRules.preserveNumbers() == null
                || numberMappingRules.preserveNumbers();
        final String format = numberMappingRules != null ? numberMappingRules.format() : null;
        return new SectionMappingTable(mappings, preserve, format);
    }

    public static SectionMappingDocument fromTable(final String version, final SectionMappingTable table) {
        return new SectionMappingDocument(
                version,
                new LinkedHashMap<>(table.asMap()),
                new NumberRules(table.isPreserveNumbers(), table.getNumberFormat())
        );
    }
}

package eu.virtualparadox.ewexport.lyrics.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SectionMappingTableTest {

    @Test
    @DisplayName("Keys are normalized and looked up case-insensitively")
    void testLookup() {
        final SectionMappingTable table = SectionMappingTable.of(Map.of("  Refräng ", " Chorus "));

        assertThat(table.lookup("REFRÄNG")).contains("Chorus");
        assertThat(table.containsKey("refräng")).isTrue();
        assertThat(table.lookup("vers")).isEmpty();
        assertThat(table.lookup(null)).isEmpty();
    }

    @Test
    @DisplayName("The first of two colliding keys wins")
    void testFirstKeyWins() {
        final Map<String, String> mappings = new LinkedHashMap<>();
        mappings.put("Vers", "Verse");
        mappings.put("vers", "Strophe");

        final SectionMappingTable table = SectionMappingTable.of(mappings);

        assertThat(table.size()).isEqualTo(1);
        assertThat(table.lookup("vers")).contains("Verse");
    }

    @Test
    @DisplayName("Keys are offered longest first")
    void testKeysLongestFirst() {
        final SectionMappingTable table = SectionMappingTable.of(Map.of("pre", "Pre", "pre-chorus", "Pre-Chorus", "tag", "Tag"));

        assertThat(table.keysLongestFirst().get(0)).isEqualTo("pre-chorus");
        assertThat(table.keysLongestFirst()).hasSize(3);
    }

    @Test
    @DisplayName("Number format supports both label placeholders")
    void testFormatNumbered() {
        assertThat(SectionMappingTable.empty().formatNumbered("Verse", "2")).isEqualTo("Verse 2");
        assertThat(SectionMappingTable.empty().withNumberRules(true, "{section_name}-{number}")
                .formatNumbered("Verse", "3")).isEqualTo("Verse-3");
        assertThat(SectionMappingTable.empty().withNumberRules(true, "  ").getNumberFormat())
                .isEqualTo(SectionMappingTable.DEFAULT_NUMBER_FORMAT);
    }

    @Test
    @DisplayName("Merging keeps existing entries")
    void testWithMappings() {
        final SectionMappingTable table = SectionMappingTable.of(Map.of("vers", "Verse"));

        final SectionMappingTable merged = table.withMappings(Map.of("VERS", "Other", "brygga", "Bridge"));

        assertThat(merged.lookup("vers")).contains("Verse");
        assertThat(merged.lookup("brygga")).contains("Bridge");
        assertThat(table.size()).isEqualTo(1);
    }
}

package eu.virtualparadox.ewexport.lyrics.mapping;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Built-in section vocabularies for the languages EasyWorship libraries are commonly written in.
 *
 * <p>Source vocabularies map section words of one language to English labels. Target vocabularies
 * list the section names of a language, for building manual mappings towards a non-English target.</p>
 */
@Slf4j
public final class LanguageLexicon {

    public static final String ENGLISH = "english";

    private static final Map<String, Map<String, String>> SOURCE_MAPPINGS = new LinkedHashMap<>();
    private static final Map<String, List<String>> TARGET_SECTIONS = new LinkedHashMap<>();

    static {
        SOURCE_MAPPINGS.put("swedish", mappings(
                "vers", "Verse",
                "refräng", "Chorus",
                "refrang", "Chorus",
                "brygga", "Bridge",
                "bro", "Bridge",
                "förrefräng", "Pre-Chorus",
                "forrefrang", "Pre-Chorus",
                "stick", "Bridge",
                "outro", "Outro",
                "slut", "Outro",
                "intro", "Intro",
                "tag", "Tag",
                "ending", "Ending"));
        SOURCE_MAPPINGS.put("german", mappings(
                "strophe", "Verse",
                "vers", "Verse",
                "refrain", "Chorus",
                "brücke", "Bridge",
                "brucke", "Bridge",
                "vorrefrain", "Pre-Chorus",
                "intro", "Intro",
                "outro", "Outro",
                "schluss", "Ending",
                "tag", "Tag"));
        SOURCE_MAPPINGS.put("french", mappings(
                "couplet", "Verse",
                "refrain", "Chorus",
                "pont", "Bridge",
                "pré-refrain", "Pre-Chorus",
                "pre-refrain", "Pre-Chorus",
                "prérefrain", "Pre-Chorus",
                "intro", "Intro",
                "outro", "Outro",
                "final", "Ending",
                "tag", "Tag"));
        SOURCE_MAPPINGS.put("spanish", mappings(
                "verso", "Verse",
                "estrofa", "Verse",
                "coro", "Chorus",
                "estribillo", "Chorus",
                "puente", "Bridge",
                "pre-coro", "Pre-Chorus",
                "precoro", "Pre-Chorus",
                "intro", "Intro",
                "outro", "Outro",
                "final", "Ending",
                "tag", "Tag"));
        SOURCE_MAPPINGS.put("norwegian", mappings(
                "vers", "Verse",
                "refreng", "Chorus",
                "bro", "Bridge",
                "bru", "Bridge",
                "mellomspill", "Bridge",
                "intro", "Intro",
                "outro", "Outro",
                "slutt", "Ending",
                "tag", "Tag"));
        SOURCE_MAPPINGS.put("danish", mappings(
                "vers", "Verse",
                "omkvæd", "Chorus",
                "omkvaed", "Chorus",
                "bro", "Bridge",
                "mellemspil", "Bridge",
                "intro", "Intro",
                "outro", "Outro",
                "slutning", "Ending",
                "tag", "Tag"));
        SOURCE_MAPPINGS.put(ENGLISH, mappings(
                "verse", "Verse",
                "chorus", "Chorus",
                "bridge", "Bridge",
                "pre-chorus", "Pre-Chorus",
                "prechorus", "Pre-Chorus",
                "intro", "Intro",
                "outro", "Outro",
                "ending", "Ending",
                "tag", "Tag",
                "interlude", "Interlude",
                "vamp", "Vamp"));

        TARGET_SECTIONS.put(ENGLISH, List.of("Verse", "Chorus", "Bridge", "Pre-Chorus", "Intro", "Outro", "Tag", "Ending", "Interlude"));
        TARGET_SECTIONS.put("german", List.of("Strophe", "Refrain", "Brücke", "Vorrefrain", "Intro", "Outro", "Tag", "Schluss"));
        TARGET_SECTIONS.put("french", List.of("Couplet", "Refrain", "Pont", "Pré-refrain", "Intro", "Outro", "Tag", "Final"));
        TARGET_SECTIONS.put("spanish", List.of("Verso", "Coro", "Puente", "Pre-coro", "Intro", "Outro", "Tag", "Final"));
        TARGET_SECTIONS.put("swedish", List.of("Vers", "Refräng", "Brygga", "Förrefräng", "Intro", "Outro", "Tag", "Slut"));
        TARGET_SECTIONS.put("norwegian", List.of("Vers", "Refreng", "Bro", "Intro", "Outro", "Tag", "Slutt"));
        TARGET_SECTIONS.put("danish", List.of("Vers", "Omkvæd", "Bro", "Intro", "Outro", "Tag", "Slutning"));
    }

    private LanguageLexicon() {
        // static data only
    }

    public static Set<String> sourceLanguages() {
        return Collections.unmodifiableSet(SOURCE_MAPPINGS.keySet());
    }

    public static Set<String> targetLanguages() {
        return Collections.unmodifiableSet(TARGET_SECTIONS.keySet());
    }

    /**
     * @return the English mapping of one source language, empty for unknown languages
     */
    public static Map<String, String> sourceMappings(final String language) {
        return SOURCE_MAPPINGS.getOrDefault(normalize(language), Map.of());
    }

    /**
     * @return section names of a target language, empty for unknown languages
     */
    public static List<String> targetSections(final String language) {
        return TARGET_SECTIONS.getOrDefault(normalize(language), List.of());
    }

    /**
     * Merges the vocabularies of the given source languages into one mapping.
     * Languages earlier in the list win when two languages map the same word differently.
     * Only English targets can be populated automatically; other targets get an empty map.
     *
     * @param sourceLanguages languages the song library is written in
     * @param targetLanguage  language of the exported section names
     * @return lowercase source word to label, in merge order
     */
    public static Map<String, String> autoPopulate(final Collection<String> sourceLanguages,
                                                   final String targetLanguage) {
        if (!ENGLISH.equals(normalize(targetLanguage))) {
            log.info("Auto-populate only works for English target language, got {}", targetLanguage);
            return Map.of();
        }

        final Map<String, String> merged = new LinkedHashMap<>();
        for (final String language : sourceLanguages) {
            final Map<String, String> vocabulary = SOURCE_MAPPINGS.get(normalize(language));
            if (vocabulary == null) {
                log.warn("Unknown source language {} skipped", language);
                continue;
            }
            vocabulary.forEach((term, label) -> merged.putIfAbsent(term.toLowerCase(Locale.ROOT), label));
        }

        log.info("Auto-populated {} mappings from {}", merged.size(), sourceLanguages);
        return merged;
    }

    /**
     * Builds a ready to use table from the given source languages, English target.
     */
    public static SectionMappingTable tableFor(final Collection<String> sourceLanguages) {
        return SectionMappingTable.of(autoPopulate(sourceLanguages, ENGLISH));
    }

    /**
     * Checks a language selection against a mapping table.
     *
     * @return human readable problems, empty when the selection is usable
     */
    public static List<String> validate(final Collection<String> sourceLanguages,
                                        final String targetLanguage,
                                        final SectionMappingTable table) {
        final List<String> issues = new ArrayList<>();
        if (sourceLanguages.isEmpty()) {
            issues.add("No source languages selected");
        }
        if (targetLanguage == null || targetLanguage.isBlank()) {
            issues.add("No target language selected");
        } else if (!ENGLISH.equals(normalize(targetLanguage)) && table.isEmpty()) {
            issues.add("Non-English target requires manual mappings");
        }

        final Set<String> unmapped = new LinkedHashSet<>();
        for (final String language : sourceLanguages) {
            sourceMappings(language).keySet().stream()
                    .filter(term -> !table.containsKey(term))
                    .forEach(unmapped::add);
        }
        if (!unmapped.isEmpty()) {
            log.warn("Unmapped source terms: {}", unmapped);
        }
        return issues;
    }

    private static Map<String, String> mappings(final String... pairs) {
        final Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    private static String normalize(final String language) {
        return language == null ? "" : language.strip().toLowerCase(Locale.ROOT);
    }
}

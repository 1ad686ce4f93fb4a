package eu.virtualparadox.ewexport.lyrics.mapping;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the section marker lexicon.
 *
 * <p>Maps lowercase source terms ({@code "vers"}, {@code "refräng"}) to canonical labels
 * ({@code "Verse"}, {@code "Chorus"}). Keys are trimmed and lowercased on construction; when two keys
 * collide after lowercasing the first one wins. Lookups are case-insensitive.</p>
 *
 * <p>The number format template supports the placeholders {@code {label}} (alias
 * {@code {section_name}}) and {@code {number}}.</p>
 */
public final class SectionMappingTable {

    public static final String DEFAULT_NUMBER_FORMAT = "{label} {number}";

    private static final String LABEL_PLACEHOLDER = "{label}";
    private static final String LEGACY_LABEL_PLACEHOLDER = "{section_name}";
    private static final String NUMBER_PLACEHOLDER = "{number}";

    private final Map<String, String> mappings;
    private final boolean preserveNumbers;
    private final String numberFormat;
    private final List<String> keysLongestFirst;

    public SectionMappingTable(final Map<String, String> mappings,
                               final boolean preserveNumbers,
                               final String numberFormat) {
        final Map<String, String> normalized = new LinkedHashMap<>();
        mappings.forEach((key, value) -> {
            final String normalizedKey = normalizeKey(key);
            if (!normalizedKey.isEmpty()) {
                normalized.putIfAbsent(normalizedKey, StringUtils.defaultString(value).strip());
            }
        });

        this.mappings = Collections.unmodifiableMap(normalized);
        this.preserveNumbers = preserveNumbers;
        this.numberFormat = StringUtils.isBlank(numberFormat) ? DEFAULT_NUMBER_FORMAT : numberFormat;
        this.keysLongestFirst = normalized.keySet().stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    /**
     * Table with numbers preserved and the default number format.
     */
    public static SectionMappingTable of(final Map<String, String> mappings) {
        return new SectionMappingTable(mappings, true, DEFAULT_NUMBER_FORMAT);
    }

    public static SectionMappingTable empty() {
        return of(Map.of());
    }

    public Optional<String> lookup(final String term) {
        if (term == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mappings.get(normalizeKey(term)));
    }

    public boolean containsKey(final String term) {
        return lookup(term).isPresent();
    }

    /**
     * @return the mappings in insertion order, keys lowercased
     */
    public Map<String, String> asMap() {
        return mappings;
    }

    /**
     * Keys ordered by decreasing length, so that {@code "pre-chorus"} is tried before {@code "pre"}.
     */
    public List<String> keysLongestFirst() {
        return keysLongestFirst;
    }

    public boolean isPreserveNumbers() {
        return preserveNumbers;
    }

    public String getNumberFormat() {
        return numberFormat;
    }

    public int size() {
        return mappings.size();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    /**
     * Applies the number format template.
     *
     * @param label  canonical label, e.g. {@code "Verse"}
     * @param number number found next to the marker, e.g. {@code "2"}
     * @return e.g. {@code "Verse 2"}
     */
    public String formatNumbered(final String label, final String number) {
        return numberFormat
                .replace(LABEL_PLACEHOLDER, label)
                .replace(LEGACY_LABEL_PLACEHOLDER, label)
                .replace(NUMBER_PLACEHOLDER, number)
                .strip();
    }

    /**
     * Returns a new table with {@code additions} merged in. Existing entries win.
     */
    public SectionMappingTable withMappings(final Map<String, String> additions) {
        final Map<String, String> merged = new LinkedHashMap<>(mappings);
        additions.forEach((key, value) -> merged.putIfAbsent(normalizeKey(key), value));
        return new SectionMappingTable(merged, preserveNumbers, numberFormat);
    }

    /**
     * Returns a new table with the same mappings and different number rules.
     */
    public SectionMappingTable withNumberRules(final boolean preserveNumbers, final String numberFormat) {
        return new SectionMappingTable(mappings, preserveNumbers, numberFormat);
    }

    private static String normalizeKey(final String key) {
        return StringUtils.defaultString(key).strip().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "SectionMappingTable{" + mappings.size() + " mappings, preserveNumbers=" + preserveNumbers
                + ", numberFormat='" + numberFormat + "'}";
    }
}

package eu.virtualparadox.ewexport.lyrics.mapping;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Map;

/**
 * Display names for section types.
 */
public final class SectionLabelFormatter {

    private static final Map<String, String> CANONICAL_NAMES = Map.of(
            "verse", "Verse",
            "chorus", "Chorus",
            "refrain", "Chorus",
            "bridge", "Bridge",
            "pre-chorus", "Pre-Chorus",
            "intro", "Intro",
            "outro", "Outro",
            "ending", "Ending",
            "tag", "Tag",
            "interlude", "Interlude"
    );

    private SectionLabelFormatter() {
        // utility
    }

    /**
     * Canonical name for well known types, title case for everything else.
     * {@code "chorus"} gives {@code "Chorus"}, {@code "verse 2"} gives {@code "Verse 2"}.
     */
    public static String displayName(final String sectionType) {
        final String type = StringUtils.defaultString(sectionType).strip();
        final String canonical = CANONICAL_NAMES.get(type.toLowerCase(Locale.ROOT));
        return canonical != null ? canonical : titleCase(type);
    }

    /**
     * Upper-cases the first letter of every run of letters and lower-cases the rest.
     * Any non-letter starts a new word, so {@code "pre-chorus"} becomes {@code "Pre-Chorus"}.
     */
    public static String titleCase(final String text) {
        if (StringUtils.isEmpty(text)) {
            return StringUtils.defaultString(text);
        }

        final StringBuilder sb = new StringBuilder(text.length());
        boolean previousWasLetter = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousWasLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousWasLetter = true;
            } else {
                sb.append(c);
                previousWasLetter = false;
            }
        }
        return sb.toString();
    }
}

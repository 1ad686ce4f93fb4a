package eu.virtualparadox.ewexport.export;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Slide group colours keyed by section type, as {@code "r g b a"} with components in {@code [0, 1]}.
 */
public final class SectionColorPalette {

    public static final String DEFAULT_COLOR = "0 0 0 1";

    private static final String GRAY = "0.5 0.5 0.5 1";

    private static final Map<String, String> COLORS = Map.of(
            "verse", "0 0 1 1",
            "chorus", "1 0.2 0.2 1",
            "bridge", "0.4 0.7 1 1",
            "pre-chorus", "0.6 0.2 0.8 1",
            "intro", GRAY,
            "outro", GRAY,
            "ending", GRAY,
            "tag", "1 0.6 0 1",
            "interlude", "0 0.8 0 1"
    );

    private static final Pattern NUMBER_SUFFIX = Pattern.compile("\\s*\\d+$");

    private SectionColorPalette() {
        // static lookup only
    }

    /**
     * @param sectionType label such as {@code "Verse 2"} or {@code "chorus"}
     */
    public static String colorFor(final String sectionType) {
        if (sectionType == null) {
            return DEFAULT_COLOR;
        }
        final String base = NUMBER_SUFFIX.matcher(sectionType.strip()).replaceFirst("").toLowerCase(Locale.ROOT);
        return COLORS.getOrDefault(base, DEFAULT_COLOR);
    }
}

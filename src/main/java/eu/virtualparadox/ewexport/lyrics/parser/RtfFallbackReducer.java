package eu.virtualparadox.ewexport.lyrics.parser;

import java.util.regex.Pattern;

/**
 * Regex based RTF reduction used when {@link RtfTextStripper} rejects the markup.
 *
 * <p>Less precise than the tokenizer but never fails: it works on whatever survives of the
 * group structure. Unicode escapes are decoded before control words are stripped, otherwise the
 * escapes would be removed as ordinary control words.</p>
 */
final class RtfFallbackReducer {

    // placeholders for escaped literals, taken from the private use area
    private static final String BACKSLASH = "\uE000";
    private static final String OPEN_BRACE = "\uE001";
    private static final String CLOSE_BRACE = "\uE002";

    private static final Pattern HEADER = Pattern.compile("^\\s*\\{\\\\rtf\\d*\\s?");
    private static final Pattern FOOTER = Pattern.compile("}\\s*$");
    private static final Pattern PARAGRAPH = Pattern.compile("\\\\(?:par|line)(?![a-zA-Z])-?\\d*\\s?");
    private static final Pattern FONT_TABLE = Pattern.compile("\\{\\\\fonttbl[^}]*}");
    private static final Pattern COLOR_TABLE = Pattern.compile("\\{\\\\colortbl[^}]*}");
    private static final Pattern CONTROL_GROUP = Pattern.compile("\\{\\\\[^}]*}");
    private static final Pattern CONTROL_WORD = Pattern.compile("\\\\[a-zA-Z]+-?\\d*\\s?");
    private static final Pattern CONTROL_SYMBOL = Pattern.compile("\\\\[^a-zA-Z]");

    String reduce(final String rtf) {
        String text = rtf
                .replace("\\\\", BACKSLASH)
                .replace("\\{", OPEN_BRACE)
                .replace("\\}", CLOSE_BRACE);

        text = UnicodeEscapeDecoder.decodeEscapes(text);

        text = HEADER.matcher(text).replaceFirst("");
        text = FOOTER.matcher(text).replaceFirst("");
        text = PARAGRAPH.matcher(text).replaceAll("\n");
        text = FONT_TABLE.matcher(text).replaceAll("");
        text = COLOR_TABLE.matcher(text).replaceAll("");
        text = CONTROL_GROUP.matcher(text).replaceAll("");
        text = CONTROL_WORD.matcher(text).replaceAll("");
        text = CONTROL_SYMBOL.matcher(text).replaceAll("");
        text = text.replace("{", "").replace("}", "");

        return text
                .replace(OPEN_BRACE, "{")
                .replace(CLOSE_BRACE, "}")
                .replace(BACKSLASH, "\\");
    }
}

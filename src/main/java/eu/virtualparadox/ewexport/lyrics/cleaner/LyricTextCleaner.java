package eu.virtualparadox.ewexport.lyrics.cleaner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes plain lyric text before section detection.
 *
 * <p>The base pass removes RTF leftovers, substitutes control characters, normalizes whitespace and
 * line breaks, and straightens typographic punctuation. The song pass additionally strips chord
 * notation (on request) and repetition shorthand such as {@code (x2)}, spaces sentence punctuation,
 * tightens parentheses and capitalizes the first letter of every line.</p>
 *
 * <p>Passes are repeated until the text no longer changes, so cleaning an already cleaned text
 * returns it unchanged.</p>
 */
@Component
@Slf4j
public class LyricTextCleaner {

    private static final int MAX_PASSES = 10;

    private static final Pattern RTF_CONTROL_WORD = Pattern.compile("\\\\[a-z]+\\d*");
    private static final Pattern RTF_GROUP = Pattern.compile("\\{[^}]*}");
    private static final Pattern RTF_HEX_ESCAPE = Pattern.compile("\\\\'[0-9a-fA-F]{2}");

    private static final Pattern FORBIDDEN_CONTROL = Pattern.compile("[\\x00-\\x08\\x0E-\\x1F\\x7F]");
    private static final Pattern MULTIPLE_SPACES = Pattern.compile(" {2,}");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);

    /**
     * Chord grammar: root note, optional accidental, optional quality, optional extension.
     */
    private static final String CHORD = "\\[?[A-G][#b]?(?:maj|min|m|dim|aug|sus|add)?[0-9]*]?";
    private static final Pattern BRACKETED_CHORD = Pattern.compile("\\[" + CHORD + "]");
    private static final Pattern PARENTHESIZED_CHORD = Pattern.compile("\\(" + CHORD + "\\)");
    private static final Pattern LEADING_CHORD = Pattern.compile("^" + CHORD + "[ \\t]+", Pattern.MULTILINE);

    private static final Pattern REPETITION = Pattern.compile(
            "\\(x\\d+\\)|\\(\\d+x\\)|\\[x\\d+]|\\[\\d+x]|x\\d+$",
            Pattern.MULTILINE | Pattern.CASE_INSENSITIVE
    );

    private static final Pattern MISSING_SENTENCE_SPACE = Pattern.compile("([.!?])(\\p{L})");
    private static final Pattern SPACE_AFTER_OPEN_PAREN = Pattern.compile("\\([ \\t]+");
    private static final Pattern SPACE_BEFORE_CLOSE_PAREN = Pattern.compile("[ \\t]+\\)");

    /**
     * Cleans song lyrics without removing chords.
     */
    public String clean(final String text) {
        return clean(text, true, false);
    }

    /**
     * Cleans {@code text}.
     *
     * @param text         text to clean, may be {@code null}
     * @param forSong      apply the lyric specific transforms
     * @param removeChords strip chord notation, only honoured together with {@code forSong}
     * @return cleaned text, never {@code null}
     */
    public String clean(final String text, final boolean forSong, final boolean removeChords) {
        return cleanWithStats(text, forSong, removeChords).getCleanText();
    }

    public CleaningResult cleanWithStats(final String text, final boolean forSong, final boolean removeChords) {
        if (text == null || text.isEmpty()) {
            return new CleaningResult("", 0, 0);
        }

        String current = text;
        int passes = 0;
        while (passes < MAX_PASSES) {
            passes++;
            final String next = cleanOnce(current, forSong, removeChords);
            if (next.equals(current)) {
                break;
            }
            current = next;
        }

        final CleaningResult result = new CleaningResult(current, text.length(), passes);
        log.debug("Cleaned text from {} to {} characters in {} passes",
                result.getOriginalLength(), result.getCleanedLength(), result.getPasses());
        return result;
    }

    private String cleanOnce(final String input, final boolean forSong, final boolean removeChords) {
        String text = removeRtfArtifacts(input);
        text = replaceControlCharacters(text);
        text = normalizeWhitespace(text);
        text = cleanPunctuation(text);

        if (forSong) {
            if (removeChords) {
                text = removeChords(text);
            }
            text = REPETITION.matcher(text).replaceAll("");
            text = fixSongFormatting(text);
            text = normalizeWhitespace(text);
        }

        return text.strip();
    }

    private String removeRtfArtifacts(final String input) {
        String text = RTF_CONTROL_WORD.matcher(input).replaceAll("");
        text = RTF_GROUP.matcher(text).replaceAll("");
        text = RTF_HEX_ESCAPE.matcher(text).replaceAll("");
        return text
                .replace("\\{", "{")
                .replace("\\}", "}")
                .replace("\\\\", "\\");
    }

    private String replaceControlCharacters(final String input) {
        final String text = input
                .replace("\r\n", "\n")
                .replace('\r', '\n')
                .replace("\u0000", "")
                .replace('\u000B', '\n')
                .replace('\u000C', '\n')
                .replace('\u00A0', ' ')
                .replace('\u2028', '\n')
                .replace("\u2029", "\n\n");
        return FORBIDDEN_CONTROL.matcher(text).replaceAll("");
    }

    private String normalizeWhitespace(final String input) {
        String text = input.replace("\t", "  ");
        text = MULTIPLE_SPACES.matcher(text).replaceAll(" ");
        text = TRAILING_WHITESPACE.matcher(text).replaceAll("");
        return EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");
    }

    private String cleanPunctuation(final String input) {
        return input
                .replace('“', '"')
                .replace('”', '"')
                .replace('‘', '\'')
                .replace('’', '\'')
                .replace('–', '-')
                .replace('—', '-')
                .replace("…", "...");
    }

    private String removeChords(final String input) {
        String text = BRACKETED_CHORD.matcher(input).replaceAll("");
        text = PARENTHESIZED_CHORD.matcher(text).replaceAll("");
        return LEADING_CHORD.matcher(text).replaceAll("");
    }

    private String fixSongFormatting(final String input) {
        String text = MISSING_SENTENCE_SPACE.matcher(input).replaceAll("$1 $2");
        text = SPACE_AFTER_OPEN_PAREN.matcher(text).replaceAll("(");
        text = SPACE_BEFORE_CLOSE_PAREN.matcher(text).replaceAll(")");
        return capitalizeLines(text);
    }

    private String capitalizeLines(final String input) {
        final String[] lines = input.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lines[i] = capitalizeFirstLetter(lines[i]);
        }
        return String.join("\n", lines);
    }

    private String capitalizeFirstLetter(final String line) {
        int pos = 0;
        while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
            pos++;
        }
        if (pos == line.length() || !Character.isLowerCase(line.charAt(pos))) {
            return line;
        }
        final StringBuilder sb = new StringBuilder(line);
        sb.setCharAt(pos, Character.toUpperCase(line.charAt(pos)));
        return sb.toString();
    }
}

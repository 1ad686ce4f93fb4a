package eu.virtualparadox.ewexport.lyrics.parser;

import java.util.List;

/**
 * Plain text recovered from an RTF lyric body.
 *
 * @param plainText  cleaned plain text, line endings normalized to {@code \n}
 * @param lines      {@code plainText} split on newlines, right-trimmed, blank lines kept
 * @param hasContent whether {@code plainText} contains anything besides whitespace
 */
public record ParsedText(String plainText, List<String> lines, boolean hasContent) {

    public ParsedText {
        if (hasContent == plainText.isBlank()) {
            throw new IllegalStateException("hasContent must reflect whether the text is blank");
        }
        lines = List.copyOf(lines);
    }

    public ParsedText(final String plainText, final List<String> lines) {
        this(plainText, lines, !plainText.isBlank());
    }
}

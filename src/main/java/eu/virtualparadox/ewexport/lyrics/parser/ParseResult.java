package eu.virtualparadox.ewexport.lyrics.parser;

import java.util.Optional;

/**
 * Outcome of parsing one lyric body. Only {@link EParseStatus#CONTENT} carries text.
 *
 * @param status        what happened
 * @param parsedText    the recovered text, {@code null} unless status is {@code CONTENT}
 * @param failureReason error text, {@code null} unless status is {@code FAILED}
 */
public record ParseResult(EParseStatus status, ParsedText parsedText, String failureReason) {

    private static final ParseResult EMPTY = new ParseResult(EParseStatus.EMPTY, null, null);

    public static ParseResult content(final ParsedText parsedText) {
        return new ParseResult(EParseStatus.CONTENT, parsedText, null);
    }

    public static ParseResult empty() {
        return EMPTY;
    }

    public static ParseResult failed(final String reason) {
        return new ParseResult(EParseStatus.FAILED, null, reason);
    }

    public boolean hasContent() {
        return status == EParseStatus.CONTENT;
    }

    public Optional<ParsedText> text() {
        return Optional.ofNullable(parsedText);
    }
}

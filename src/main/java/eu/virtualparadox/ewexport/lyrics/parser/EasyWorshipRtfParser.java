package eu.virtualparadox.ewexport.lyrics.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns EasyWorship RTF lyric bodies into plain text.
 *
 * <p>The group-aware tokenizer is tried first; if it rejects the markup the regex reduction takes
 * over. Input that is not an RTF document keeps its own line breaks. The result is then cleaned up:
 * leftover Unicode escapes are decoded, residual control words removed, line endings normalized to
 * {@code \n}, runs of three or more newlines collapsed to one blank line, every line right-trimmed
 * and the whole text trimmed.</p>
 *
 * <p>Blank input is reported as {@link EParseStatus#EMPTY}. If both reductions throw, the result is
 * {@link EParseStatus#FAILED} and the message is kept for {@link #getLastError()}.</p>
 */
@Component
@Slf4j
public class EasyWorshipRtfParser implements LyricParser {

    private static final Pattern RESIDUAL_CONTROL_WORD = Pattern.compile("\\\\[a-z]+\\d*");
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
    private static final String RTF_SIGNATURE = "{\\rtf";

    private final RtfTextStripper stripper = new RtfTextStripper();
    private final RtfFallbackReducer fallbackReducer = new RtfFallbackReducer();

    private volatile String lastError;

    @Override
    public ParseResult parse(final String rawLyrics) {
        if (StringUtils.isBlank(rawLyrics)) {
            log.debug("Empty RTF content provided");
            return ParseResult.empty();
        }

        try {
            String text = reduce(rawLyrics);
            text = UnicodeEscapeDecoder.decodeEscapes(text);
            text = tidy(text);

            if (text.isEmpty()) {
                log.debug("RTF content reduced to nothing");
                return ParseResult.empty();
            }

            final ParsedText parsed = new ParsedText(text, extractLines(text));
            log.debug("Successfully parsed RTF with {} lines", parsed.lines().size());
            return ParseResult.content(parsed);

        } catch (RuntimeException e) {
            lastError = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("RTF parsing failed: {}", lastError, e);
            return ParseResult.failed(lastError);
        }
    }

    @Override
    public Optional<String> getLastError() {
        return Optional.ofNullable(lastError);
    }

    private String reduce(final String rtf) {
        try {
            return stripper.strip(rtf, !isRtfDocument(rtf));
        } catch (RtfParseException e) {
            log.warn("RTF tokenizer failed, attempting manual reduction: {}", e.getMessage());
            return fallbackReducer.reduce(rtf);
        }
    }

    private static boolean isRtfDocument(final String raw) {
        return raw.stripLeading().startsWith(RTF_SIGNATURE);
    }

    private String tidy(final String input) {
        String text = RESIDUAL_CONTROL_WORD.matcher(input).replaceAll("");
        text = text.replace("\r\n", "\n").replace('\r', '\n');
        text = EXCESS_BLANK_LINES.matcher(text).replaceAll("\n\n");

        final String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            lines[i] = StringUtils.stripEnd(lines[i], null);
        }
        return StringUtils.strip(String.join("\n", lines));
    }

    private List<String> extractLines(final String text) {
        return Arrays.stream(text.split("\n", -1))
                .map(line -> StringUtils.stripEnd(line, null))
                .toList();
    }
}

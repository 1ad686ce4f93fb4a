package eu.virtualparadox.ewexport.lyrics.parser;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes RTF {@code \}{@code uN} escapes the way EasyWorship writes them.
 *
 * <p>A fixed override table wins over the numeric value: EasyWorship stores some Swedish letters and
 * typographic marks under codes that must be mapped explicitly. Code 180 stays an acute accent even
 * though some sources use it as a quote mark. Negative codes are signed 16-bit values and get
 * {@code 65536} added before conversion.</p>
 */
@Slf4j
final class UnicodeEscapeDecoder {

    private static final Map<Integer, String> OVERRIDES = Map.of(
            228, "ä",
            229, "å",
            246, "ö",
            180, "´",
            8217, "'",
            8220, "\"",
            8221, "\"",
            8211, "–",
            8212, "—"
    );

    /**
     * {@code \}{@code u} followed by a signed decimal code and an optional {@code ?} placeholder.
     */
    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u(-?\\d+)\\??");

    private UnicodeEscapeDecoder() {
        // static only
    }

    /**
     * Converts a single escape code.
     *
     * @param code the number following {@code \}{@code u}
     * @return the decoded text, or {@code null} if the code is not a valid code point
     */
    static String decode(final long code) {
        if (code >= Integer.MIN_VALUE && code <= Integer.MAX_VALUE) {
            final String override = OVERRIDES.get((int) code);
            if (override != null) {
                return override;
            }
        }

        long corrected = code;
        if (corrected < 0) {
            corrected += 65536;
        }
        if (corrected < 0 || corrected > Character.MAX_CODE_POINT) {
            log.warn("Cannot decode Unicode value: {}", code);
            return null;
        }
        return new String(Character.toChars((int) corrected));
    }

    /**
     * Replaces every escape left in {@code text}. Escapes that cannot be decoded stay as they are.
     */
    static String decodeEscapes(final String text) {
        if (text.indexOf("\\u") < 0) {
            return text;
        }

        final Matcher matcher = UNICODE_ESCAPE.matcher(text);
        final StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            final String decoded = decodeDigits(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(decoded != null ? decoded : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static String decodeDigits(final String digits) {
        try {
            return decode(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            log.warn("Unicode escape out of range: {}", digits);
            return null;
        }
    }
}

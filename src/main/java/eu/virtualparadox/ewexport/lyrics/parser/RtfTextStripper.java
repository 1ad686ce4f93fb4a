package eu.virtualparadox.ewexport.lyrics.parser;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;

/**
 * Group-aware RTF to plain text tokenizer.
 *
 * <p>Walks the markup once, keeping a stack of group states. Text inside ignorable destinations
 * (font and colour tables, stylesheets, document info, pictures, {@code \*} groups) is dropped,
 * paragraph and line controls become newlines, {@code \'hh} bytes are decoded as Windows-1252 and
 * Unicode escapes go through {@link UnicodeEscapeDecoder}, honouring the {@code uc} fallback count.</p>
 *
 * <p>Structural damage (a closing brace without a matching opening brace, a truncated escape)
 * raises {@link RtfParseException} so the caller can switch to the regex based reduction.</p>
 */
final class RtfTextStripper {

    private static final Charset ANSI = Charset.forName("windows-1252");

    private static final Set<String> IGNORED_DESTINATIONS = Set.of(
            "fonttbl", "colortbl", "stylesheet", "info", "pict", "object", "header", "headerl",
            "headerr", "headerf", "footer", "footerl", "footerr", "footerf", "listtable",
            "listoverridetable", "rsidtbl", "generator", "xmlnstbl", "themedata",
            "colorschememapping", "latentstyles", "datastore", "filetbl", "revtbl", "fldinst"
    );

    /**
     * Formatting state saved when a group opens and restored when it closes.
     */
    private static final class GroupState {
        final boolean ignorable;
        final int unicodeSkip;

        GroupState(final boolean ignorable, final int unicodeSkip) {
            this.ignorable = ignorable;
            this.unicodeSkip = unicodeSkip;
        }
    }

    /**
     * Mutable cursor over one document. A new instance is used per call.
     */
    private static final class Cursor {
        final String rtf;
        final StringBuilder out;
        final Deque<GroupState> groups = new ArrayDeque<>();
        int pos;
        boolean ignorable;
        int unicodeSkip = 1;
        int pendingSkip;

        Cursor(final String rtf) {
            this.rtf = rtf;
            this.out = new StringBuilder(rtf.length());
        }
    }

    String strip(final String rtf) {
        return strip(rtf, false);
    }

    /**
     * Reduces {@code rtf} to plain text.
     *
     * @param rtf           RTF markup, or plain text that may contain RTF escapes
     * @param keepRawBreaks treat CR and LF in the input as line breaks, for input that is not an RTF document
     * @return the text content, not yet trimmed
     * @throws RtfParseException if the group structure or an escape is broken
     */
    String strip(final String rtf, final boolean keepRawBreaks) {
        final Cursor cursor = new Cursor(rtf);
        final int length = rtf.length();

        while (cursor.pos < length) {
            final char c = rtf.charAt(cursor.pos);
            switch (c) {
                case '{' -> {
                    cursor.groups.push(new GroupState(cursor.ignorable, cursor.unicodeSkip));
                    cursor.pendingSkip = 0;
                    cursor.pos++;
                }
                case '}' -> {
                    if (cursor.groups.isEmpty()) {
                        throw new RtfParseException("Unbalanced closing brace at offset " + cursor.pos);
                    }
                    final GroupState state = cursor.groups.pop();
                    cursor.ignorable = state.ignorable;
                    cursor.unicodeSkip = state.unicodeSkip;
                    cursor.pendingSkip = 0;
                    cursor.pos++;
                }
                case '\\' -> readControl(cursor);
                case '\r', '\n' -> {
                    if (keepRawBreaks) {
                        emitBreak(cursor, String.valueOf(c));
                    }
                    cursor.pos++;
                }
                default -> {
                    emit(cursor, String.valueOf(c));
                    cursor.pos++;
                }
            }
        }

        return cursor.out.toString();
    }

    private void readControl(final Cursor cursor) {
        final String rtf = cursor.rtf;
        if (cursor.pos + 1 >= rtf.length()) {
            throw new RtfParseException("Dangling backslash at end of input");
        }

        final char next = rtf.charAt(cursor.pos + 1);
        if (isAsciiLetter(next)) {
            readControlWord(cursor);
            return;
        }

        switch (next) {
            case '\'' -> {
                if (cursor.pos + 4 > rtf.length()) {
                    throw new RtfParseException("Truncated hex escape at offset " + cursor.pos);
                }
                final String hex = rtf.substring(cursor.pos + 2, cursor.pos + 4);
                final int value;
                try {
                    value = Integer.parseInt(hex, 16);
                } catch (NumberFormatException e) {
                    throw new RtfParseException("Malformed hex escape '" + hex + "' at offset " + cursor.pos);
                }
                emit(cursor, ANSI.decode(ByteBuffer.wrap(new byte[]{(byte) value})).toString());
                cursor.pos += 4;
                return;
            }
            case '*' -> cursor.ignorable = true;
            case '\\', '{', '}' -> emit(cursor, String.valueOf(next));
            case '~' -> emit(cursor, "\u00A0");
            case '_' -> emit(cursor, "-");
            case '\r', '\n' -> emitBreak(cursor, "\n");
            default -> {
                // optional hyphen and other control symbols carry no text
            }
        }
        cursor.pos += 2;
    }

    private void readControlWord(final Cursor cursor) {
        final String rtf = cursor.rtf;
        final int length = rtf.length();

        int end = cursor.pos + 1;
        while (end < length && isAsciiLetter(rtf.charAt(end))) {
            end++;
        }
        final String word = rtf.substring(cursor.pos + 1, end);

        int paramEnd = end;
        if (paramEnd < length && rtf.charAt(paramEnd) == '-') {
            paramEnd++;
        }
        while (paramEnd < length && Character.isDigit(rtf.charAt(paramEnd))) {
            paramEnd++;
        }
        final String param = rtf.substring(end, paramEnd);
        final boolean hasParam = !param.isEmpty() && !"-".equals(param);
        if (!hasParam) {
            paramEnd = end;
        }

        // a single space delimits the control word and is not part of the text
        if (paramEnd < length && rtf.charAt(paramEnd) == ' ') {
            paramEnd++;
        }
        cursor.pos = paramEnd;

        handleControlWord(cursor, word, hasParam ? param : null);
    }

    private void handleControlWord(final Cursor cursor, final String word, final String param) {
        if ("u".equals(word)) {
            if (param == null) {
                throw new RtfParseException("Unicode escape without code point");
            }
            cursor.pendingSkip = 0;
            final String decoded = decodeUnicode(param);
            emit(cursor, decoded != null ? decoded : "\\u" + param);
            cursor.pendingSkip = cursor.unicodeSkip;
            return;
        }

        cursor.pendingSkip = 0;
        switch (word) {
            case "par", "line" -> emitBreak(cursor, "\n");
            case "sect", "page" -> emitBreak(cursor, "\n\n");
            case "tab" -> emit(cursor, "\t");
            case "emdash" -> emit(cursor, "—");
            case "endash" -> emit(cursor, "–");
            case "lquote" -> emit(cursor, "‘");
            case "rquote" -> emit(cursor, "’");
            case "ldblquote" -> emit(cursor, "“");
            case "rdblquote" -> emit(cursor, "”");
            case "bullet" -> emit(cursor, "•");
            case "emspace", "enspace", "qmspace" -> emit(cursor, " ");
            case "uc" -> cursor.unicodeSkip = param == null ? 1 : Math.max(0, parseInt(param));
            default -> {
                if (IGNORED_DESTINATIONS.contains(word)) {
                    cursor.ignorable = true;
                }
            }
        }
    }

    private String decodeUnicode(final String param) {
        try {
            return UnicodeEscapeDecoder.decode(Long.parseLong(param));
        } catch (NumberFormatException e) {
            throw new RtfParseException("Unicode escape out of range: " + param);
        }
    }

    private int parseInt(final String param) {
        try {
            return Integer.parseInt(param);
        } catch (NumberFormatException e) {
            throw new RtfParseException("Numeric parameter out of range: " + param);
        }
    }

    private void emitBreak(final Cursor cursor, final String text) {
        if (!cursor.ignorable) {
            cursor.out.append(text);
        }
    }

    private void emit(final Cursor cursor, final String text) {
        if (cursor.ignorable) {
            return;
        }
        if (cursor.pendingSkip > 0) {
            cursor.pendingSkip--;
            return;
        }
        cursor.out.append(text);
    }

    private static boolean isAsciiLetter(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}

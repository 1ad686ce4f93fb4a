package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.song.SongRecord;
import eu.virtualparadox.ewexport.util.Pro6Constants;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Derives safe file names from song titles.
 */
@Component
public class FilenameSanitizer {

    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\x00-\\x1F\\x7F]");
    private static final Pattern RESERVED_CHARACTERS = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final String EDGE_CHARACTERS = " .";

    /**
     * Makes {@code name} usable as a file name on Windows, macOS and Linux.
     * <ol>
     *   <li>ASCII control characters are removed,</li>
     *   <li>{@code < > : " / \ | ? *} become underscores,</li>
     *   <li>whitespace runs collapse to one space,</li>
     *   <li>leading and trailing spaces and dots are trimmed,</li>
     *   <li>the result is cut to 200 characters, never inside a surrogate pair, and trimmed again.</li>
     * </ol>
     *
     * @return the sanitized name, {@code "Untitled_Song"} if nothing is left
     */
    public String sanitize(final String name) {
        if (name == null) {
            return Pro6Constants.UNTITLED_SONG;
        }

        String result = CONTROL_CHARACTERS.matcher(name).replaceAll("");
        result = RESERVED_CHARACTERS.matcher(result).replaceAll("_");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");
        result = StringUtils.strip(result, EDGE_CHARACTERS);

        if (result.length() > Pro6Constants.MAX_FILENAME_LENGTH) {
            int cut = Pro6Constants.MAX_FILENAME_LENGTH;
            if (Character.isHighSurrogate(result.charAt(cut - 1))) {
                cut--;
            }
            result = StringUtils.strip(result.substring(0, cut), EDGE_CHARACTERS);
        }

        return result.isEmpty() ? Pro6Constants.UNTITLED_SONG : result;
    }

    /**
     * Full file name of a song: sanitized title, optional CCLI and author suffixes, {@code .pro6}.
     */
    public String fileNameFor(final SongRecord song, final ExportOptions options) {
        final StringBuilder sb = new StringBuilder(sanitize(song.title()));
        if (options.includeCcliInFilename() && StringUtils.isNotBlank(song.referenceNumber())) {
            sb.append('_').append(sanitize(song.referenceNumber()));
        }
        if (options.includeAuthorInFilename() && StringUtils.isNotBlank(song.author())) {
            sb.append('_').append(sanitize(song.author()));
        }
        return sb.append(Pro6Constants.FILE_EXTENSION).toString();
    }

    /**
     * File name for a user supplied name, with the extension added when missing.
     */
    public String fileNameFor(final String customName) {
        final String base = StringUtils.removeEndIgnoreCase(StringUtils.defaultString(customName).strip(),
                Pro6Constants.FILE_EXTENSION);
        return sanitize(base) + Pro6Constants.FILE_EXTENSION;
    }
}

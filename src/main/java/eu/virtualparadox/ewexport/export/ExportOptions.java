package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.export.duplicate.EDuplicateAction;
import eu.virtualparadox.ewexport.lyrics.section.ESectionDetectionMode;
import eu.virtualparadox.ewexport.util.Pro6Constants;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable snapshot of the export configuration, taken once per export call or batch.
 *
 * @param formattingEnabled       custom formatting switched on
 * @param changeFont              use {@code fontFamily} and {@code fontSize}; needs {@code formattingEnabled}
 * @param fontFamily              configured font family
 * @param fontSize                configured font size in points
 * @param maxLinesPerSlide        longest slide before it is broken up
 * @param autoBreakLongLines      break slides longer than {@code maxLinesPerSlide}
 * @param includeCcliInFilename   append {@code _<ccli>} to the file name
 * @param includeAuthorInFilename append {@code _<author>} to the file name
 * @param overwriteExisting       replace existing files without asking
 * @param duplicateAction         what to do with existing files otherwise
 * @param renamePattern           pattern for automatic renames, {@code {name}} and {@code {number}}
 * @param removeChords            strip chord notation while cleaning
 * @param detectionMode           section detection mode
 * @param createSubfolder         export into a dated subfolder of the destination
 * @param subfolderPattern        subfolder name, {@code {date}} is replaced by the current date
 */
@Builder(toBuilder = true)
public record ExportOptions(boolean formattingEnabled,
                            boolean changeFont,
                            String fontFamily,
                            int fontSize,
                            int maxLinesPerSlide,
                            boolean autoBreakLongLines,
                            boolean includeCcliInFilename,
                            boolean includeAuthorInFilename,
                            boolean overwriteExisting,
                            EDuplicateAction duplicateAction,
                            String renamePattern,
                            boolean removeChords,
                            ESectionDetectionMode detectionMode,
                            boolean createSubfolder,
                            String subfolderPattern) {

    public static final String DEFAULT_RENAME_PATTERN = "{name}_{number}";
    public static final String DEFAULT_SUBFOLDER_PATTERN = "ProPresenter_Export_{date}";

    public ExportOptions {
        if (maxLinesPerSlide <= 0) {
            throw new IllegalArgumentException("maxLinesPerSlide must be positive");
        }
        if (fontSize <= 0) {
            throw new IllegalArgumentException("fontSize must be positive");
        }
        if (duplicateAction == EDuplicateAction.RENAME_CUSTOM || duplicateAction == EDuplicateAction.CANCEL) {
            throw new IllegalArgumentException("Unsupported default duplicate action: " + duplicateAction);
        }
        fontFamily = StringUtils.defaultIfBlank(fontFamily, Pro6Constants.DEFAULT_FONT_FAMILY);
        duplicateAction = duplicateAction == null ? EDuplicateAction.ASK : duplicateAction;
        renamePattern = StringUtils.defaultIfBlank(renamePattern, DEFAULT_RENAME_PATTERN);
        detectionMode = detectionMode == null ? ESectionDetectionMode.STANDARD : detectionMode;
        subfolderPattern = StringUtils.defaultIfBlank(subfolderPattern, DEFAULT_SUBFOLDER_PATTERN);
    }

    public static ExportOptions defaults() {
        return ExportOptions.builder()
                .fontFamily(Pro6Constants.DEFAULT_FONT_FAMILY)
                .fontSize(48)
                .maxLinesPerSlide(4)
                .autoBreakLongLines(true)
                .duplicateAction(EDuplicateAction.ASK)
                .renamePattern(DEFAULT_RENAME_PATTERN)
                .detectionMode(ESectionDetectionMode.STANDARD)
                .subfolderPattern(DEFAULT_SUBFOLDER_PATTERN)
                .build();
    }

    /**
     * Font family written into the slide text, the configured one only when custom fonts are enabled.
     */
    public String effectiveFontFamily() {
        return formattingEnabled && changeFont ? fontFamily : Pro6Constants.DEFAULT_FONT_FAMILY;
    }

    public int effectiveFontSize() {
        return formattingEnabled && changeFont ? fontSize : Pro6Constants.DEFAULT_FONT_SIZE;
    }
}

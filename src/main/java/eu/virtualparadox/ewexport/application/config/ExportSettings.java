package eu.virtualparadox.ewexport.application.config;

import eu.virtualparadox.ewexport.export.ExportOptions;
import eu.virtualparadox.ewexport.export.duplicate.EDuplicateAction;
import eu.virtualparadox.ewexport.lyrics.section.ESectionDetectionMode;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Export preferences bound from {@code ewexport.export.*}. Mutable; batches work on the
 * {@link ExportOptions} snapshot returned by {@link #toOptions()}.
 */
@Configuration
@ConfigurationProperties(prefix = "ewexport.export")
@Getter @Setter
public class ExportSettings {

    private boolean formattingEnabled = false;
    private boolean changeFont = false;
    private String fontFamily = "Arial";
    private int fontSize = 48;
    private int maxLinesPerSlide = 4;
    private boolean autoBreakLongLines = true;
    private boolean includeCcliInFilename = false;
    private boolean includeAuthorInFilename = false;
    private boolean overwriteExisting = false;
    private EDuplicateAction duplicateAction = EDuplicateAction.ASK;
    private String renamePattern = ExportOptions.DEFAULT_RENAME_PATTERN;
    private boolean removeChords = false;
    private ESectionDetectionMode detectionMode = ESectionDetectionMode.STANDARD;
    private boolean createSubfolder = false;
    private String subfolderPattern = ExportOptions.DEFAULT_SUBFOLDER_PATTERN;

    public ExportOptions toOptions() {
        return ExportOptions.builder()
                .formattingEnabled(formattingEnabled)
                .changeFont(changeFont)
                .fontFamily(fontFamily)
                .fontSize(fontSize)
                .maxLinesPerSlide(maxLinesPerSlide)
                .autoBreakLongLines(autoBreakLongLines)
                .includeCcliInFilename(includeCcliInFilename)
                .includeAuthorInFilename(includeAuthorInFilename)
                .overwriteExisting(overwriteExisting)
                .duplicateAction(duplicateAction)
                .renamePattern(renamePattern)
                .removeChords(removeChords)
                .detectionMode(detectionMode)
                .createSubfolder(createSubfolder)
                .subfolderPattern(subfolderPattern)
                .build();
    }
}

package eu.virtualparadox.ewexport.lyrics.cleaner;

/**
 * Result of a text cleaning operation.
 */
public class CleaningResult {
    private final String cleanText;
    private final int originalLength;
    private final int passes;

    public CleaningResult(String cleanText, int originalLength, int passes) {
        this.cleanText = cleanText;
        this.originalLength = originalLength;
        this.passes = passes;

        if (originalLength < 0 || passes < 0) {
            throw new IllegalStateException(
                    "Cleaning produced negative statistics: originalLength " + originalLength +
                            ", passes " + passes
            );
        }
    }

    public String getCleanText() {
        return cleanText;
    }

    public int getOriginalLength() {
        return originalLength;
    }

    public int getCleanedLength() {
        return cleanText.length();
    }

    /**
     * Net number of characters dropped. Negative when replacements grew the text,
     * e.g. an ellipsis glyph expanded to three periods.
     */
    public int getCharactersRemoved() {
        return originalLength - cleanText.length();
    }

    /**
     * Number of cleaning passes needed before the text stopped changing.
     */
    public int getPasses() {
        return passes;
    }
}

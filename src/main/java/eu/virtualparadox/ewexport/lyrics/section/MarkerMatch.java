package eu.virtualparadox.ewexport.lyrics.section;

/**
 * A recognized marker line: the mapping key it matched and the number written next to it.
 */
final class MarkerMatch {
    /**
     * Lowercase mapping key.
     */
    final String key;
    /**
     * Digits following the key, {@code null} if none.
     */
    final String number;

    MarkerMatch(final String key, final String number) {
        this.key = key;
        this.number = number;
    }

    boolean hasNumber() {
        return number != null;
    }
}

package eu.virtualparadox.ewexport.export.duplicate;

/**
 * Answer to "the target file already exists".
 *
 * @param action     what to do; never {@link EDuplicateAction#ASK}
 * @param customName new file name for {@link EDuplicateAction#RENAME_CUSTOM}, otherwise {@code null}
 * @param applyToAll reuse this answer for the remaining duplicates of the batch
 */
public record DuplicateDecision(EDuplicateAction action, String customName, boolean applyToAll) {

    public DuplicateDecision {
        if (action == null || action == EDuplicateAction.ASK) {
            throw new IllegalArgumentException("A duplicate decision needs a concrete action");
        }
        if (action == EDuplicateAction.RENAME_CUSTOM && (customName == null || customName.isBlank())) {
            throw new IllegalArgumentException("Custom rename requires a name");
        }
    }

    public static DuplicateDecision of(final EDuplicateAction action) {
        return new DuplicateDecision(action, null, false);
    }

    public static DuplicateDecision forAll(final EDuplicateAction action) {
        return new DuplicateDecision(action, null, true);
    }

    public static DuplicateDecision renameTo(final String customName) {
        return new DuplicateDecision(EDuplicateAction.RENAME_CUSTOM, customName, false);
    }
}

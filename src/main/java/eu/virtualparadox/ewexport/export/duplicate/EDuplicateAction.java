package eu.virtualparadox.ewexport.export.duplicate;

public enum EDuplicateAction {
    ASK,
    SKIP,
    OVERWRITE,
    RENAME,
    RENAME_CUSTOM,
    CANCEL
}

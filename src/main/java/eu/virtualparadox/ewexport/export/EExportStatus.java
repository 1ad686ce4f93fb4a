package eu.virtualparadox.ewexport.export;

public enum EExportStatus {
    EXPORTED,
    SKIPPED,
    FAILED
}

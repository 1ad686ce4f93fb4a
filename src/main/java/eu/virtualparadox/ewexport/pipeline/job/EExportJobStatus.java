package eu.virtualparadox.ewexport.pipeline.job;

public enum EExportJobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED
}

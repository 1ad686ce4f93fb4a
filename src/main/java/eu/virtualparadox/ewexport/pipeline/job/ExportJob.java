package eu.virtualparadox.ewexport.pipeline.job;

import eu.virtualparadox.ewexport.export.BatchExportResult;

import java.time.Instant;

/**
 * A batch export queued on the export executor.
 */
public class ExportJob {
    private final long id;
    private final int songCount;
    private volatile EExportJobStatus status;
    private volatile BatchExportResult result;
    private volatile String error;
    private volatile boolean cancelRequested;
    private final Instant createdAt;

    public ExportJob(long id, int songCount) {
        this.id = id;
        this.songCount = songCount;
        this.status = EExportJobStatus.QUEUED;
        this.createdAt = Instant.now();
    }

    public long getId() { return id; }
    public int getSongCount() { return songCount; }
    public EExportJobStatus getStatus() { return status; }
    public BatchExportResult getResult() { return result; }
    public String getError() { return error; }
    public boolean isCancelRequested() { return cancelRequested; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean isFinished() {
        return status == EExportJobStatus.COMPLETED
                || status == EExportJobStatus.CANCELLED
                || status == EExportJobStatus.FAILED;
    }

    public void setStatus(EExportJobStatus status) { this.status = status; }
    public void setResult(BatchExportResult result) { this.result = result; }
    public void setError(String error) { this.error = error; }

    // checked by the worker before each song
    public void requestCancel() { this.cancelRequested = true; }
}

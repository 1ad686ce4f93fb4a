package eu.virtualparadox.ewexport.pipeline.job;

import eu.virtualparadox.ewexport.export.BatchExportResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class ExportJobRegistry {

    private final AtomicLong counter;
    private final Map<Long, ExportJob> jobs;

    public ExportJobRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public ExportJob createJob(int songCount) {
        long id = counter.incrementAndGet();
        ExportJob job = new ExportJob(id, songCount);
        jobs.put(id, job);
        return job;
    }

    public Optional<ExportJob> getJob(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void updateStatus(long id, EExportJobStatus status, BatchExportResult result) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(status);
            if (result != null) job.setResult(result);
            return job;
        });
    }

    public void fail(long id, String error) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setStatus(EExportJobStatus.FAILED);
            job.setError(error);
            return job;
        });
    }

    /**
     * @return {@code true} if the job exists and had not finished yet
     */
    public boolean requestCancel(long id) {
        ExportJob job = jobs.get(id);
        if (job == null || job.isFinished()) {
            return false;
        }
        job.requestCancel();
        return true;
    }
}

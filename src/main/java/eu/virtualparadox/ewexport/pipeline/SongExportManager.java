package eu.virtualparadox.ewexport.pipeline;

import eu.virtualparadox.ewexport.application.config.ApplicationConfig;
import eu.virtualparadox.ewexport.application.config.ExportSettings;
import eu.virtualparadox.ewexport.application.executor.ExportExecutor;
import eu.virtualparadox.ewexport.export.BatchExportResult;
import eu.virtualparadox.ewexport.export.ExportItem;
import eu.virtualparadox.ewexport.export.ExportOptions;
import eu.virtualparadox.ewexport.export.ExportOutcome;
import eu.virtualparadox.ewexport.export.ExportProgressListener;
import eu.virtualparadox.ewexport.export.FilenameSanitizer;
import eu.virtualparadox.ewexport.export.Pro6Exporter;
import eu.virtualparadox.ewexport.lyrics.cleaner.LyricTextCleaner;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingStore;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingTable;
import eu.virtualparadox.ewexport.lyrics.parser.LyricParser;
import eu.virtualparadox.ewexport.lyrics.parser.ParseResult;
import eu.virtualparadox.ewexport.lyrics.section.DetectionResult;
import eu.virtualparadox.ewexport.lyrics.section.SectionDetector;
import eu.virtualparadox.ewexport.pipeline.job.EExportJobStatus;
import eu.virtualparadox.ewexport.pipeline.job.ExportJob;
import eu.virtualparadox.ewexport.pipeline.job.ExportJobRegistry;
import eu.virtualparadox.ewexport.pipeline.progress.ExportProgressTracker;
import eu.virtualparadox.ewexport.song.SongRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * Runs songs through the whole pipeline: RTF reduction, normalization, section detection and export.
 *
 * <p>Batches can run synchronously ({@link #exportSongs}) or on the export executor ({@link #submit}).
 * The mapping table and the export options are snapshotted when a batch starts; changes made while
 * it runs apply to the next batch.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SongExportManager {

    private static final String DATE_PLACEHOLDER = "{date}";

    private final LyricParser lyricParser;
    private final LyricTextCleaner textCleaner;
    private final SectionDetector sectionDetector;
    private final SectionMappingStore mappingStore;
    private final Pro6Exporter exporter;
    private final FilenameSanitizer filenameSanitizer;
    private final ExportSettings exportSettings;
    private final ApplicationConfig applicationConfig;
    private final ExportExecutor exportExecutor;
    private final ExportJobRegistry registry;
    private final ExportProgressTracker progressTracker;

    /**
     * Parses, cleans and sections one lyric body.
     *
     * @param song         the song the lyrics belong to
     * @param rawLyrics    EasyWorship RTF, may be {@code null}
     * @param mappingTable marker lexicon snapshot
     * @param options      options snapshot
     */
    public SongPreparation prepare(final SongRecord song,
                                   final String rawLyrics,
                                   final SectionMappingTable mappingTable,
                                   final ExportOptions options) {
        final ParseResult parseResult = lyricParser.parse(rawLyrics);
        if (!parseResult.hasContent()) {
            log.debug("Song {} '{}' has no usable lyrics ({})", song.id(), song.title(), parseResult.status());
            return SongPreparation.notExportable(song, parseResult);
        }

        final String plainText = parseResult.parsedText().plainText();
        final String cleanText = textCleaner.clean(plainText, true, options.removeChords());
        final DetectionResult detection = sectionDetector.detectSections(cleanText, mappingTable, options.detectionMode());

        log.debug("Song {} '{}' prepared with sections {}", song.id(), song.title(), detection.sectionTypes());
        return new SongPreparation(song, parseResult, cleanText, detection);
    }

    /**
     * Exports a single song with the current settings, replacing an existing file.
     */
    public ExportOutcome exportSong(final SongRecord song, final String rawLyrics, final Path destinationDir) {
        final ExportOptions options = exportSettings.toOptions();
        final SongPreparation preparation = prepare(song, rawLyrics, mappingStore.load(), options);
        if (!preparation.isExportable()) {
            return ExportOutcome.skipped(preparation.skipReason());
        }
        return exporter.exportSong(song, preparation.detection().sections(), resolveDestination(destinationDir, options), options);
    }

    /**
     * Exports a batch on the calling thread.
     */
    public BatchExportResult exportSongs(final ExportRequest request) {
        return runBatch(request, () -> false);
    }

    /**
     * Queues a batch on the export executor.
     *
     * @return the job, whose status and result are updated by the worker
     */
    public ExportJob submit(final ExportRequest request) {
        final ExportJob job = registry.createJob(request.songs().size());
        progressTracker.addBatch(request.songs().size());

        exportExecutor.submit(() -> {
            if (job.isCancelRequested()) {
                log.info("Export job {} cancelled before it started", job.getId());
                progressTracker.finishBatch();
                registry.updateStatus(job.getId(), EExportJobStatus.CANCELLED, null);
                return;
            }
            try {
                registry.updateStatus(job.getId(), EExportJobStatus.RUNNING, null);
                log.info("Export job {} started with {} songs", job.getId(), job.getSongCount());

                final BatchExportResult result = runTrackedBatch(request, job::isCancelRequested);

                registry.updateStatus(job.getId(),
                        result.cancelled() ? EExportJobStatus.CANCELLED : EExportJobStatus.COMPLETED,
                        result);
                log.info("Export job {} finished: {}", job.getId(), result.summary());
            } catch (Exception e) {
                log.error("Export job {} failed", job.getId(), e);
                registry.fail(job.getId(), e.getMessage());
            } finally {
                progressTracker.finishBatch();
            }
        });

        return job;
    }

    /**
     * Requests cooperative cancellation; the song being exported is finished, later songs are not started.
     *
     * @return {@code true} if the job was still running or queued
     */
    public boolean cancel(final long jobId) {
        final boolean requested = registry.requestCancel(jobId);
        if (requested) {
            log.info("Cancellation requested for export job {}", jobId);
        }
        return requested;
    }

    public Optional<ExportJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }

    private BatchExportResult runTrackedBatch(final ExportRequest request, final BooleanSupplier cancelRequested) {
        final AtomicInteger lastCompleted = new AtomicInteger();
        final ExportProgressListener userListener =
                request.listener() != null ? request.listener() : ExportProgressListener.NONE;

        final ExportProgressListener trackingListener = (completed, total, currentTitle) -> {
            if (completed > lastCompleted.getAndSet(completed)) {
                progressTracker.step();
            }
            userListener.onProgress(completed, total, currentTitle);
        };

        final ExportRequest tracked = new ExportRequest(request.songs(), request.lyricSource(),
                request.destinationDir(), request.resolver(), trackingListener);
        return runBatch(tracked, cancelRequested, progressTracker::step);
    }

    private BatchExportResult runBatch(final ExportRequest request, final BooleanSupplier cancelRequested) {
        return runBatch(request, cancelRequested, () -> {
        });
    }

    private BatchExportResult runBatch(final ExportRequest request,
                                       final BooleanSupplier cancelRequested,
                                       final Runnable onSongSkipped) {
        final SectionMappingTable mappingTable = mappingStore.load();
        final ExportOptions options = exportSettings.toOptions();
        final Path destination = resolveDestination(request.destinationDir(), options);

        log.info("Preparing {} songs for export to {}", request.songs().size(), destination);

        final List<ExportItem> items = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();
        for (final SongRecord song : request.songs()) {
            if (cancelRequested.getAsBoolean()) {
                break;
            }
            final SongPreparation preparation = prepareSafely(song, request, mappingTable, options);
            if (preparation.isExportable()) {
                items.add(preparation.toExportItem());
            } else {
                skipped.add(preparation.skipReason());
                onSongSkipped.run();
            }
        }

        final BatchExportResult result = exporter.exportBatch(items, destination, options,
                request.listener(), request.resolver(), cancelRequested);
        return result.withSkipped(skipped);
    }

    private SongPreparation prepareSafely(final SongRecord song,
                                          final ExportRequest request,
                                          final SectionMappingTable mappingTable,
                                          final ExportOptions options) {
        try {
            final String rawLyrics = request.lyricSource().findLyrics(song.id()).orElse(null);
            return prepare(song, rawLyrics, mappingTable, options);
        } catch (RuntimeException e) {
            log.error("Failed to prepare song {} '{}'", song.id(), song.title(), e);
            return SongPreparation.notExportable(song, ParseResult.failed(e.getMessage()));
        }
    }

    private Path resolveDestination(final Path requested, final ExportOptions options) {
        final Path base = requested != null ? requested : applicationConfig.getOutput();
        if (base == null) {
            throw new IllegalStateException("No destination directory given and none configured");
        }
        if (!options.createSubfolder()) {
            return base;
        }
        final String date = LocalDate.now().format(DateTimeFormatter.ISO_LOCAL_DATE);
        return base.resolve(filenameSanitizer.sanitize(options.subfolderPattern().replace(DATE_PLACEHOLDER, date)));
    }
}

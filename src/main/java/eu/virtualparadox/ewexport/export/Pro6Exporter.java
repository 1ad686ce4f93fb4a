package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.export.duplicate.DuplicateHandler;
import eu.virtualparadox.ewexport.export.duplicate.DuplicateResolution;
import eu.virtualparadox.ewexport.export.duplicate.DuplicateResolver;
import eu.virtualparadox.ewexport.lyrics.section.Section;
import eu.virtualparadox.ewexport.song.SongRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Writes songs as ProPresenter 6 documents.
 *
 * <p>Single songs overwrite an existing file. Batches run sequentially, resolve duplicates through a
 * {@link DuplicateHandler} and isolate every song: a failure is recorded and the next song is exported.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Pro6Exporter {

    static final String ERROR_NO_CONTENT = "No lyric content to export for '%s'";
    static final String ERROR_UNEXPECTED = "Unexpected error exporting '%s' (id %d): %s";
    static final String SKIPPED_EXISTING = "'%s' skipped, %s already exists";
    static final String SKIPPED_CANCELLED = "'%s' not exported, batch cancelled";

    private final Pro6DocumentBuilder documentBuilder;
    private final Pro6XmlWriter xmlWriter;
    private final FilenameSanitizer filenameSanitizer;

    /**
     * Exports one song into {@code destinationDir}, replacing an existing file of the same name.
     *
     * @return the written path, or the reason nothing was written
     */
    public ExportOutcome exportSong(final SongRecord song,
                                    final List<Section> sections,
                                    final Path destinationDir,
                                    final ExportOptions options) {
        if (!hasContent(sections)) {
            log.warn("Song {} '{}' has no section content, not exported", song.id(), song.title());
            return ExportOutcome.failed(String.format(ERROR_NO_CONTENT, song.title()));
        }

        final Path target;
        try {
            target = destinationDir.resolve(filenameSanitizer.fileNameFor(song, options));
        } catch (InvalidPathException e) {
            log.error("Cannot build target path for song {} '{}' in {}", song.id(), song.title(), destinationDir, e);
            return ExportOutcome.failed(WriteErrorClassifier.describe(e));
        }
        return write(song, sections, target, options);
    }

    public BatchExportResult exportBatch(final List<ExportItem> items,
                                         final Path destinationDir,
                                         final ExportOptions options,
                                         final ExportProgressListener listener,
                                         final DuplicateResolver resolver) {
        return exportBatch(items, destinationDir, options, listener, resolver, () -> false);
    }

    /**
     * Exports songs one after the other.
     *
     * @param items           songs with their sections, in export order
     * @param destinationDir  output directory, created when missing
     * @param options         options snapshot applied to every song
     * @param listener        progress listener, {@code null} for none
     * @param resolver        asked about existing files when the duplicate action is ASK, may be {@code null}
     * @param cancelRequested checked before every song; {@code true} stops the batch
     * @return written files, failure messages and skip messages
     */
    public BatchExportResult exportBatch(final List<ExportItem> items,
                                         final Path destinationDir,
                                         final ExportOptions options,
                                         final ExportProgressListener listener,
                                         final DuplicateResolver resolver,
                                         final BooleanSupplier cancelRequested) {
        final ExportProgressListener progress = listener != null ? listener : ExportProgressListener.NONE;
        final DuplicateHandler duplicateHandler = new DuplicateHandler(
                options.duplicateAction(),
                options.overwriteExisting(),
                options.renamePattern(),
                resolver,
                filenameSanitizer::fileNameFor);

        final List<Path> successes = new ArrayList<>();
        final List<String> failures = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();
        boolean cancelled = false;

        final int total = items.size();
        log.info("Exporting {} song(s) to {}", total, destinationDir);

        for (int i = 0; i < total; i++) {
            final ExportItem item = items.get(i);
            final SongRecord song = item.song();

            if (cancelRequested.getAsBoolean()) {
                log.info("Export cancelled before song {} of {}", i + 1, total);
                cancelled = true;
                break;
            }

            try {
                final ExportOutcome outcome = exportBatchItem(item, destinationDir, options, duplicateHandler);
                if (outcome == null) {
                    skipped.add(String.format(SKIPPED_CANCELLED, song.title()));
                    cancelled = true;
                    break;
                }
                switch (outcome.status()) {
                    case EXPORTED -> successes.add(outcome.path());
                    case SKIPPED -> skipped.add(outcome.message());
                    case FAILED -> failures.add(outcome.message());
                }
            } catch (RuntimeException e) {
                log.error("Unexpected error exporting song {} '{}'", song.id(), song.title(), e);
                failures.add(String.format(ERROR_UNEXPECTED, song.title(), song.id(), e.getMessage()));
            }

            progress.onProgress(i + 1, total, song.title());
        }

        progress.onProgress(total, total, ExportProgressListener.COMPLETE_MESSAGE);

        final BatchExportResult result = new BatchExportResult(successes, failures, skipped, cancelled);
        log.info("Batch finished: {} exported, {} failed, {} skipped{}",
                successes.size(), failures.size(), skipped.size(), cancelled ? ", cancelled" : "");
        return result;
    }

    /**
     * @return the outcome, or {@code null} when the duplicate resolver cancelled the batch
     */
    private ExportOutcome exportBatchItem(final ExportItem item,
                                          final Path destinationDir,
                                          final ExportOptions options,
                                          final DuplicateHandler duplicateHandler) {
        final SongRecord song = item.song();
        if (!hasContent(item.sections())) {
            log.warn("Song {} '{}' has no section content, not exported", song.id(), song.title());
            return ExportOutcome.failed(String.format(ERROR_NO_CONTENT, song.title()));
        }

        final Path naturalTarget;
        try {
            naturalTarget = destinationDir.resolve(filenameSanitizer.fileNameFor(song, options));
        } catch (InvalidPathException e) {
            log.error("Cannot build target path for song {} '{}' in {}", song.id(), song.title(), destinationDir, e);
            return ExportOutcome.failed(WriteErrorClassifier.describe(e));
        }

        final DuplicateResolution resolution = duplicateHandler.resolve(naturalTarget, song);
        if (resolution.cancelled()) {
            return null;
        }
        if (!resolution.shouldWrite()) {
            log.info("Song {} '{}' skipped, {} exists", song.id(), song.title(), naturalTarget);
            return ExportOutcome.skipped(String.format(SKIPPED_EXISTING, song.title(), naturalTarget.getFileName()));
        }
        return write(song, item.sections(), resolution.target(), options);
    }

    private ExportOutcome write(final SongRecord song,
                                final List<Section> sections,
                                final Path target,
                                final ExportOptions options) {
        try {
            final Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final Document document = documentBuilder.build(song, sections, options);
            xmlWriter.write(document, target);
            log.info("Exported song {} '{}' to {}", song.id(), song.title(), target);
            return ExportOutcome.exported(target);
        } catch (IOException | InvalidPathException e) {
            log.error("Failed to write song {} '{}' to {}", song.id(), song.title(), target, e);
            return ExportOutcome.failed(WriteErrorClassifier.describe(e));
        }
    }

    private static boolean hasContent(final List<Section> sections) {
        return sections != null && sections.stream().anyMatch(section -> !section.content().isBlank());
    }
}

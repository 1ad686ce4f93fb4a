package eu.virtualparadox.ewexport.pipeline;

import eu.virtualparadox.ewexport.application.config.ApplicationConfig;
import eu.virtualparadox.ewexport.application.config.ExportSettings;
import eu.virtualparadox.ewexport.application.executor.ExportExecutor;
import eu.virtualparadox.ewexport.export.BatchExportResult;
import eu.virtualparadox.ewexport.export.EExportStatus;
import eu.virtualparadox.ewexport.export.ExportOptions;
import eu.virtualparadox.ewexport.export.ExportOutcome;
import eu.virtualparadox.ewexport.export.FilenameSanitizer;
import eu.virtualparadox.ewexport.export.Pro6DocumentBuilder;
import eu.virtualparadox.ewexport.export.Pro6Exporter;
import eu.virtualparadox.ewexport.export.Pro6TextEncoder;
import eu.virtualparadox.ewexport.export.Pro6XmlWriter;
import eu.virtualparadox.ewexport.export.SlideSplitter;
import eu.virtualparadox.ewexport.lyrics.cleaner.LyricTextCleaner;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingStore;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingTable;
import eu.virtualparadox.ewexport.lyrics.parser.EasyWorshipRtfParser;
import eu.virtualparadox.ewexport.lyrics.section.ESectionDetectionMode;
import eu.virtualparadox.ewexport.lyrics.section.SectionDetector;
import eu.virtualparadox.ewexport.pipeline.job.EExportJobStatus;
import eu.virtualparadox.ewexport.pipeline.job.ExportJob;
import eu.virtualparadox.ewexport.pipeline.job.ExportJobRegistry;
import eu.virtualparadox.ewexport.pipeline.progress.ExportProgressTracker;
import eu.virtualparadox.ewexport.song.LyricSource;
import eu.virtualparadox.ewexport.song.SongRecord;
import eu.virtualparadox.ewexport.song.SongSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Pipeline tests wired with real components.
 */
class SongExportManagerTest {

    private static final String VERSE_AND_CHORUS = "{\\rtf1\\ansi vers 1\\par H\\u228?r \\u228?r jag\\par\\par "
            + "refr\\u228?ng\\par Sjung med\\par}";

    @TempDir
    Path tempDir;

    private ExportSettings settings;
    private ApplicationConfig applicationConfig;
    private ExportExecutor executor;
    private ExportProgressTracker tracker;
    private SongExportManager manager;

    private final Map<Long, String> lyrics = Map.of(
            1L, VERSE_AND_CHORUS,
            2L, "   ",
            4L, "{\\rtf1 Only one verse}");
    private final LyricSource lyricSource = songId -> Optional.ofNullable(lyrics.get(songId));

    @BeforeEach
    void setUp() {
        settings = new ExportSettings();
        applicationConfig = new ApplicationConfig();
        applicationConfig.setOutput(tempDir.resolve("default-output"));

        executor = new ExportExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.initialize();

        tracker = new ExportProgressTracker();

        final Pro6Exporter exporter = new Pro6Exporter(
                new Pro6DocumentBuilder(new Pro6TextEncoder(), new SlideSplitter()),
                new Pro6XmlWriter(),
                new FilenameSanitizer());

        manager = new SongExportManager(
                new EasyWorshipRtfParser(),
                new LyricTextCleaner(),
                new SectionDetector(),
                new SectionMappingStore(tempDir.resolve("section_mappings.json")),
                exporter,
                new FilenameSanitizer(),
                settings,
                applicationConfig,
                executor,
                new ExportJobRegistry(),
                tracker);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Preparation runs parser, cleaner and detector")
    void testPrepare() {
        final SongPreparation preparation = manager.prepare(SongRecord.of(1, "Här"), VERSE_AND_CHORUS,
                SectionMappingTable.of(Map.of("vers", "Verse", "refräng", "Chorus")), ExportOptions.defaults());

        assertThat(preparation.isExportable()).isTrue();
        assertThat(preparation.detection().sectionTypes()).containsExactly("Verse 1", "Chorus");
        assertThat(preparation.detection().sections().get(0).content()).isEqualTo("Här är jag");
    }

    @Test
    @DisplayName("Advanced detection is taken from the options")
    void testPrepareAdvanced() {
        final ExportOptions advanced = ExportOptions.defaults().toBuilder()
                .detectionMode(ESectionDetectionMode.ADVANCED)
                .build();

        final SongPreparation preparation = manager.prepare(SongRecord.of(5, "Repeat"),
                "{\\rtf1 Again\\par\\par Once\\par\\par Again}", SectionMappingTable.empty(), advanced);

        assertThat(preparation.detection().sectionTypes()).containsExactly("chorus", "verse", "chorus");
    }

    @Test
    @DisplayName("Songs without lyrics are skipped, the rest is exported")
    void testExportSongs() {
        final List<SongRecord> songs = List.of(
                SongRecord.of(1, "Here I Am"),
                SongRecord.of(2, "Blank"),
                SongRecord.of(3, "Missing"),
                SongRecord.of(4, "Single"));

        final BatchExportResult result = manager.exportSongs(ExportRequest.of(songs, lyricSource, tempDir));

        assertThat(result.successes()).containsExactly(
                tempDir.resolve("Here I Am.pro6"),
                tempDir.resolve("Single.pro6"));
        assertThat(result.skipped()).containsExactly("'Blank' has no lyrics", "'Missing' has no lyrics");
        assertThat(result.failures()).isEmpty();
    }

    @Test
    @DisplayName("A whole catalog can be exported")
    void testAllSongs() {
        final SongSource catalog = () -> List.of(SongRecord.of(4, "Single"), SongRecord.of(1, "Here I Am"));

        final BatchExportResult result = manager.exportSongs(ExportRequest.allSongs(catalog, lyricSource, tempDir));

        assertThat(result.successes()).containsExactly(
                tempDir.resolve("Single.pro6"),
                tempDir.resolve("Here I Am.pro6"));
    }

    @Test
    @DisplayName("Without a destination the configured output folder is used")
    void testDefaultDestination() {
        final BatchExportResult result = manager.exportSongs(
                ExportRequest.of(List.of(SongRecord.of(4, "Single")), lyricSource, null));

        assertThat(result.successes()).containsExactly(tempDir.resolve("default-output").resolve("Single.pro6"));
    }

    @Test
    @DisplayName("Dated subfolders are created on request")
    void testSubfolder() {
        settings.setCreateSubfolder(true);

        final BatchExportResult result = manager.exportSongs(
                ExportRequest.of(List.of(SongRecord.of(4, "Single")), lyricSource, tempDir));

        final Path expectedFolder = tempDir.resolve("ProPresenter_Export_" + LocalDate.now());
        assertThat(result.successes()).containsExactly(expectedFolder.resolve("Single.pro6"));
    }

    @Test
    @DisplayName("Single export reports missing lyrics as skipped")
    void testExportSong() {
        final ExportOutcome missing = manager.exportSong(SongRecord.of(9, "Nothing"), null, tempDir);
        final ExportOutcome written = manager.exportSong(SongRecord.of(4, "Single"), lyrics.get(4L), tempDir);

        assertThat(missing.status()).isEqualTo(EExportStatus.SKIPPED);
        assertThat(written.success()).isTrue();
    }

    @Test
    @DisplayName("Submitted jobs run on the executor and complete")
    void testSubmit() throws Exception {
        final ExportJob job = manager.submit(ExportRequest.of(
                List.of(SongRecord.of(1, "Here I Am"), SongRecord.of(2, "Blank")), lyricSource, tempDir));

        awaitQueue();

        assertThat(job.getStatus()).isEqualTo(EExportJobStatus.COMPLETED);
        assertThat(job.getResult().successes()).hasSize(1);
        assertThat(job.getResult().skipped()).hasSize(1);
        assertThat(manager.getJob(job.getId())).containsSame(job);
        assertThat(tracker.getProgressStatus().totalPercent()).isEqualTo(100);
    }

    @Test
    @DisplayName("Cancelled jobs do not export")
    void testCancel() throws Exception {
        final CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> {
            release.await(10, TimeUnit.SECONDS);
            return null;
        });

        final ExportJob job = manager.submit(ExportRequest.of(List.of(SongRecord.of(4, "Single")), lyricSource, tempDir));
        assertThat(manager.cancel(job.getId())).isTrue();
        release.countDown();

        awaitQueue();

        assertThat(job.getStatus()).isEqualTo(EExportJobStatus.CANCELLED);
        assertThat(tempDir.resolve("Single.pro6")).doesNotExist();
        assertThat(manager.cancel(job.getId())).isFalse();
        assertThat(manager.cancel(4711)).isFalse();
    }

    @Test
    @DisplayName("An empty job closes only its own progress batch")
    void testEmptyJobProgress() throws Exception {
        final List<String> events = new CopyOnWriteArrayList<>();
        tracker.setProgressCallback((total, batch) -> events.add(total + "/" + batch));
        final CountDownLatch release = new CountDownLatch(1);
        executor.submit(() -> {
            release.await(10, TimeUnit.SECONDS);
            return null;
        });

        final ExportJob empty = manager.submit(ExportRequest.of(List.of(), lyricSource, tempDir));
        final ExportJob single = manager.submit(ExportRequest.of(List.of(SongRecord.of(4, "Single")), lyricSource, tempDir));
        release.countDown();

        awaitQueue();

        assertThat(empty.getStatus()).isEqualTo(EExportJobStatus.COMPLETED);
        assertThat(single.getStatus()).isEqualTo(EExportJobStatus.COMPLETED);
        assertThat(events).containsExactly("0/0", "100/100", "100/100");
    }

    private void awaitQueue() throws Exception {
        // single worker: once this runs, everything queued before it has finished
        executor.submit(() -> {
        }).get(10, TimeUnit.SECONDS);
    }
}

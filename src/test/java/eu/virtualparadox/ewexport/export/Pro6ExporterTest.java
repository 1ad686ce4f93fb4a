package eu.virtualparadox.ewexport.export;

import eu.virtualparadox.ewexport.export.duplicate.DuplicateDecision;
import eu.virtualparadox.ewexport.export.duplicate.EDuplicateAction;
import eu.virtualparadox.ewexport.lyrics.cleaner.LyricTextCleaner;
import eu.virtualparadox.ewexport.lyrics.mapping.SectionMappingTable;
import eu.virtualparadox.ewexport.lyrics.parser.EasyWorshipRtfParser;
import eu.virtualparadox.ewexport.lyrics.section.DetectionResult;
import eu.virtualparadox.ewexport.lyrics.section.Section;
import eu.virtualparadox.ewexport.lyrics.section.SectionDetector;
import eu.virtualparadox.ewexport.song.SongRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Pro6Exporter}, including the full RTF to file path.
 */
class Pro6ExporterTest {

    @TempDir
    Path tempDir;

    private Pro6Exporter exporter;

    @BeforeEach
    void setUp() {
        exporter = newExporter(new Pro6DocumentBuilder(new Pro6TextEncoder(), new SlideSplitter()));
    }

    private static Pro6Exporter newExporter(final Pro6DocumentBuilder documentBuilder) {
        return new Pro6Exporter(documentBuilder, new Pro6XmlWriter(), new FilenameSanitizer());
    }

    private static List<Section> sections(final String content) {
        return List.of(new Section("Verse", content));
    }

    @Test
    @DisplayName("Songs without section content are rejected and nothing is written")
    void testNoData() throws IOException {
        final ExportOutcome outcome = exporter.exportSong(SongRecord.of(1, "Empty"), List.of(), tempDir,
                ExportOptions.defaults());

        assertThat(outcome.status()).isEqualTo(EExportStatus.FAILED);
        assertThat(outcome.message()).contains("No lyric content").contains("Empty");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("Single export creates the directory and overwrites")
    void testExportSong() {
        final Path destination = tempDir.resolve("nested").resolve("out");
        final SongRecord song = SongRecord.of(1, "Amazing Grace");

        final ExportOutcome first = exporter.exportSong(song, sections("Line"), destination, ExportOptions.defaults());
        final ExportOutcome second = exporter.exportSong(song, sections("Other"), destination, ExportOptions.defaults());

        assertThat(first.success()).isTrue();
        assertThat(first.path()).isEqualTo(destination.resolve("Amazing Grace.pro6"));
        assertThat(second.path()).isEqualTo(first.path());
        assertThat(first.path()).exists();
    }

    @Test
    @DisplayName("Write errors are reported per song")
    void testWriteError() throws IOException {
        final Path blocker = Files.createFile(tempDir.resolve("blocker"));

        final ExportOutcome outcome = exporter.exportSong(SongRecord.of(1, "Song"), sections("x"), blocker,
                ExportOptions.defaults());

        assertThat(outcome.status()).isEqualTo(EExportStatus.FAILED);
        assertThat(outcome.message()).isNotBlank();
    }

    @Test
    @DisplayName("RTF lyrics end up as two groups with one slide each")
    void testEndToEnd() throws Exception {
        final String rtf = "{\\rtf1\\ansi\\deff0{\\fonttbl{\\f0 Arial;}}\\f0 verse\\par Amazing grace\\par\\par "
                + "chorus\\par I once was lost\\par}";
        final String plain = new EasyWorshipRtfParser().parse(rtf).parsedText().plainText();
        final String clean = new LyricTextCleaner().clean(plain);
        final DetectionResult detection = new SectionDetector().detectSections(clean,
                SectionMappingTable.of(Map.of("verse", "Verse", "chorus", "Chorus")));

        final ExportOutcome outcome = exporter.exportSong(SongRecord.of(3, "Amazing Grace"), detection.sections(),
                tempDir, ExportOptions.defaults());

        assertThat(outcome.success()).isTrue();
        final String xml = Files.readString(outcome.path(), StandardCharsets.UTF_8);
        assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>");
        assertThat(xml).doesNotContainPattern("<array[^>]*/>");
        assertThat(xml).doesNotContainPattern("<dictionary[^>]*/>");

        final Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(outcome.path().toFile());
        final NodeList groups = document.getElementsByTagName("RVSlideGrouping");
        assertThat(groups.getLength()).isEqualTo(2);

        for (int i = 0; i < groups.getLength(); i++) {
            final Element group = (Element) groups.item(i);
            final NodeList slides = group.getElementsByTagName("RVDisplaySlide");
            assertThat(slides.getLength()).isEqualTo(1);

            final String plainText = plainTextOf((Element) slides.item(0));
            assertThat(plainText).isEqualTo(detection.sections().get(i).content());
        }
        assertThat(((Element) groups.item(0)).getAttribute("name")).isEqualTo("Verse");
        assertThat(((Element) groups.item(1)).getAttribute("name")).isEqualTo("Chorus");
    }

    @Test
    @DisplayName("Control characters in song metadata still give a readable document")
    void testControlCharactersInMetadata() throws Exception {
        final SongRecord song = new SongRecord(1, "Bad\u0001Title", "A\u0008uthor", "Copy\u001Fright",
                "", "", "", "line\u000Bbreak");

        final ExportOutcome outcome = exporter.exportSong(song, sections("x"), tempDir, ExportOptions.defaults());

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.path()).isEqualTo(tempDir.resolve("BadTitle.pro6"));
        final Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(outcome.path().toFile());
        final Element root = document.getDocumentElement();
        assertThat(root.getAttribute("CCLISongTitle")).isEqualTo("BadTitle");
        assertThat(root.getAttribute("CCLIAuthor")).isEqualTo("Author");
        assertThat(root.getAttribute("CCLICopyright")).isEqualTo("Copyright");
        assertThat(root.getAttribute("notes")).isEqualTo("linebreak");
    }

    private static String plainTextOf(final Element slide) {
        final NodeList strings = slide.getElementsByTagName("NSString");
        for (int i = 0; i < strings.getLength(); i++) {
            final Element string = (Element) strings.item(i);
            if ("PlainText".equals(string.getAttribute("rvXMLIvarName"))) {
                final byte[] bytes = Base64.getDecoder().decode(string.getTextContent().strip());
                return new String(bytes, StandardCharsets.UTF_8).replace("\r\n", "\n");
            }
        }
        throw new AssertionError("No PlainText payload");
    }

    @Test
    @DisplayName("Songs with the same file name are numbered when renaming")
    void testDuplicateAutoRename() {
        final ExportOptions options = ExportOptions.defaults().toBuilder()
                .duplicateAction(EDuplicateAction.RENAME)
                .build();
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "Same Song"), sections("First")),
                new ExportItem(SongRecord.of(2, "Same Song"), sections("Second")));

        final BatchExportResult result = exporter.exportBatch(items, tempDir, options, null, null);

        assertThat(result.successes()).containsExactly(
                tempDir.resolve("Same Song.pro6"),
                tempDir.resolve("Same Song_1.pro6"));
        assertThat(result.failures()).isEmpty();
        assertThat(tempDir.resolve("Same Song_1.pro6")).exists();
    }

    @Test
    @DisplayName("Existing files are skipped when nobody can be asked")
    void testDuplicateAskWithoutResolver() {
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "Same Song"), sections("First")),
                new ExportItem(SongRecord.of(2, "Same Song"), sections("Second")));

        final BatchExportResult result = exporter.exportBatch(items, tempDir, ExportOptions.defaults(), null, null);

        assertThat(result.successes()).hasSize(1);
        assertThat(result.skipped()).hasSize(1);
        assertThat(result.skipped().get(0)).contains("Same Song");
    }

    @Test
    @DisplayName("Cancel from the duplicate resolver stops the remaining songs")
    void testResolverCancel() {
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "A"), sections("a")),
                new ExportItem(SongRecord.of(2, "A"), sections("b")),
                new ExportItem(SongRecord.of(3, "C"), sections("c")));

        final BatchExportResult result = exporter.exportBatch(items, tempDir, ExportOptions.defaults(), null,
                (file, song) -> DuplicateDecision.of(EDuplicateAction.CANCEL));

        assertThat(result.cancelled()).isTrue();
        assertThat(result.successes()).containsExactly(tempDir.resolve("A.pro6"));
        assertThat(tempDir.resolve("C.pro6")).doesNotExist();
    }

    @Test
    @DisplayName("Cooperative cancellation is checked before every song")
    void testCancellation() {
        final AtomicInteger checks = new AtomicInteger();
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "One"), sections("1")),
                new ExportItem(SongRecord.of(2, "Two"), sections("2")));

        final BatchExportResult result = exporter.exportBatch(items, tempDir, ExportOptions.defaults(), null, null,
                () -> checks.getAndIncrement() >= 1);

        assertThat(result.cancelled()).isTrue();
        assertThat(result.successes()).containsExactly(tempDir.resolve("One.pro6"));
        assertThat(result.summary()).contains("Exported 1 song(s)").contains("cancelled");
    }

    @Test
    @DisplayName("Progress is reported after every song and at the end")
    void testProgress() {
        final List<String> events = new ArrayList<>();
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "One"), sections("1")),
                new ExportItem(SongRecord.of(2, "Two"), sections("2")));

        exporter.exportBatch(items, tempDir, ExportOptions.defaults(),
                (completed, total, title) -> events.add(completed + "/" + total + " " + title), null);

        assertThat(events).containsExactly("1/2 One", "2/2 Two", "2/2 Export complete");
    }

    @Test
    @DisplayName("An unexpected error fails one song and the batch continues")
    void testFailureIsolation() {
        final Pro6Exporter failing = newExporter(new Pro6DocumentBuilder(new Pro6TextEncoder(), new SlideSplitter()) {
            @Override
            public Document build(final SongRecord song, final List<Section> sections, final ExportOptions options) {
                if ("Boom".equals(song.title())) {
                    throw new IllegalStateException("renderer exploded");
                }
                return super.build(song, sections, options);
            }
        });
        final List<ExportItem> items = List.of(
                new ExportItem(SongRecord.of(1, "Fine"), sections("1")),
                new ExportItem(SongRecord.of(2, "Boom"), sections("2")),
                new ExportItem(SongRecord.of(3, "Also Fine"), sections("3")),
                new ExportItem(SongRecord.of(4, "No Content"), List.of()));

        final BatchExportResult result = failing.exportBatch(items, tempDir, ExportOptions.defaults(), null, null);

        assertThat(result.successes()).hasSize(2);
        assertThat(result.failures()).containsExactly(
                "Unexpected error exporting 'Boom' (id 2): renderer exploded",
                "No lyric content to export for 'No Content'");
        assertThat(result.summary()).startsWith("Exported 2 song(s), 2 failed");
    }
}

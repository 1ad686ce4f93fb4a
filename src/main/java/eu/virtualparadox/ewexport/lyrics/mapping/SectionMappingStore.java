package eu.virtualparadox.ewexport.lyrics.mapping;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import eu.virtualparadox.ewexport.application.config.ApplicationConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the section mapping document.
 *
 * <p>Every {@link #load()} returns a fresh immutable snapshot; callers that need a stable lexicon
 * for a whole batch keep the snapshot instead of reloading. On first use the document is created
 * from the bundled defaults.</p>
 */
@Service
@Slf4j
public class SectionMappingStore {

    public static final String DOCUMENT_VERSION = "1.0";

    private static final String DEFAULTS_RESOURCE = "/section_mappings.json";
    private static final String ERROR_READ = "Cannot read section mapping document: ";
    private static final String ERROR_WRITE = "Cannot write section mapping document: ";

    private final Path documentPath;
    private final ObjectMapper objectMapper;

    @Autowired
    public SectionMappingStore(final ApplicationConfig applicationConfig) {
        this(applicationConfig.getMappings());
    }

    public SectionMappingStore(final Path documentPath) {
        if (documentPath == null) {
            throw new IllegalArgumentException("documentPath must not be null");
        }
        this.documentPath = documentPath;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getDocumentPath() {
        return documentPath;
    }

    /**
     * Loads the current mapping table, creating the document with defaults if it does not exist.
     *
     * @throws IllegalStateException if the document cannot be read or created
     */
    public synchronized SectionMappingTable load() {
        if (!Files.exists(documentPath)) {
            log.info("Section mapping document {} not found, creating it with defaults", documentPath);
            save(defaults());
        }
        final SectionMappingTable table = read(documentPath);
        log.debug("Loaded {} section mappings from {}", table.size(), documentPath);
        return table;
    }

    /**
     * The lexicon bundled with the application.
     */
    public SectionMappingTable defaults() {
        try (InputStream is = SectionMappingStore.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                log.warn("Bundled mapping defaults missing, falling back to the English vocabulary");
                return LanguageLexicon.tableFor(List.of(LanguageLexicon.ENGLISH));
            }
            return objectMapper.readValue(is, SectionMappingDocument.class).toTable();
        } catch (IOException e) {
            throw new IllegalStateException(ERROR_READ + DEFAULTS_RESOURCE, e);
        }
    }

    public synchronized void save(final SectionMappingTable table) {
        write(documentPath, table);
        log.info("Saved {} section mappings to {}", table.size(), documentPath);
    }

    /**
     * Imports another mapping document.
     *
     * @param source document to import
     * @param merge  {@code true} to add only new terms (existing entries win), {@code false} to replace
     * @return the table now stored
     */
    public synchronized SectionMappingTable importFrom(final Path source, final boolean merge) {
        final SectionMappingTable imported = read(source);
        final SectionMappingTable result = merge ? load().withMappings(imported.asMap()) : imported;
        save(result);
        log.info("Imported {} mappings from {} ({})", imported.size(), source, merge ? "merged" : "replaced");
        return result;
    }

    public synchronized void exportTo(final Path target) {
        write(target, load());
    }

    private SectionMappingTable read(final Path path) {
        try {
            return objectMapper.readValue(path.toFile(), SectionMappingDocument.class).toTable();
        } catch (IOException e) {
            log.error("Failed to read section mappings from {}", path, e);
            throw new IllegalStateException(ERROR_READ + path, e);
        }
    }

    private void write(final Path path, final SectionMappingTable table) {
        try {
            final Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), SectionMappingDocument.fromTable(DOCUMENT_VERSION, table));
        } catch (IOException e) {
            log.error("Failed to write section mappings to {}", path, e);
            throw new IllegalStateException(ERROR_WRITE + path, e);
        }
    }
}

package eu.virtualparadox.ewexport.export.duplicate;

import eu.virtualparadox.ewexport.song.SongRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Decides the target file of each song when the natural file name is taken.
 *
 * <p>One instance per batch: a decision marked "apply to all" is remembered for the rest of the batch.
 * Custom renames are never remembered, a custom name belongs to one song.</p>
 */
@Slf4j
public class DuplicateHandler {

    private static final String ERROR_NO_FREE_NAME = "No free file name found for %s";
    private static final int MAX_RENAME_ATTEMPTS = 10_000;

    private final EDuplicateAction defaultAction;
    private final boolean overwriteExisting;
    private final String renamePattern;
    private final DuplicateResolver resolver;
    private final UnaryOperator<String> customNameSanitizer;

    private DuplicateDecision remembered;

    /**
     * @param defaultAction       configured action, {@link EDuplicateAction#ASK} consults the resolver
     * @param overwriteExisting   replace existing files without consulting anything
     * @param renamePattern       automatic rename pattern with {@code {name}} and {@code {number}}
     * @param resolver            interactive resolver, may be {@code null}
     * @param customNameSanitizer turns a user supplied name into a file name with extension
     */
    public DuplicateHandler(final EDuplicateAction defaultAction,
                            final boolean overwriteExisting,
                            final String renamePattern,
                            final DuplicateResolver resolver,
                            final UnaryOperator<String> customNameSanitizer) {
        this.defaultAction = defaultAction;
        this.overwriteExisting = overwriteExisting;
        this.renamePattern = renamePattern;
        this.resolver = resolver;
        this.customNameSanitizer = customNameSanitizer;
    }

    /**
     * Resolves the target for one song.
     *
     * @param target natural target path
     * @param song   song being exported, shown to the resolver
     */
    public DuplicateResolution resolve(final Path target, final SongRecord song) {
        if (!Files.exists(target) || overwriteExisting) {
            return DuplicateResolution.write(target);
        }

        final DuplicateDecision decision = decide(target, song);
        log.debug("Duplicate {} resolved with {}", target.getFileName(), decision.action());

        return switch (decision.action()) {
            case OVERWRITE -> DuplicateResolution.write(target);
            case SKIP -> DuplicateResolution.skip();
            case CANCEL -> DuplicateResolution.cancel();
            case RENAME -> DuplicateResolution.write(nextFreeName(target));
            case RENAME_CUSTOM -> {
                final Path custom = target.resolveSibling(customNameSanitizer.apply(decision.customName()));
                yield DuplicateResolution.write(Files.exists(custom) ? nextFreeName(custom) : custom);
            }
            case ASK -> throw new IllegalStateException("Unresolved duplicate decision");
        };
    }

    private DuplicateDecision decide(final Path target, final SongRecord song) {
        if (remembered != null) {
            return remembered;
        }
        if (defaultAction != EDuplicateAction.ASK) {
            return DuplicateDecision.of(defaultAction);
        }
        if (resolver == null) {
            log.warn("File {} exists and nobody can be asked, skipping '{}'", target, song.title());
            return DuplicateDecision.of(EDuplicateAction.SKIP);
        }

        final DuplicateDecision decision = resolver.resolve(target, song);
        if (decision == null) {
            return DuplicateDecision.of(EDuplicateAction.SKIP);
        }
        if (decision.applyToAll() && decision.action() != EDuplicateAction.RENAME_CUSTOM) {
            remembered = decision;
        }
        return decision;
    }

    /**
     * First {@code pattern(name, n)} for n = 1, 2, ... that does not exist yet.
     */
    Path nextFreeName(final Path target) {
        final String fileName = target.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        final String extension = dot > 0 ? fileName.substring(dot) : "";

        for (int number = 1; number <= MAX_RENAME_ATTEMPTS; number++) {
            final String candidate = StringUtils.replaceEach(renamePattern,
                    new String[]{"{name}", "{number}"},
                    new String[]{stem, String.valueOf(number)}) + extension;
            final Path path = target.resolveSibling(candidate);
            if (!Files.exists(path)) {
                return path;
            }
        }
        throw new IllegalStateException(String.format(ERROR_NO_FREE_NAME, target));
    }
}

package eu.virtualparadox.ewexport.export.duplicate;

import eu.virtualparadox.ewexport.song.SongRecord;

import java.nio.file.Path;

/**
 * Asks the user what to do with an already existing output file. Called synchronously
 * from the export thread.
 */
@FunctionalInterface
public interface DuplicateResolver {

    DuplicateDecision resolve(final Path existingFile, final SongRecord song);

}

package eu.virtualparadox.ewexport.lyrics.parser;

import java.util.Optional;

public interface LyricParser {

    ParseResult parse(final String rawLyrics);

    Optional<String> getLastError();

}

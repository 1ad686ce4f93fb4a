package eu.virtualparadox.ewexport.lyrics.parser;

/**
 * Raised by the RTF tokenizer when the markup is structurally broken.
 */
public class RtfParseException extends RuntimeException {

    public RtfParseException(final String message) {
        super(message);
    }
}

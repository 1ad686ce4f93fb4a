package eu.virtualparadox.ewexport.lyrics.parser;

public enum EParseStatus {
    CONTENT,
    EMPTY,
    FAILED
}

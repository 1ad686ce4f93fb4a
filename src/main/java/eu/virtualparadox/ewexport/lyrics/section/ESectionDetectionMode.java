package eu.virtualparadox.ewexport.lyrics.section;

public enum ESectionDetectionMode {
    /** Marker lines only. */
    STANDARD,
    /** Marker lines, then repeated-paragraph heuristics when no markers were found. */
    ADVANCED
}

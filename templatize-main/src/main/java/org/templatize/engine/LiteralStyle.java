package org.templatize.engine;

public enum LiteralStyle {
    /** Escape sequences are processed; single line. */
    REGULAR,
    /** Verbatim or raw form: no escape processing, may span lines. Never merged with neighbours. */
    RAW
}

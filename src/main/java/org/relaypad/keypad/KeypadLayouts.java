package org.relaypad.keypad;

import java.util.List;

/**
 * The two fixed keypads and their key symbols.
 */
public final class KeypadLayouts {

    public static final char ACTIVATE = 'A';
    public static final char UP = '^';
    public static final char DOWN = 'v';
    public static final char LEFT = '<';
    public static final char RIGHT = '>';

    static final char[] DIRECTIONAL_KEYS = {UP, DOWN, LEFT, RIGHT, ACTIVATE};

    public static final String DIRECTIONAL_ID = "DIRECTIONAL";
    public static final String NUMERIC_ID = "NUMERIC";

    /** Directional pad, gap at (0, 0). */
    public static final List<String> DIRECTIONAL_ROWS = List.of(
            " ^A",
            "<v>"
    );

    /** Numeric pad, gap at (0, 3). */
    public static final List<String> NUMERIC_ROWS = List.of(
            "789",
            "456",
            "123",
            " 0A"
    );

    public static final KeypadLayout DIRECTIONAL = KeypadLayout.fromRows(DIRECTIONAL_ID, DIRECTIONAL_ROWS);
    public static final KeypadLayout NUMERIC = KeypadLayout.fromRows(NUMERIC_ID, NUMERIC_ROWS);

    private KeypadLayouts() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}

package org.relaypad.complexity;

import org.relaypad.keypad.KeypadLayouts;

import java.util.Objects;

/**
 * A door code typed on the numeric keypad, such as {@code 029A}.
 *
 * @param code full code including the trailing activate key.
 * @param numericPart integer value of the leading digits ({@code 029A} gives 29).
 */
public record DoorCode(String code, long numericPart) {

    public DoorCode {
        Objects.requireNonNull(code, "code");
        if (numericPart < 0L) {
            throw new IllegalArgumentException("numericPart must be >= 0, got " + numericPart);
        }
    }

    /**
     * Parses a door code.
     *
     * <p>The code must end in the activate key; every other symbol must be a digit.</p>
     *
     * @param raw code text, surrounding whitespace ignored.
     * @return parsed code.
     */
    public static DoorCode parse(String raw) {
        String code = Objects.requireNonNull(raw, "code").trim();
        if (code.length() < 2 || code.charAt(code.length() - 1) != KeypadLayouts.ACTIVATE) {
            throw new IllegalArgumentException(
                    "door code must be digits followed by '" + KeypadLayouts.ACTIVATE + "': '" + code + "'"
            );
        }
        long value = 0L;
        for (int i = 0; i < code.length() - 1; i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') {
                throw new IllegalArgumentException("door code has non-digit '" + c + "' at " + i + ": '" + code + "'");
            }
            value = Math.addExact(Math.multiplyExact(value, 10L), c - '0');
        }
        return new DoorCode(code, value);
    }

    @Override
    public String toString() {
        return code;
    }
}

package org.relaypad.complexity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses newline-separated door codes. Blank lines are skipped.
 */
public final class CodeSheetParser {

    private CodeSheetParser() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Parses every non-blank line of {@code text} as a {@link DoorCode}.
     *
     * @throws IllegalArgumentException naming the 1-based line of the first invalid code.
     */
    public static List<DoorCode> parse(String text) {
        Objects.requireNonNull(text, "text");
        return parseLines(text.lines().toList());
    }

    /**
     * Parses pre-split lines.
     */
    public static List<DoorCode> parseLines(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        List<DoorCode> codes = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            try {
                codes.add(DoorCode.parse(line));
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new IllegalArgumentException("line " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return List.copyOf(codes);
    }
}

package org.relaypad.testutil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reference oracle: expands a target literally through every layer, keeping every candidate
 * string, and returns the shortest bottom-layer length. Exponential; only for small depths.
 * <p>
 * Candidates are all monotone paths that avoid the gap, including interleaved ones such as
 * {@code >^>^}, so the oracle does not assume the two-grouping restriction. Every monotone
 * path between two keys has the same length, so the last expansion only sums Manhattan
 * distances instead of materializing bottom-layer strings.
 * </p>
 */
public final class BruteForceExpansion {

    private static final List<String> DIRECTIONAL_ROWS = List.of(" ^A", "<v>");
    private static final List<String> NUMERIC_ROWS = List.of("789", "456", "123", " 0A");

    private BruteForceExpansion() {
    }

    public static long minimalPresses(String target, int depth) {
        if (depth == 0) {
            return target.length();
        }
        Set<String> current = new LinkedHashSet<>(List.of(target));
        for (int layer = depth; layer >= 2; layer--) {
            Keys keys = Keys.of(layer == depth ? NUMERIC_ROWS : DIRECTIONAL_ROWS);
            Set<String> next = new LinkedHashSet<>();
            for (String sequence : current) {
                next.addAll(expandOnce(sequence, keys));
            }
            current = next;
        }
        Keys bottom = Keys.of(depth == 1 ? NUMERIC_ROWS : DIRECTIONAL_ROWS);
        long best = Long.MAX_VALUE;
        for (String sequence : current) {
            best = Math.min(best, monotoneLength(sequence, bottom));
        }
        return best;
    }

    /**
     * Lists every monotone, gap-avoiding move string from {@code from} to {@code to}, each
     * terminated by the activate key.
     */
    public static List<String> monotonePaths(List<String> rows, char from, char to) {
        Keys keys = Keys.of(rows);
        List<String> paths = new ArrayList<>();
        collectPaths(keys.position(from), keys.position(to), keys.gap, new StringBuilder(), paths);
        return paths;
    }

    private static List<String> expandOnce(String sequence, Keys keys) {
        List<String> partials = List.of("");
        char previous = 'A';
        for (char c : sequence.toCharArray()) {
            List<String> options = new ArrayList<>();
            collectPaths(keys.position(previous), keys.position(c), keys.gap, new StringBuilder(), options);
            List<String> extended = new ArrayList<>();
            for (String partial : partials) {
                for (String option : options) {
                    extended.add(partial + option);
                }
            }
            partials = extended;
            previous = c;
        }
        return partials;
    }

    private static void collectPaths(int[] at, int[] to, int[] gap, StringBuilder path, List<String> out) {
        if (at[0] == gap[0] && at[1] == gap[1]) {
            return;
        }
        if (at[0] == to[0] && at[1] == to[1]) {
            out.add(path + "A");
            return;
        }
        if (at[0] != to[0]) {
            int step = to[0] > at[0] ? 1 : -1;
            path.append(step > 0 ? '>' : '<');
            collectPaths(new int[]{at[0] + step, at[1]}, to, gap, path, out);
            path.setLength(path.length() - 1);
        }
        if (at[1] != to[1]) {
            int step = to[1] > at[1] ? 1 : -1;
            path.append(step > 0 ? 'v' : '^');
            collectPaths(new int[]{at[0], at[1] + step}, to, gap, path, out);
            path.setLength(path.length() - 1);
        }
    }

    private static long monotoneLength(String sequence, Keys keys) {
        long length = 0;
        char previous = 'A';
        for (char c : sequence.toCharArray()) {
            int[] from = keys.position(previous);
            int[] to = keys.position(c);
            length += Math.abs(to[0] - from[0]) + Math.abs(to[1] - from[1]) + 1;
            previous = c;
        }
        return length;
    }

    private static final class Keys {
        private final Map<Character, int[]> positions;
        private final int[] gap;

        private Keys(Map<Character, int[]> positions, int[] gap) {
            this.positions = positions;
            this.gap = gap;
        }

        static Keys of(List<String> rows) {
            Map<Character, int[]> positions = new HashMap<>();
            int[] gap = null;
            for (int y = 0; y < rows.size(); y++) {
                for (int x = 0; x < rows.get(y).length(); x++) {
                    char c = rows.get(y).charAt(x);
                    if (c == ' ') {
                        gap = new int[]{x, y};
                    } else {
                        positions.put(c, new int[]{x, y});
                    }
                }
            }
            return new Keys(positions, gap);
        }

        int[] position(char symbol) {
            int[] position = positions.get(symbol);
            if (position == null) {
                throw new IllegalArgumentException("unknown key '" + symbol + "'");
            }
            return position;
        }
    }
}

package org.relaypad.chain.cost;

import org.relaypad.keypad.KeyPosition;
import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayouts;

import java.util.List;

/**
 * The two admissible orderings of the directional presses between two keys.
 *
 * <p>All horizontal presses are grouped into one run and all vertical presses into another;
 * interleaved orderings are never cheaper on a keypad steered by four direction keys and are
 * not considered.</p>
 */
public enum Grouping {
    /** Horizontal run, then vertical run. */
    HORIZONTAL_FIRST,
    /** Vertical run, then horizontal run. */
    VERTICAL_FIRST;

    private static final List<Grouping> BOTH = List.of(HORIZONTAL_FIRST, VERTICAL_FIRST);
    private static final List<Grouping> SINGLE = List.of(HORIZONTAL_FIRST);

    /**
     * Returns the distinct groupings for a move. Straight moves have only one.
     */
    public static List<Grouping> candidates(KeyPosition start, KeyPosition end) {
        if (start.x() == end.x() || start.y() == end.y()) {
            return SINGLE;
        }
        return BOTH;
    }

    /**
     * Returns true when any cell visited after {@code start} is the layout's gap cell.
     */
    public boolean crossesGap(KeypadLayout layout, KeyPosition start, KeyPosition end) {
        int x = start.x();
        int y = start.y();
        if (this == HORIZONTAL_FIRST) {
            return crossesRow(layout, x, end.x(), y) || crossesColumn(layout, y, end.y(), end.x());
        }
        return crossesColumn(layout, y, end.y(), x) || crossesRow(layout, x, end.x(), end.y());
    }

    /**
     * Returns the move presses for this grouping, terminated by the activate key.
     */
    public char[] moves(KeyPosition start, KeyPosition end) {
        int dx = end.x() - start.x();
        int dy = end.y() - start.y();
        int horizontal = Math.abs(dx);
        int vertical = Math.abs(dy);
        char horizontalKey = dx > 0 ? KeypadLayouts.RIGHT : KeypadLayouts.LEFT;
        char verticalKey = dy > 0 ? KeypadLayouts.DOWN : KeypadLayouts.UP;

        char[] out = new char[horizontal + vertical + 1];
        int cursor = 0;
        if (this == HORIZONTAL_FIRST) {
            cursor = fill(out, cursor, horizontalKey, horizontal);
            cursor = fill(out, cursor, verticalKey, vertical);
        } else {
            cursor = fill(out, cursor, verticalKey, vertical);
            cursor = fill(out, cursor, horizontalKey, horizontal);
        }
        out[cursor] = KeypadLayouts.ACTIVATE;
        return out;
    }

    private static int fill(char[] out, int cursor, char key, int count) {
        for (int i = 0; i < count; i++) {
            out[cursor++] = key;
        }
        return cursor;
    }

    // Cells strictly after fromX up to and including toX, on row y.
    private static boolean crossesRow(KeypadLayout layout, int fromX, int toX, int y) {
        int step = Integer.signum(toX - fromX);
        for (int x = fromX; x != toX; ) {
            x += step;
            if (layout.isGap(x, y)) {
                return true;
            }
        }
        return false;
    }

    private static boolean crossesColumn(KeypadLayout layout, int fromY, int toY, int x) {
        int step = Integer.signum(toY - fromY);
        for (int y = fromY; y != toY; ) {
            y += step;
            if (layout.isGap(x, y)) {
                return true;
            }
        }
        return false;
    }
}

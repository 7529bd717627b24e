package org.relaypad.chain.cost;

import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayouts;

import java.nio.CharBuffer;
import java.util.Objects;

/**
 * Reconstructs one concrete minimal press sequence from a finished table.
 * <p>
 * Each stored pair remembers its winning {@link Grouping}; expanding the target through the
 * winners layer by layer yields a bottom-layer press string whose length equals
 * {@link TransitionCostTable#sequenceCost(CharSequence)}. Output length grows geometrically with
 * depth, so this is a debugging path, not the cost path.
 * </p>
 */
public final class PressSequenceExpander {

    private static final int MAX_EXPANSION = Integer.MAX_VALUE - 8;

    private final TransitionCostTable table;

    public PressSequenceExpander(TransitionCostTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /**
     * Expands {@code target} into the presses of the physical hand.
     *
     * @param target symbols typed on the outermost keypad.
     * @return bottom-layer press string.
     */
    public String expand(CharSequence target) {
        return expand(target, table.sequenceCost(target));
    }

    /**
     * Expands {@code target} when its press count is already known from
     * {@link TransitionCostTable#sequenceCost(CharSequence)} on the same table.
     *
     * @param target symbols typed on the outermost keypad.
     * @param pressCount total press count of {@code target}.
     * @return bottom-layer press string.
     */
    public String expand(CharSequence target, long pressCount) {
        Objects.requireNonNull(target, "target");
        if (pressCount < 0) {
            throw new IllegalArgumentException("pressCount must be >= 0, got " + pressCount);
        }
        if (pressCount > MAX_EXPANSION) {
            throw new IllegalStateException("expansion of " + pressCount + " presses does not fit in a string");
        }
        StringBuilder out = new StringBuilder((int) pressCount);
        expandLayer(table.depth(), target, out);
        return out.toString();
    }

    private void expandLayer(int layer, CharSequence presses, StringBuilder out) {
        if (layer == 0) {
            out.append(presses);
            return;
        }
        LayerCostMatrix matrix = table.layer(layer);
        KeypadLayout layout = matrix.layout();
        char previous = KeypadLayouts.ACTIVATE;
        for (int i = 0; i < presses.length(); i++) {
            char next = presses.charAt(i);
            Grouping grouping = matrix.grouping(previous, next);
            char[] moves = grouping.moves(layout.positionOf(previous), layout.positionOf(next));
            expandLayer(layer - 1, CharBuffer.wrap(moves), out);
            previous = next;
        }
    }
}

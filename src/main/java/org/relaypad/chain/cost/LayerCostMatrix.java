package org.relaypad.chain.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayouts;

import java.util.Arrays;
import java.util.Objects;

/**
 * One finished layer of the transition-cost table.
 * <p>
 * Holds, for every ordered pair {@code (from, to)} of the layer's keypad, the minimal number of
 * bottom-layer presses needed to move the arm from {@code from} to {@code to} and press it,
 * together with the grouping that achieved it.
 * </p>
 * <p>
 * Storage is a flat row-major {@code |alphabet|²} arena. Immutable after construction, safe for
 * concurrent reads.
 * </p>
 */
@Accessors(fluent = true)
public final class LayerCostMatrix {

    @Getter
    private final int layer;
    @Getter
    private final KeypadLayout layout;
    private final int size;
    private final long[] costs;
    private final byte[] groupings;

    LayerCostMatrix(int layer, KeypadLayout layout, long[] costs, byte[] groupings) {
        if (layer < 1) {
            throw new IllegalArgumentException("layer must be >= 1, got " + layer);
        }
        this.layer = layer;
        this.layout = Objects.requireNonNull(layout, "layout");
        this.size = layout.size();
        if (costs.length != size * size || groupings.length != size * size) {
            throw new IllegalArgumentException(
                    "matrix arena must hold " + size * size + " pairs for keypad " + layout.id()
            );
        }
        this.costs = costs;
        this.groupings = groupings;
    }

    /**
     * Returns the transition cost between two symbols of this layer's keypad.
     *
     * @throws org.relaypad.core.id.SymbolIndex.UnknownSymbolException when either symbol is not on the keypad.
     */
    public long cost(char from, char to) {
        return costs[slot(layout.indexOf(from), layout.indexOf(to))];
    }

    /**
     * Index-based cost lookup for hot-path callers.
     */
    public long cost(int fromIndex, int toIndex) {
        return costs[checkedSlot(fromIndex, toIndex)];
    }

    /**
     * Returns the grouping that produced {@link #cost(char, char)}.
     */
    public Grouping grouping(char from, char to) {
        return Grouping.values()[groupings[slot(layout.indexOf(from), layout.indexOf(to))]];
    }

    /**
     * Charges a press sequence typed on this layer's keypad, starting from the activate key.
     *
     * @param presses symbols in press order.
     * @return sum of the transition costs of {@code "A" + presses}.
     */
    public long sequenceCost(CharSequence presses) {
        int previous = layout.indexOf(KeypadLayouts.ACTIVATE);
        long total = 0L;
        for (int i = 0; i < presses.length(); i++) {
            int next = layout.indexOf(presses.charAt(i));
            total = addPresses(total, costs[slot(previous, next)], "layer " + layer + " keypad " + layout.id());
            previous = next;
        }
        return total;
    }

    /**
     * Overflow-checked press addition.
     */
    static long addPresses(long left, long right, String context) {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException e) {
            throw new TransitionCostException(
                    TransitionCostException.REASON_PRESS_COUNT_OVERFLOW,
                    "press count exceeds 64-bit range on " + context,
                    e
            );
        }
    }

    private int slot(int fromIndex, int toIndex) {
        return fromIndex * size + toIndex;
    }

    private int checkedSlot(int fromIndex, int toIndex) {
        if (fromIndex < 0 || fromIndex >= size || toIndex < 0 || toIndex >= size) {
            throw new IndexOutOfBoundsException(
                    "pair (" + fromIndex + ", " + toIndex + ") out of range [0, " + size + ")"
            );
        }
        return slot(fromIndex, toIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LayerCostMatrix other = (LayerCostMatrix) o;
        return layer == other.layer
                && layout.id().equals(other.layout.id())
                && Arrays.equals(costs, other.costs)
                && Arrays.equals(groupings, other.groupings);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * layer + layout.id().hashCode()) + Arrays.hashCode(costs);
    }

    @Override
    public String toString() {
        return "LayerCostMatrix{layer=" + layer + ", keypad=" + layout.id() + "}";
    }
}

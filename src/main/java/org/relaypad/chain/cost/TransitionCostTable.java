package org.relaypad.chain.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.relaypad.keypad.KeypadLayout;

import java.util.List;
import java.util.Objects;

/**
 * Transition-cost table for a chain of a fixed depth.
 * <p>
 * Layer 0 is the physical hand and is not stored: every transition there costs
 * {@link #BASE_PRESS_COST}. Layers {@code 1..depth} are finished {@link LayerCostMatrix}
 * instances; layer {@code depth} is bound to the target keypad.
 * </p>
 */
@Accessors(fluent = true)
public final class TransitionCostTable {

    /** Cost of any layer-0 transition: one physical press. */
    public static final long BASE_PRESS_COST = 1L;

    private final List<LayerCostMatrix> layers;
    @Getter
    private final KeypadLayout targetLayout;

    TransitionCostTable(List<LayerCostMatrix> layers, KeypadLayout targetLayout) {
        this.layers = List.copyOf(Objects.requireNonNull(layers, "layers"));
        this.targetLayout = Objects.requireNonNull(targetLayout, "targetLayout");
        for (int i = 0; i < this.layers.size(); i++) {
            if (this.layers.get(i).layer() != i + 1) {
                throw new IllegalArgumentException(
                        "layer " + this.layers.get(i).layer() + " stored at position of layer " + (i + 1)
                );
            }
        }
        if (!this.layers.isEmpty() && this.layers.get(this.layers.size() - 1).layout() != targetLayout) {
            throw new IllegalArgumentException("top layer must be bound to target keypad " + targetLayout.id());
        }
    }

    /**
     * Number of indirection layers above the physical hand.
     */
    public int depth() {
        return layers.size();
    }

    /**
     * Returns the finished matrix of a stored layer.
     *
     * @param layer layer in {@code [1, depth]}.
     */
    public LayerCostMatrix layer(int layer) {
        if (layer < 1 || layer > layers.size()) {
            throw new IllegalArgumentException("layer out of range: " + layer + " [1, " + layers.size() + "]");
        }
        return layers.get(layer - 1);
    }

    /**
     * Returns {@code cost[layer][from][to]}. Layer 0 always costs {@link #BASE_PRESS_COST}.
     */
    public long cost(int layer, char from, char to) {
        if (layer == 0) {
            return BASE_PRESS_COST;
        }
        return layer(layer).cost(from, to);
    }

    /**
     * Minimal bottom-layer presses needed for the outermost operator to type {@code target}.
     *
     * <p>At depth 0 the operator is the physical hand, so each symbol costs one press. Symbols
     * are validated against the target keypad in both cases.</p>
     */
    public long sequenceCost(CharSequence target) {
        Objects.requireNonNull(target, "target");
        if (layers.isEmpty()) {
            for (int i = 0; i < target.length(); i++) {
                targetLayout.indexOf(target.charAt(i));
            }
            return target.length() * BASE_PRESS_COST;
        }
        return layers.get(layers.size() - 1).sequenceCost(target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TransitionCostTable other = (TransitionCostTable) o;
        return layers.equals(other.layers) && targetLayout.id().equals(other.targetLayout.id());
    }

    @Override
    public int hashCode() {
        return 31 * layers.hashCode() + targetLayout.id().hashCode();
    }

    @Override
    public String toString() {
        return "TransitionCostTable{depth=" + depth() + ", target=" + targetLayout.id() + "}";
    }
}

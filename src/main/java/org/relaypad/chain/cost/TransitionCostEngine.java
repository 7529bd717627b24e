package org.relaypad.chain.cost;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.relaypad.keypad.KeyPosition;
import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayouts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Layered transition-cost engine.
 * <p>
 * Builds the table bottom-up. For layer {@code L} bound to keypad {@code K}:
 * </p>
 * <pre>
 * cost[L][s][e] = min over groupings g not crossing K's gap of
 *                 sum over pairs (a,b) of "A" + moves(g)  of  (L &gt; 1 ? cost[L-1][a][b] : 1)
 * </pre>
 * <p>
 * Layers {@code 1..N-1} are bound to the directional keypad, layer {@code N} to the numeric
 * keypad. Layer {@code L} reads only the finished layer {@code L-1}, so every layer costs
 * {@code O(|K|²)} pair evaluations and the expanded press string is never built.
 * </p>
 */
@Accessors(fluent = true)
public final class TransitionCostEngine {

    private static final Logger log = LoggerFactory.getLogger(TransitionCostEngine.class);

    private static final long UNREACHABLE = -1L;

    @Getter
    private final KeypadLayout directionalLayout;
    @Getter
    private final KeypadLayout numericLayout;
    @Getter
    private final LayerEvaluationMode evaluationMode;

    /**
     * Creates an engine over the two fixed keypads with sequential layer evaluation.
     */
    public TransitionCostEngine() {
        this(KeypadLayouts.DIRECTIONAL, KeypadLayouts.NUMERIC, LayerEvaluationMode.SEQUENTIAL);
    }

    /**
     * Creates an engine over explicit keypads.
     *
     * @param directionalLayout keypad of every intermediate layer; must carry all direction keys.
     * @param numericLayout keypad of the outermost layer.
     * @param evaluationMode per-layer pair evaluation mode.
     */
    public TransitionCostEngine(
            KeypadLayout directionalLayout,
            KeypadLayout numericLayout,
            LayerEvaluationMode evaluationMode
    ) {
        this.directionalLayout = requireDirectional(Objects.requireNonNull(directionalLayout, "directionalLayout"));
        this.numericLayout = Objects.requireNonNull(numericLayout, "numericLayout");
        this.evaluationMode = Objects.requireNonNull(evaluationMode, "evaluationMode");
    }

    /**
     * Builds the full table for a chain depth.
     *
     * @param depth number of layers above the physical hand, {@code >= 0}.
     * @return finished table whose top layer is bound to the numeric keypad.
     */
    public TransitionCostTable buildTable(int depth) {
        requireDepth(depth);
        List<LayerCostMatrix> directionalLayers = extendDirectionalLayers(List.of(), Math.max(0, depth - 1));
        return assembleTable(directionalLayers, depth);
    }

    /**
     * Minimal bottom-layer presses to type {@code target} on the numeric keypad through
     * {@code depth} layers.
     */
    public long pressCount(CharSequence target, int depth) {
        return buildTable(depth).sequenceCost(target);
    }

    /**
     * Extends a directional layer prefix to {@code count} layers.
     * The returned list shares the finished matrices of {@code prefix}.
     *
     * @param prefix directional layers {@code 1..k}, possibly empty.
     * @param count requested number of directional layers.
     * @return immutable list of directional layers {@code 1..max(k, count)}.
     */
    public List<LayerCostMatrix> extendDirectionalLayers(List<LayerCostMatrix> prefix, int count) {
        Objects.requireNonNull(prefix, "prefix");
        if (count <= prefix.size()) {
            return List.copyOf(prefix);
        }
        List<LayerCostMatrix> layers = new ArrayList<>(prefix);
        LayerCostMatrix below = layers.isEmpty() ? null : layers.get(layers.size() - 1);
        for (int layer = layers.size() + 1; layer <= count; layer++) {
            below = computeLayer(layer, directionalLayout, below);
            layers.add(below);
        }
        log.debug("Extended directional layers from {} to {}", prefix.size(), count);
        return List.copyOf(layers);
    }

    /**
     * Assembles a table for {@code depth} from a directional prefix of at least
     * {@code depth - 1} layers, computing the numeric top layer.
     */
    public TransitionCostTable assembleTable(List<LayerCostMatrix> directionalLayers, int depth) {
        requireDepth(depth);
        Objects.requireNonNull(directionalLayers, "directionalLayers");
        if (depth == 0) {
            return new TransitionCostTable(List.of(), numericLayout);
        }
        if (directionalLayers.size() < depth - 1) {
            throw new IllegalArgumentException(
                    "depth " + depth + " needs " + (depth - 1) + " directional layers, got " + directionalLayers.size()
            );
        }
        List<LayerCostMatrix> layers = new ArrayList<>(directionalLayers.subList(0, depth - 1));
        LayerCostMatrix below = layers.isEmpty() ? null : layers.get(layers.size() - 1);
        layers.add(computeLayer(depth, numericLayout, below));
        return new TransitionCostTable(layers, numericLayout);
    }

    /**
     * Computes one finished layer.
     *
     * @param layer layer number, {@code >= 1}.
     * @param active keypad the layer's arm moves over.
     * @param below finished layer {@code layer - 1}, or null when {@code layer == 1}.
     * @return immutable layer matrix.
     * @throws TransitionCostException when a pair is unreachable or a cost overflows.
     */
    public LayerCostMatrix computeLayer(int layer, KeypadLayout active, LayerCostMatrix below) {
        Objects.requireNonNull(active, "active");
        if (layer < 1) {
            throw new IllegalArgumentException("layer must be >= 1, got " + layer);
        }
        if (layer == 1 && below != null) {
            throw new IllegalArgumentException("layer 1 sits on the physical hand and takes no lower matrix");
        }
        if (layer > 1) {
            Objects.requireNonNull(below, "below");
            if (below.layer() != layer - 1) {
                throw new IllegalArgumentException(
                        "layer " + layer + " must read layer " + (layer - 1) + ", got layer " + below.layer()
                );
            }
            requireDirectional(below.layout());
        }

        int size = active.size();
        long[] costs = new long[size * size];
        byte[] groupings = new byte[size * size];
        IntStream pairs = IntStream.range(0, size * size);
        if (evaluationMode == LayerEvaluationMode.PARALLEL) {
            pairs = pairs.parallel();
        }
        // Each pair writes only its own slot; the terminal operation joins before returning.
        pairs.forEach(slot -> evaluatePair(layer, active, below, slot, costs, groupings));

        log.debug("Computed layer {} on keypad {} ({} pairs, {})", layer, active.id(), size * size, evaluationMode);
        return new LayerCostMatrix(layer, active, costs, groupings);
    }

    private void evaluatePair(
            int layer,
            KeypadLayout active,
            LayerCostMatrix below,
            int slot,
            long[] costs,
            byte[] groupings
    ) {
        int size = active.size();
        int fromIndex = slot / size;
        int toIndex = slot % size;
        KeyPosition start = active.positionAt(fromIndex);
        KeyPosition end = active.positionAt(toIndex);

        long best = UNREACHABLE;
        Grouping winner = null;
        for (Grouping grouping : Grouping.candidates(start, end)) {
            if (grouping.crossesGap(active, start, end)) {
                continue;
            }
            long cost = chargeMoves(grouping.moves(start, end), below);
            if (best == UNREACHABLE || cost < best) {
                best = cost;
                winner = grouping;
            }
        }
        if (winner == null) {
            throw new TransitionCostException(
                    TransitionCostException.REASON_UNREACHABLE_TRANSITION,
                    "every grouping from '" + active.symbolAt(fromIndex) + "' to '" + active.symbolAt(toIndex)
                            + "' on keypad " + active.id() + " at layer " + layer + " crosses gap " + active.gap()
            );
        }
        costs[slot] = best;
        groupings[slot] = (byte) winner.ordinal();
    }

    /**
     * Charges a move string typed one layer down. Layer 0 is the physical hand.
     */
    private static long chargeMoves(char[] moves, LayerCostMatrix below) {
        if (below == null) {
            return moves.length * TransitionCostTable.BASE_PRESS_COST;
        }
        return below.sequenceCost(CharBuffer.wrap(moves));
    }

    private static KeypadLayout requireDirectional(KeypadLayout layout) {
        if (!layout.isDirectional()) {
            throw new TransitionCostException(
                    TransitionCostException.REASON_LAYOUT_MISMATCH,
                    "keypad " + layout.id() + " cannot steer another arm: it lacks direction or activate keys"
            );
        }
        return layout;
    }

    private static void requireDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0, got " + depth);
        }
    }
}

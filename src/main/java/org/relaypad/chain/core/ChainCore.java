package org.relaypad.chain.core;

import lombok.Builder;
import org.relaypad.chain.cost.LayerCostMatrix;
import org.relaypad.chain.cost.PressSequenceExpander;
import org.relaypad.chain.cost.TransitionCostEngine;
import org.relaypad.chain.cost.TransitionCostException;
import org.relaypad.chain.cost.TransitionCostTable;
import org.relaypad.keypad.KeypadLayout;
import org.relaypad.keypad.KeypadLayoutCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main press-count entry point.
 *
 * <p>The facade binds its keypads once at construction and validates every request before
 * any table work starts. Execution flow:</p>
 * <ul>
 * <li>Resolve the directional and numeric keypads from the catalog.</li>
 * <li>Validate request fields with stable reason codes.</li>
 * <li>Reuse the retained directional layer prefix, extending it when a deeper chain is asked for.</li>
 * <li>Compute the numeric top layer for the requested depth and charge the target.</li>
 * </ul>
 * <p>Unknown target symbols surface as
 * {@link org.relaypad.core.id.SymbolIndex.UnknownSymbolException}; table failures surface as
 * {@link TransitionCostException}.</p>
 */
public final class ChainCore implements ChainCostService {
    public static final String REASON_REQUEST_REQUIRED = "H_NULL_REQUEST";
    public static final String REASON_TARGET_REQUIRED = "H_NULL_TARGET";
    public static final String REASON_INVALID_DEPTH = "H_INVALID_DEPTH";
    public static final String REASON_UNKNOWN_LAYOUT = "H_UNKNOWN_LAYOUT";
    public static final String REASON_INVALID_CONFIG = "H_INVALID_CONFIG";
    public static final String REASON_EXPLAIN_LIMIT_EXCEEDED = "H_EXPLAIN_LIMIT_EXCEEDED";

    private static final Logger log = LoggerFactory.getLogger(ChainCore.class);

    private final ChainRuntimeConfig runtimeConfig;
    private final TransitionCostEngine engine;

    // Finished directional layers 1..k; replaced, never mutated.
    private volatile List<LayerCostMatrix> directionalLayers = List.of();
    private final ReentrantLock growthLock = new ReentrantLock();

    /**
     * Creates the chain facade.
     *
     * @param runtimeConfig runtime config; defaults to {@link ChainRuntimeConfig#defaultRuntime()}.
     * @param layoutCatalog keypad catalog; defaults to {@link KeypadLayoutCatalog#defaultCatalog()}.
     */
    @Builder
    public ChainCore(ChainRuntimeConfig runtimeConfig, KeypadLayoutCatalog layoutCatalog) {
        this.runtimeConfig = runtimeConfig == null ? ChainRuntimeConfig.defaultRuntime() : runtimeConfig;
        KeypadLayoutCatalog catalog = layoutCatalog == null ? KeypadLayoutCatalog.defaultCatalog() : layoutCatalog;
        if (this.runtimeConfig.getLayerEvaluationMode() == null) {
            throw new ChainCoreException(REASON_INVALID_CONFIG, "layerEvaluationMode must be set");
        }
        if (this.runtimeConfig.getMaxExplainPresses() <= 0L) {
            throw new ChainCoreException(
                    REASON_INVALID_CONFIG,
                    "maxExplainPresses must be > 0, got " + this.runtimeConfig.getMaxExplainPresses()
            );
        }

        KeypadLayout directional = resolveLayout(catalog, this.runtimeConfig.getDirectionalLayoutId(), "directionalLayoutId");
        KeypadLayout numeric = resolveLayout(catalog, this.runtimeConfig.getNumericLayoutId(), "numericLayoutId");
        this.engine = new TransitionCostEngine(directional, numeric, this.runtimeConfig.getLayerEvaluationMode());
        log.debug("Bound chain core to keypads {} / {}", directional.id(), numeric.id());
    }

    /**
     * Creates a chain facade over the default runtime.
     */
    public static ChainCore defaultCore() {
        return new ChainCore(null, null);
    }

    /**
     * Computes the minimal physical press count.
     *
     * @throws ChainCoreException when request contracts fail.
     */
    @Override
    public ChainResponse pressCount(ChainRequest request) {
        validate(request);
        long presses = table(request.getDepth()).sequenceCost(request.getTargetSequence());
        return ChainResponse.builder()
                .targetSequence(request.getTargetSequence())
                .depth(request.getDepth())
                .pressCount(presses)
                .build();
    }

    /**
     * Computes the press count and expands one concrete minimal press sequence.
     *
     * @throws ChainCoreException when request contracts fail or the expansion would exceed
     *                            {@link ChainRuntimeConfig#getMaxExplainPresses()}.
     */
    @Override
    public PressPlan explain(ChainRequest request) {
        validate(request);
        TransitionCostTable table = table(request.getDepth());
        long presses = table.sequenceCost(request.getTargetSequence());
        if (presses > runtimeConfig.getMaxExplainPresses()) {
            throw new ChainCoreException(
                    REASON_EXPLAIN_LIMIT_EXCEEDED,
                    "expansion of " + presses + " presses exceeds limit " + runtimeConfig.getMaxExplainPresses()
            );
        }
        String bottom = new PressSequenceExpander(table).expand(request.getTargetSequence(), presses);
        return new PressPlan(request.getTargetSequence(), request.getDepth(), presses, bottom);
    }

    /**
     * Returns the table for a depth, sharing the retained directional prefix.
     */
    @Override
    public TransitionCostTable table(int depth) {
        if (depth < 0) {
            throw new ChainCoreException(REASON_INVALID_DEPTH, "depth must be >= 0, got " + depth);
        }
        return engine.assembleTable(directionalPrefix(depth - 1), depth);
    }

    /**
     * Number of directional layers currently retained.
     */
    public int retainedDirectionalLayers() {
        return directionalLayers.size();
    }

    public ChainRuntimeConfig runtimeConfig() {
        return runtimeConfig;
    }

    private List<LayerCostMatrix> directionalPrefix(int count) {
        List<LayerCostMatrix> current = directionalLayers;
        if (current.size() >= count) {
            return current;
        }
        growthLock.lock();
        try {
            current = directionalLayers;
            if (current.size() < count) {
                current = engine.extendDirectionalLayers(current, count);
                directionalLayers = current;
            }
            return current;
        } finally {
            growthLock.unlock();
        }
    }

    private static void validate(ChainRequest request) {
        if (request == null) {
            throw new ChainCoreException(REASON_REQUEST_REQUIRED, "request must be provided");
        }
        if (request.getTargetSequence() == null) {
            throw new ChainCoreException(REASON_TARGET_REQUIRED, "targetSequence must be provided");
        }
        if (request.getDepth() < 0) {
            throw new ChainCoreException(REASON_INVALID_DEPTH, "depth must be >= 0, got " + request.getDepth());
        }
    }

    private static KeypadLayout resolveLayout(KeypadLayoutCatalog catalog, String layoutId, String fieldName) {
        KeypadLayout layout = catalog.layout(layoutId);
        if (layout == null) {
            throw new ChainCoreException(
                    REASON_UNKNOWN_LAYOUT,
                    fieldName + " '" + layoutId + "' is not registered; known: " + catalog.layoutIds()
            );
        }
        return layout;
    }
}

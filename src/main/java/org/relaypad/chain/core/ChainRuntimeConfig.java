package org.relaypad.chain.core;

import lombok.Builder;
import lombok.Value;
import org.relaypad.chain.cost.LayerEvaluationMode;
import org.relaypad.keypad.KeypadLayouts;

/**
 * Runtime configuration bound once when a {@link ChainCore} is constructed.
 */
@Value
@Builder(toBuilder = true)
public class ChainRuntimeConfig {

    public static final long DEFAULT_MAX_EXPLAIN_PRESSES = 1_000_000L;

    /**
     * Catalog id of the keypad used by every intermediate layer.
     */
    String directionalLayoutId;

    /**
     * Catalog id of the keypad used by the outermost layer.
     */
    String numericLayoutId;

    /**
     * Per-layer pair evaluation mode.
     */
    LayerEvaluationMode layerEvaluationMode;

    /**
     * Largest press count {@link ChainCore#explain(ChainRequest)} will expand.
     */
    long maxExplainPresses;

    /**
     * Returns the default runtime over the two fixed keypads.
     */
    public static ChainRuntimeConfig defaultRuntime() {
        return ChainRuntimeConfig.builder()
                .directionalLayoutId(KeypadLayouts.DIRECTIONAL_ID)
                .numericLayoutId(KeypadLayouts.NUMERIC_ID)
                .layerEvaluationMode(LayerEvaluationMode.SEQUENTIAL)
                .maxExplainPresses(DEFAULT_MAX_EXPLAIN_PRESSES)
                .build();
    }

    /**
     * Returns the default runtime with parallel layer evaluation.
     */
    public static ChainRuntimeConfig parallelRuntime() {
        return defaultRuntime().toBuilder()
                .layerEvaluationMode(LayerEvaluationMode.PARALLEL)
                .build();
    }
}

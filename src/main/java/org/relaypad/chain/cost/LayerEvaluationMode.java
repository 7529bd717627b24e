package org.relaypad.chain.cost;

/**
 * How the independent pairs of one layer are evaluated.
 *
 * <p>{@code SEQUENTIAL} walks the pairs on the calling thread.</p>
 * <p>{@code PARALLEL} fans the pairs out on the common fork-join pool and joins before the next
 * layer starts.</p>
 */
public enum LayerEvaluationMode {
    SEQUENTIAL,
    PARALLEL
}

package org.relaypad.chain.core;

import lombok.Builder;
import lombok.Value;

/**
 * Client-facing press-count request.
 *
 * <p>The target is typed on the numeric keypad by the outermost operator; the arm starts
 * on the activate key.</p>
 */
@Value
@Builder
public class ChainRequest {
    /** Numeric-keypad symbols to type, normally ending in {@code A}. */
    String targetSequence;
    /** Number of indirection layers above the physical hand. */
    int depth;
}

package org.relaypad.chain.core;

import lombok.Builder;
import lombok.Value;

/**
 * Minimal press count for one request.
 */
@Value
@Builder
public class ChainResponse {
    String targetSequence;
    int depth;
    /** Minimal number of physical presses at layer 0. */
    long pressCount;
}

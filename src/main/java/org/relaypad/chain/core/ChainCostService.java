package org.relaypad.chain.core;

import org.relaypad.chain.cost.TransitionCostTable;

/**
 * Public press-count service contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded runtime exceptions for contract failures.</p>
 */
public interface ChainCostService {
    /**
     * Computes the minimal physical press count for one request.
     *
     * @param request target sequence and chain depth.
     * @return response carrying the press count.
     */
    ChainResponse pressCount(ChainRequest request);

    /**
     * Computes the press count and one concrete minimal press sequence.
     *
     * @param request target sequence and chain depth.
     * @return explained plan.
     */
    PressPlan explain(ChainRequest request);

    /**
     * Returns the finished transition-cost table for a depth.
     *
     * @param depth chain depth, {@code >= 0}.
     * @return immutable table.
     */
    TransitionCostTable table(int depth);
}

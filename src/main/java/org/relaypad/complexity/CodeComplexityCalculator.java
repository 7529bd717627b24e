package org.relaypad.complexity;

import org.relaypad.chain.core.ChainCostService;
import org.relaypad.chain.core.ChainRequest;
import org.relaypad.chain.cost.TransitionCostException;

import java.util.List;
import java.util.Objects;

/**
 * Door-code complexity: minimal physical press count times the code's numeric part.
 */
public final class CodeComplexityCalculator {

    private final ChainCostService chainCostService;

    public CodeComplexityCalculator(ChainCostService chainCostService) {
        this.chainCostService = Objects.requireNonNull(chainCostService, "chainCostService");
    }

    /**
     * Complexity of one code at a chain depth.
     */
    public long complexity(DoorCode code, int depth) {
        Objects.requireNonNull(code, "code");
        long presses = chainCostService.pressCount(ChainRequest.builder()
                .targetSequence(code.code())
                .depth(depth)
                .build()).getPressCount();
        try {
            return Math.multiplyExact(presses, code.numericPart());
        } catch (ArithmeticException e) {
            throw new TransitionCostException(
                    TransitionCostException.REASON_PRESS_COUNT_OVERFLOW,
                    "complexity of " + code + " at depth " + depth + " exceeds 64-bit range",
                    e
            );
        }
    }

    /**
     * Sum of complexities of all codes at a chain depth.
     */
    public long totalComplexity(List<DoorCode> codes, int depth) {
        Objects.requireNonNull(codes, "codes");
        long total = 0L;
        for (DoorCode code : codes) {
            try {
                total = Math.addExact(total, complexity(code, depth));
            } catch (ArithmeticException e) {
                throw new TransitionCostException(
                        TransitionCostException.REASON_PRESS_COUNT_OVERFLOW,
                        "total complexity at depth " + depth + " exceeds 64-bit range",
                        e
                );
            }
        }
        return total;
    }
}

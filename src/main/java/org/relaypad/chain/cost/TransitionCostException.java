package org.relaypad.chain.cost;

import org.relaypad.core.error.ReasonCodedException;

/**
 * Thrown when a transition-cost layer or a press total cannot be computed.
 */
public final class TransitionCostException extends ReasonCodedException {

    /** Both groupings of a pair cross the gap cell. */
    public static final String REASON_UNREACHABLE_TRANSITION = "H_UNREACHABLE_TRANSITION";
    /** A press count does not fit in a signed 64-bit integer. */
    public static final String REASON_PRESS_COUNT_OVERFLOW = "H_PRESS_COUNT_OVERFLOW";
    /** A layer was bound to a keypad that cannot play its role. */
    public static final String REASON_LAYOUT_MISMATCH = "H_LAYOUT_MISMATCH";

    public TransitionCostException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public TransitionCostException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}

package org.relaypad.chain.core;

import org.relaypad.core.error.ReasonCodedException;

/**
 * Request or runtime-config contract failure raised by {@link ChainCore}.
 *
 * <p>Reason codes are the {@code REASON_*} constants of {@link ChainCore}.</p>
 */
public final class ChainCoreException extends ReasonCodedException {

    public ChainCoreException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ChainCoreException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}

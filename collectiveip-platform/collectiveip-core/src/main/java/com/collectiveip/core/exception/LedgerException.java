package com.collectiveip.core.exception;

import java.util.Objects;

/**
 * Base class of every failure raised by the collective ledger.
 * <p>
 * A thrown {@code LedgerException} always means the whole operation was aborted and no state
 * change is visible to later calls.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorReason reason;

    protected LedgerException(ErrorReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
        if (reason.category() != category()) {
            throw new IllegalArgumentException(
                    "Reason " + reason + " does not belong to category " + category());
        }
    }

    public ErrorReason reason() {
        return reason;
    }

    public abstract ErrorCategory category();
}

package com.collectiveip.core.exception;

/**
 * Thrown when a share, accumulated revenue, balance or allowance is too low.
 */
public class InsufficientFundsException extends LedgerException {

    public InsufficientFundsException(ErrorReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.INSUFFICIENT_FUNDS;
    }
}

package com.collectiveip.core.exception;

/**
 * Thrown when a mutating call arrives while another one is still executing.
 */
public class ReentrancyException extends LedgerException {

    public ReentrancyException(ErrorReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.REENTRANCY;
    }
}

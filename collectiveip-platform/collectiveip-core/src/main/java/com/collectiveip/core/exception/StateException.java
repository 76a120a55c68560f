package com.collectiveip.core.exception;

/**
 * Thrown when an operation is not valid for the current state of its target.
 */
public class StateException extends LedgerException {

    public StateException(ErrorReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.STATE;
    }
}

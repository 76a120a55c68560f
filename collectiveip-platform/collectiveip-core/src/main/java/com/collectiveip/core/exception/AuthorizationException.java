package com.collectiveip.core.exception;

/**
 * Thrown when the caller lacks the role an operation requires.
 */
public class AuthorizationException extends LedgerException {

    public AuthorizationException(ErrorReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.AUTHORIZATION;
    }
}

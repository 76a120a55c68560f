package com.collectiveip.core.exception;

/**
 * Thrown for malformed input: array shapes, out-of-range numbers, bad addresses.
 */
public class ValidationException extends LedgerException {

    public ValidationException(ErrorReason reason, String message) {
        super(reason, message);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }
}

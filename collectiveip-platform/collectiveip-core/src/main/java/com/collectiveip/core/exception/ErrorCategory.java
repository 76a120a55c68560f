package com.collectiveip.core.exception;

/**
 * Top-level failure classes of the ledger. Every {@link ErrorReason} belongs to exactly one.
 */
public enum ErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    STATE,
    INSUFFICIENT_FUNDS,
    REENTRANCY
}

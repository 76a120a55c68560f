package com.collectiveip.core.exception;

/**
 * Stable failure reasons surfaced by every ledger operation.
 * <p>
 * The enum constant name is the wire code returned to callers; it must not be renamed.
 */
public enum ErrorReason {

    // ==================== Validation ====================
    ARRAY_LENGTH_MISMATCH(ErrorCategory.VALIDATION),
    EMPTY_OWNER_SET(ErrorCategory.VALIDATION),
    DUPLICATE_OWNER(ErrorCategory.VALIDATION),
    PERCENTAGE_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    PERCENTAGES_NOT_100(ErrorCategory.VALIDATION),
    NEGATIVE_WEIGHT(ErrorCategory.VALIDATION),
    INVALID_ADDRESS(ErrorCategory.VALIDATION),
    SELF_TRANSFER(ErrorCategory.VALIDATION),
    MISSING_FIELD(ErrorCategory.VALIDATION),
    NON_POSITIVE_AMOUNT(ErrorCategory.VALIDATION),
    NEGATIVE_AMOUNT(ErrorCategory.VALIDATION),
    BELOW_MINIMUM_DISTRIBUTION(ErrorCategory.VALIDATION),
    UNKNOWN_CURRENCY(ErrorCategory.VALIDATION),
    ROYALTY_RATE_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    INVALID_DURATION(ErrorCategory.VALIDATION),
    QUORUM_OUT_OF_RANGE(ErrorCategory.VALIDATION),
    EMERGENCY_QUORUM_ABOVE_DEFAULT(ErrorCategory.VALIDATION),
    EXECUTION_DELAY_TOO_SHORT(ErrorCategory.VALIDATION),
    EMPTY_PROPOSAL_PAYLOAD(ErrorCategory.VALIDATION),
    WRONG_PROPOSAL_CATEGORY(ErrorCategory.VALIDATION),
    LICENSE_NOT_OF_ASSET(ErrorCategory.VALIDATION),
    LICENSEE_IS_LICENSOR(ErrorCategory.VALIDATION),

    // ==================== Authorization ====================
    NOT_ASSET_OWNER(ErrorCategory.AUTHORIZATION),
    NOT_SHARE_HOLDER(ErrorCategory.AUTHORIZATION),
    NOT_LICENSEE(ErrorCategory.AUTHORIZATION),
    NOT_PROPOSER(ErrorCategory.AUTHORIZATION),
    NOT_ADMINISTRATOR(ErrorCategory.AUTHORIZATION),

    // ==================== State ====================
    ASSET_NOT_FOUND(ErrorCategory.STATE),
    LICENSE_NOT_FOUND(ErrorCategory.STATE),
    PROPOSAL_NOT_FOUND(ErrorCategory.STATE),
    APPROVAL_NOT_REQUIRED(ErrorCategory.STATE),
    APPROVAL_ALREADY_RESOLVED(ErrorCategory.STATE),
    LICENSE_NOT_APPROVED(ErrorCategory.STATE),
    LICENSE_ALREADY_ACTIVE(ErrorCategory.STATE),
    LICENSE_NOT_ACTIVE(ErrorCategory.STATE),
    LICENSE_REVOKED(ErrorCategory.STATE),
    LICENSE_SUSPENDED(ErrorCategory.STATE),
    LICENSE_NOT_SUSPENDED(ErrorCategory.STATE),
    SUSPENSION_NOT_ELAPSED(ErrorCategory.STATE),
    LICENSE_EXPIRED(ErrorCategory.STATE),
    LICENSE_NEVER_ACTIVATED(ErrorCategory.STATE),
    USAGE_CAP_EXCEEDED(ErrorCategory.STATE),
    PROPOSAL_ALREADY_EXECUTED(ErrorCategory.STATE),
    PROPOSAL_CANCELLED(ErrorCategory.STATE),
    ALREADY_VOTED(ErrorCategory.STATE),
    VOTING_CLOSED(ErrorCategory.STATE),
    VOTING_STILL_OPEN(ErrorCategory.STATE),
    EXECUTION_WINDOW_PASSED(ErrorCategory.STATE),
    QUORUM_NOT_REACHED(ErrorCategory.STATE),
    MAJORITY_NOT_REACHED(ErrorCategory.STATE),
    SYSTEM_PAUSED(ErrorCategory.STATE),
    SYSTEM_NOT_PAUSED(ErrorCategory.STATE),

    // ==================== Funds ====================
    INSUFFICIENT_SHARE(ErrorCategory.INSUFFICIENT_FUNDS),
    INSUFFICIENT_ACCUMULATED_REVENUE(ErrorCategory.INSUFFICIENT_FUNDS),
    NOTHING_TO_WITHDRAW(ErrorCategory.INSUFFICIENT_FUNDS),
    INSUFFICIENT_BALANCE(ErrorCategory.INSUFFICIENT_FUNDS),
    INSUFFICIENT_ALLOWANCE(ErrorCategory.INSUFFICIENT_FUNDS),

    // ==================== Reentrancy ====================
    REENTRANT_CALL(ErrorCategory.REENTRANCY);

    private final ErrorCategory category;

    ErrorReason(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}

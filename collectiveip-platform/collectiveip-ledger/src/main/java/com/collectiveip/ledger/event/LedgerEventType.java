package com.collectiveip.ledger.event;

/**
 * Types of events published by the ledger after a call commits.
 */
public enum LedgerEventType {
    // Ownership events
    ASSET_REGISTERED,
    OWNERSHIP_REGISTERED,
    SHARE_TRANSFERRED,
    METADATA_UPDATED,
    COMPLIANCE_STATUS_UPDATED,
    SUPPLY_MINTED,

    // Revenue events
    REVENUE_RECEIVED,
    REVENUE_DISTRIBUTED,
    REVENUE_WITHDRAWN,
    MINIMUM_DISTRIBUTION_SET,
    FEE_ROUTED,

    // License events
    LICENSE_OFFERED,
    LICENSE_APPROVED,
    LICENSE_REJECTED,
    LICENSE_EXECUTED,
    LICENSE_REVOKED,
    LICENSE_SUSPENDED,
    LICENSE_REACTIVATED,
    LICENSE_TRANSFERRED,
    USAGE_REPORTED,
    ROYALTIES_PAID,
    LICENSE_PROPOSAL_CREATED,
    LICENSE_PROPOSAL_VOTED,
    LICENSE_PROPOSAL_EXECUTED,

    // Governance events
    PROPOSAL_CREATED,
    VOTE_CAST,
    PROPOSAL_EXECUTED,
    PROPOSAL_CANCELLED,
    GOVERNANCE_SETTINGS_UPDATED,

    // System events
    SYSTEM_PAUSED,
    SYSTEM_UNPAUSED,

    // Wildcard for subscribing to all events
    ALL
}

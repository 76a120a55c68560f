package com.collectiveip.core.domain;

/**
 * Derived status of a license, evaluated in declaration order against the current time.
 */
public enum LicenseStatus {
    NOT_FOUND,
    REJECTED,
    PENDING_APPROVAL,
    REVOKED,
    INACTIVE,
    SUSPENDED,
    SUSPENSION_EXPIRED,
    EXPIRED,
    ACTIVE
}

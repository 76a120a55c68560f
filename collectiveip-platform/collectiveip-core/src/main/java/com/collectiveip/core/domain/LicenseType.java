package com.collectiveip.core.domain;

/**
 * Exclusivity of a license grant.
 */
public enum LicenseType {
    EXCLUSIVE,
    SOLE_EXCLUSIVE,
    NON_EXCLUSIVE;

    /**
     * Exclusive grants always need an explicit owner decision before they can be executed.
     */
    public boolean alwaysRequiresApproval() {
        return this != NON_EXCLUSIVE;
    }
}

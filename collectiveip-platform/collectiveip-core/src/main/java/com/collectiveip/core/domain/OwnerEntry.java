package com.collectiveip.core.domain;

import java.util.Objects;

/**
 * One address's stake in an asset: its economic percentage and its governance weight.
 * <p>
 * The two values move independently. An entry whose percentage drops to zero keeps its
 * membership flag so it stays in the asset's owner enumeration.
 */
public class OwnerEntry {

    private String owner;
    private int percentage;
    private long governanceWeight;
    private boolean member;

    private OwnerEntry() {}

    public static OwnerEntry create(String owner, int percentage, long governanceWeight) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("Percentage must be within 0..100");
        }
        if (governanceWeight < 0) {
            throw new IllegalArgumentException("Governance weight cannot be negative");
        }
        var entry = new OwnerEntry();
        entry.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        entry.percentage = percentage;
        entry.governanceWeight = governanceWeight;
        entry.member = true;
        return entry;
    }

    public void debit(int percentageDelta, long weightDelta) {
        if (percentageDelta > percentage) {
            throw new IllegalStateException("Cannot debit more percentage than held");
        }
        if (weightDelta > governanceWeight) {
            throw new IllegalStateException("Cannot debit more weight than held");
        }
        this.percentage -= percentageDelta;
        this.governanceWeight -= weightDelta;
    }

    public void credit(int percentageDelta, long weightDelta) {
        if (percentage + percentageDelta > 100) {
            throw new IllegalStateException("Percentage cannot exceed 100");
        }
        this.percentage += percentageDelta;
        this.governanceWeight += weightDelta;
    }

    /**
     * Holds a non-zero economic share, which is what grants owner rights.
     */
    public boolean holdsShare() {
        return member && percentage > 0;
    }

    public OwnerEntry copy() {
        var copy = new OwnerEntry();
        copy.owner = owner;
        copy.percentage = percentage;
        copy.governanceWeight = governanceWeight;
        copy.member = member;
        return copy;
    }

    public String getOwner() { return owner; }
    public int getPercentage() { return percentage; }
    public long getGovernanceWeight() { return governanceWeight; }
    public boolean isMember() { return member; }
}

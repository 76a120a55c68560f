package com.collectiveip.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Revenue credited to one owner of one asset in one currency and not yet withdrawn.
 */
public class PendingBalance {

    private long assetId;
    private String owner;
    private String currency;
    private BigInteger pending;
    private BigInteger totalEarned;
    private BigInteger totalWithdrawn;
    private long lastWithdrawalAt;

    private PendingBalance() {}

    public static PendingBalance open(long assetId, String owner, String currency) {
        var balance = new PendingBalance();
        balance.assetId = assetId;
        balance.owner = Objects.requireNonNull(owner, "Owner cannot be null");
        balance.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        balance.pending = BigInteger.ZERO;
        balance.totalEarned = BigInteger.ZERO;
        balance.totalWithdrawn = BigInteger.ZERO;
        return balance;
    }

    public void credit(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Credit cannot be negative");
        }
        this.pending = pending.add(amount);
        this.totalEarned = totalEarned.add(amount);
    }

    /**
     * Zeroes the pending amount.
     *
     * @return the amount that was pending
     */
    public BigInteger withdrawAll(long at) {
        BigInteger amount = pending;
        this.pending = BigInteger.ZERO;
        this.totalWithdrawn = totalWithdrawn.add(amount);
        this.lastWithdrawalAt = at;
        return amount;
    }

    public PendingBalance copy() {
        var copy = new PendingBalance();
        copy.assetId = assetId;
        copy.owner = owner;
        copy.currency = currency;
        copy.pending = pending;
        copy.totalEarned = totalEarned;
        copy.totalWithdrawn = totalWithdrawn;
        copy.lastWithdrawalAt = lastWithdrawalAt;
        return copy;
    }

    public long getAssetId() { return assetId; }
    public String getOwner() { return owner; }
    public String getCurrency() { return currency; }
    public BigInteger getPending() { return pending; }
    public BigInteger getTotalEarned() { return totalEarned; }
    public BigInteger getTotalWithdrawn() { return totalWithdrawn; }
    public long getLastWithdrawalAt() { return lastWithdrawalAt; }
}

package com.collectiveip.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Pool accounting for one (asset, currency) pair.
 * <p>
 * {@code accumulated == totalReceived - totalDistributed} after every mutation. Rounding residue
 * from pro-rata splits stays in {@code accumulated} and can be distributed later.
 */
public class RevenueAccount {

    private long assetId;
    private String currency;
    private BigInteger totalReceived;
    private BigInteger totalDistributed;
    private BigInteger accumulated;
    private BigInteger minimumDistribution;
    private long distributionCount;
    private long lastDistributionAt;
    private long routedPaymentCount;

    private RevenueAccount() {}

    public static RevenueAccount open(long assetId, String currency) {
        var account = new RevenueAccount();
        account.assetId = assetId;
        account.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        account.totalReceived = BigInteger.ZERO;
        account.totalDistributed = BigInteger.ZERO;
        account.accumulated = BigInteger.ZERO;
        account.minimumDistribution = BigInteger.ZERO;
        return account;
    }

    public void recordReceipt(BigInteger amount) {
        requirePositive(amount);
        this.totalReceived = totalReceived.add(amount);
        this.accumulated = accumulated.add(amount);
    }

    /**
     * Records a distribution out of the accumulated balance. Only the amount actually credited
     * to owners leaves the pool.
     */
    public void recordDistribution(BigInteger distributed, long at) {
        release(distributed);
        this.distributionCount++;
        this.lastDistributionAt = at;
    }

    /**
     * Records a fee or royalty that was received and split in the same step. Counted apart from
     * owner-initiated distributions.
     */
    public void recordRoutedPayment(BigInteger received, BigInteger distributed) {
        recordReceipt(received);
        release(distributed);
        this.routedPaymentCount++;
    }

    public void setMinimumDistribution(BigInteger minimumDistribution) {
        if (minimumDistribution.signum() < 0) {
            throw new IllegalArgumentException("Minimum distribution cannot be negative");
        }
        this.minimumDistribution = minimumDistribution;
    }

    public RevenueAccount copy() {
        var copy = new RevenueAccount();
        copy.assetId = assetId;
        copy.currency = currency;
        copy.totalReceived = totalReceived;
        copy.totalDistributed = totalDistributed;
        copy.accumulated = accumulated;
        copy.minimumDistribution = minimumDistribution;
        copy.distributionCount = distributionCount;
        copy.lastDistributionAt = lastDistributionAt;
        copy.routedPaymentCount = routedPaymentCount;
        return copy;
    }

    private void release(BigInteger distributed) {
        if (distributed.signum() < 0 || distributed.compareTo(accumulated) > 0) {
            throw new IllegalStateException("Distribution exceeds accumulated revenue");
        }
        this.accumulated = accumulated.subtract(distributed);
        this.totalDistributed = totalDistributed.add(distributed);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }

    // Getters
    public long getAssetId() { return assetId; }
    public String getCurrency() { return currency; }
    public BigInteger getTotalReceived() { return totalReceived; }
    public BigInteger getTotalDistributed() { return totalDistributed; }
    public BigInteger getAccumulated() { return accumulated; }
    public BigInteger getMinimumDistribution() { return minimumDistribution; }
    public long getDistributionCount() { return distributionCount; }
    public long getLastDistributionAt() { return lastDistributionAt; }
    public long getRoutedPaymentCount() { return routedPaymentCount; }
}

package com.collectiveip.core.domain;

import com.collectiveip.core.support.Timestamps;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Royalty accrual for an active license.
 */
public class RoyaltySchedule {

    private static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private String holder;
    private BigInteger totalRevenueReported;
    private BigInteger totalRoyaltiesPaid;
    private long paymentInterval;
    private long nextDueAt;
    private long lastPaymentAt;

    private RoyaltySchedule() {}

    public static RoyaltySchedule start(String holder, long paymentInterval, long now) {
        if (paymentInterval <= 0) {
            throw new IllegalArgumentException("Payment interval must be positive");
        }
        var schedule = new RoyaltySchedule();
        schedule.holder = Objects.requireNonNull(holder, "Holder cannot be null");
        schedule.totalRevenueReported = BigInteger.ZERO;
        schedule.totalRoyaltiesPaid = BigInteger.ZERO;
        schedule.paymentInterval = paymentInterval;
        schedule.nextDueAt = Timestamps.after(now, paymentInterval, "Payment interval");
        return schedule;
    }

    public void reportRevenue(BigInteger revenue) {
        if (revenue.signum() < 0) {
            throw new IllegalArgumentException("Reported revenue cannot be negative");
        }
        this.totalRevenueReported = totalRevenueReported.add(revenue);
    }

    public void recordPayment(BigInteger amount, long now) {
        this.totalRoyaltiesPaid = totalRoyaltiesPaid.add(amount);
        this.lastPaymentAt = now;
        this.nextDueAt = Timestamps.after(now, paymentInterval, "Payment interval");
    }

    /**
     * {@code max(0, floor(totalRevenueReported * rateBps / 10000) - totalRoyaltiesPaid)}
     */
    public BigInteger due(int rateBps) {
        BigInteger accrued = totalRevenueReported.multiply(BigInteger.valueOf(rateBps)).divide(BPS_DENOMINATOR);
        return accrued.subtract(totalRoyaltiesPaid).max(BigInteger.ZERO);
    }

    public void transferTo(String newHolder) {
        this.holder = Objects.requireNonNull(newHolder, "Holder cannot be null");
    }

    public RoyaltySchedule copy() {
        var copy = new RoyaltySchedule();
        copy.holder = holder;
        copy.totalRevenueReported = totalRevenueReported;
        copy.totalRoyaltiesPaid = totalRoyaltiesPaid;
        copy.paymentInterval = paymentInterval;
        copy.nextDueAt = nextDueAt;
        copy.lastPaymentAt = lastPaymentAt;
        return copy;
    }

    public String getHolder() { return holder; }
    public BigInteger getTotalRevenueReported() { return totalRevenueReported; }
    public BigInteger getTotalRoyaltiesPaid() { return totalRoyaltiesPaid; }
    public long getPaymentInterval() { return paymentInterval; }
    public long getNextDueAt() { return nextDueAt; }
    public long getLastPaymentAt() { return lastPaymentAt; }
}

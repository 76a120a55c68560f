package com.collectiveip.ledger.revenue;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a pro-rata split.
 *
 * @param requested amount the split was asked to distribute
 * @param distributed sum of all credited shares, never more than {@code requested}
 * @param residue rounding remainder left in the pool
 */
public record DistributionSummary(
        long assetId,
        String currency,
        BigInteger requested,
        BigInteger distributed,
        BigInteger residue,
        List<OwnerCredit> credits
) {
    public record OwnerCredit(String owner, int percentage, BigInteger amount) {}

    public static DistributionSummary empty(long assetId, String currency) {
        return new DistributionSummary(assetId, currency, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO, List.of());
    }
}

package com.collectiveip.core.domain;

/**
 * Usage conditions attached to a license.
 *
 * @param maxUsageCount usage cap, 0 for unlimited
 * @param attributionRequired licensee must credit the asset
 * @param modificationAllowed licensee may produce derivatives
 * @param commercialRevenueShareBps informational revenue share in basis points
 * @param terminationNoticePeriod notice period in seconds
 */
public record LicenseTerms(
        long maxUsageCount,
        boolean attributionRequired,
        boolean modificationAllowed,
        long commercialRevenueShareBps,
        long terminationNoticePeriod
) {
    public LicenseTerms {
        if (maxUsageCount < 0) {
            throw new IllegalArgumentException("Usage cap cannot be negative");
        }
        if (commercialRevenueShareBps < 0 || commercialRevenueShareBps > 10_000) {
            throw new IllegalArgumentException("Revenue share must be within 0..10000 bps");
        }
        if (terminationNoticePeriod < 0) {
            throw new IllegalArgumentException("Notice period cannot be negative");
        }
    }

    public static LicenseTerms unrestricted() {
        return new LicenseTerms(0, false, true, 0, 0);
    }

    public boolean hasUsageCap() {
        return maxUsageCount > 0;
    }
}

package com.collectiveip.api.license;

import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.LicenseStatus;
import com.collectiveip.core.domain.LicenseTerms;
import com.collectiveip.core.domain.LicenseType;
import com.collectiveip.core.domain.RoyaltySchedule;

import java.math.BigInteger;

public record LicenseResponse(
    long licenseId,
    long assetId,
    String licensor,
    String licensee,
    LicenseType type,
    String usageRights,
    String territory,
    BigInteger fee,
    int royaltyRateBps,
    long startAt,
    long endAt,
    String currency,
    LicenseTerms terms,
    String termsUri,
    String termsHash,
    boolean requiresApproval,
    boolean approved,
    LicenseStatus status,
    long suspensionEnd,
    String revocationReason,
    long usageCount,
    RoyaltyView royalties
) {

    public record RoyaltyView(
        String holder,
        BigInteger totalRevenueReported,
        BigInteger totalRoyaltiesPaid,
        BigInteger due,
        long nextDueAt,
        long lastPaymentAt
    ) {}

    static LicenseResponse from(License license, LicenseStatus status) {
        RoyaltySchedule schedule = license.getRoyaltySchedule();
        RoyaltyView royalties = schedule == null ? null : new RoyaltyView(schedule.getHolder(),
                schedule.getTotalRevenueReported(), schedule.getTotalRoyaltiesPaid(), license.dueRoyalties(),
                schedule.getNextDueAt(), schedule.getLastPaymentAt());
        return new LicenseResponse(license.getId(), license.getAssetId(), license.getLicensor(), license.getLicensee(),
                license.getType(), license.getUsageRights(), license.getTerritory(), license.getFee(),
                license.getRoyaltyRateBps(), license.getStartAt(), license.getEndAt(), license.getCurrency(),
                license.getTerms(), license.getTermsUri(), license.getTermsHash(), license.isRequiresApproval(),
                license.isApproved(), status, license.getSuspensionEnd(), license.getRevocationReason(),
                license.getUsageCount(), royalties);
    }
}

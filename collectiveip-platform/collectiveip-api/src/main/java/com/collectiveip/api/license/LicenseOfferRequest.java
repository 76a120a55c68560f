package com.collectiveip.api.license;

import com.collectiveip.core.domain.LicenseOffer;
import com.collectiveip.core.domain.LicenseTerms;
import com.collectiveip.core.domain.LicenseType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;

/**
 * License parameters shared by direct offers and license proposals.
 */
public record LicenseOfferRequest(
    @NotNull Long assetId,
    @NotBlank String licensee,
    @NotNull LicenseType type,
    String usageRights,
    String territory,
    @NotNull BigInteger fee,
    @Min(0) @Max(10_000) int royaltyRateBps,
    @Min(0) long durationSeconds,
    @NotBlank String currency,
    @Valid TermsRequest terms,
    String termsUri
) {

    public record TermsRequest(
        @Min(0) long maxUsageCount,
        boolean attributionRequired,
        boolean modificationAllowed,
        @Min(0) @Max(10_000) long commercialRevenueShareBps,
        @Min(0) long terminationNoticePeriod
    ) {}

    public LicenseOffer toOffer() {
        LicenseTerms licenseTerms = terms == null
                ? LicenseTerms.unrestricted()
                : new LicenseTerms(terms.maxUsageCount(), terms.attributionRequired(), terms.modificationAllowed(),
                        terms.commercialRevenueShareBps(), terms.terminationNoticePeriod());
        return new LicenseOffer(assetId, licensee, type, usageRights, territory, fee, royaltyRateBps,
                durationSeconds, currency, licenseTerms, termsUri);
    }
}

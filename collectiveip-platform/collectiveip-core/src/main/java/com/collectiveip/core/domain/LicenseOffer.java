package com.collectiveip.core.domain;

import java.math.BigInteger;

/**
 * Everything needed to create a license, used both for direct offers and as the blueprint of a
 * license proposal.
 *
 * @param durationSeconds term length, 0 for perpetual
 * @param termsUri free-text reference to the full license terms
 */
public record LicenseOffer(
        long assetId,
        String licensee,
        LicenseType type,
        String usageRights,
        String territory,
        BigInteger fee,
        int royaltyRateBps,
        long durationSeconds,
        String currency,
        LicenseTerms terms,
        String termsUri
) {
    public LicenseOffer withParties(String normalizedLicensee, String normalizedCurrency) {
        return new LicenseOffer(assetId, normalizedLicensee, type, usageRights, territory, fee,
                royaltyRateBps, durationSeconds, normalizedCurrency, terms, termsUri);
    }
}

package com.collectiveip.core.domain;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.core.support.Timestamps;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A time-boxed grant of usage rights over an asset.
 * <p>
 * Lifecycle: offered, then approved (explicitly or automatically), then executed by the licensee.
 * An active license may be suspended and reactivated, transferred, or revoked. Revocation and
 * rejection are terminal. Licenses are never deleted.
 */
public class License {

    private long id;
    private long assetId;
    private String licensor;
    private String licensee;
    private LicenseType type;
    private String usageRights;
    private String territory;
    private BigInteger fee;
    private int royaltyRateBps;
    private long startAt;
    private long endAt;
    private String currency;
    private LicenseTerms terms;
    private String termsUri;
    private String termsHash;
    private long createdAt;

    private boolean requiresApproval;
    private boolean approvalResolved;
    private boolean approved;
    private boolean active;
    private boolean suspended;
    private boolean revoked;
    private long suspensionEnd;
    private long activatedAt;
    private String revocationReason;

    private long usageCount;
    private RoyaltySchedule royaltySchedule;

    private License() {}

    /**
     * Creates a license from an offer. When no approval is required the license is approved
     * immediately.
     */
    public static License offer(long id, String licensor, LicenseOffer offer, boolean requiresApproval,
                                String termsHash, long now) {
        Objects.requireNonNull(offer, "Offer cannot be null");
        var license = new License();
        license.id = id;
        license.assetId = offer.assetId();
        license.licensor = Objects.requireNonNull(licensor, "Licensor cannot be null");
        license.licensee = Objects.requireNonNull(offer.licensee(), "Licensee cannot be null");
        license.type = Objects.requireNonNull(offer.type(), "License type cannot be null");
        license.usageRights = offer.usageRights();
        license.territory = offer.territory();
        license.fee = offer.fee();
        license.royaltyRateBps = offer.royaltyRateBps();
        license.startAt = now;
        license.endAt = offer.durationSeconds() == 0 ? 0 : Timestamps.after(now, offer.durationSeconds(), "License duration");
        license.currency = offer.currency();
        license.terms = offer.terms() == null ? LicenseTerms.unrestricted() : offer.terms();
        license.termsUri = offer.termsUri();
        license.termsHash = termsHash;
        license.createdAt = now;
        license.requiresApproval = requiresApproval;
        license.approved = !requiresApproval;
        return license;
    }

    public void resolveApproval(boolean approve) {
        if (!requiresApproval || approvalResolved) {
            throw new IllegalStateException("Approval is not pending");
        }
        this.approvalResolved = true;
        this.approved = approve;
    }

    public void activate(long now, long royaltyInterval) {
        this.active = true;
        this.activatedAt = now;
        this.royaltySchedule = RoyaltySchedule.start(licensee, royaltyInterval, now);
    }

    public void revoke(String reason) {
        this.active = false;
        this.suspended = false;
        this.revoked = true;
        this.revocationReason = reason;
    }

    public void suspendUntil(long until) {
        this.active = false;
        this.suspended = true;
        this.suspensionEnd = until;
    }

    public void reactivate() {
        this.suspended = false;
        this.suspensionEnd = 0;
        this.active = true;
    }

    public void transferTo(String newLicensee) {
        this.licensee = Objects.requireNonNull(newLicensee, "Licensee cannot be null");
        if (royaltySchedule != null) {
            royaltySchedule.transferTo(newLicensee);
        }
    }

    /**
     * Adds usage and reported revenue, enforcing the usage cap.
     *
     * @throws StateException if the cap would be exceeded
     */
    public void recordUsage(BigInteger revenue, long count) {
        long updated = usageCount + count;
        if (terms.hasUsageCap() && updated > terms.maxUsageCount()) {
            throw new StateException(ErrorReason.USAGE_CAP_EXCEEDED,
                    "Usage " + updated + " exceeds cap " + terms.maxUsageCount() + " for license " + id);
        }
        this.usageCount = updated;
        royaltySchedule.reportRevenue(revenue);
    }

    public void recordRoyaltyPayment(BigInteger amount, long now) {
        royaltySchedule.recordPayment(amount, now);
    }

    public BigInteger dueRoyalties() {
        return royaltySchedule == null ? BigInteger.ZERO : royaltySchedule.due(royaltyRateBps);
    }

    public boolean hasBeenActivated() {
        return royaltySchedule != null;
    }

    public boolean isExpiredAt(long now) {
        return endAt != 0 && now > endAt;
    }

    public boolean isSuspensionElapsedAt(long now) {
        return suspended && now >= suspensionEnd;
    }

    public boolean isPendingApproval() {
        return requiresApproval && !approvalResolved;
    }

    public boolean isRejected() {
        return approvalResolved && !approved;
    }

    public LicenseStatus statusAt(long now) {
        if (isRejected()) {
            return LicenseStatus.REJECTED;
        }
        if (isPendingApproval()) {
            return LicenseStatus.PENDING_APPROVAL;
        }
        if (revoked) {
            return LicenseStatus.REVOKED;
        }
        if (!active && !suspended) {
            return LicenseStatus.INACTIVE;
        }
        if (suspended) {
            return isSuspensionElapsedAt(now) ? LicenseStatus.SUSPENSION_EXPIRED : LicenseStatus.SUSPENDED;
        }
        if (isExpiredAt(now)) {
            return LicenseStatus.EXPIRED;
        }
        return LicenseStatus.ACTIVE;
    }

    public License copy() {
        var copy = new License();
        copy.id = id;
        copy.assetId = assetId;
        copy.licensor = licensor;
        copy.licensee = licensee;
        copy.type = type;
        copy.usageRights = usageRights;
        copy.territory = territory;
        copy.fee = fee;
        copy.royaltyRateBps = royaltyRateBps;
        copy.startAt = startAt;
        copy.endAt = endAt;
        copy.currency = currency;
        copy.terms = terms;
        copy.termsUri = termsUri;
        copy.termsHash = termsHash;
        copy.createdAt = createdAt;
        copy.requiresApproval = requiresApproval;
        copy.approvalResolved = approvalResolved;
        copy.approved = approved;
        copy.active = active;
        copy.suspended = suspended;
        copy.revoked = revoked;
        copy.suspensionEnd = suspensionEnd;
        copy.activatedAt = activatedAt;
        copy.revocationReason = revocationReason;
        copy.usageCount = usageCount;
        copy.royaltySchedule = royaltySchedule == null ? null : royaltySchedule.copy();
        return copy;
    }

    // Getters
    public long getId() { return id; }
    public long getAssetId() { return assetId; }
    public String getLicensor() { return licensor; }
    public String getLicensee() { return licensee; }
    public LicenseType getType() { return type; }
    public String getUsageRights() { return usageRights; }
    public String getTerritory() { return territory; }
    public BigInteger getFee() { return fee; }
    public int getRoyaltyRateBps() { return royaltyRateBps; }
    public long getStartAt() { return startAt; }
    public long getEndAt() { return endAt; }
    public String getCurrency() { return currency; }
    public LicenseTerms getTerms() { return terms; }
    public String getTermsUri() { return termsUri; }
    public String getTermsHash() { return termsHash; }
    public long getCreatedAt() { return createdAt; }
    public boolean isRequiresApproval() { return requiresApproval; }
    public boolean isApprovalResolved() { return approvalResolved; }
    public boolean isApproved() { return approved; }
    public boolean isActive() { return active; }
    public boolean isSuspended() { return suspended; }
    public boolean isRevoked() { return revoked; }
    public long getSuspensionEnd() { return suspensionEnd; }
    public long getActivatedAt() { return activatedAt; }
    public String getRevocationReason() { return revocationReason; }
    public long getUsageCount() { return usageCount; }
    public RoyaltySchedule getRoyaltySchedule() { return royaltySchedule; }
}

package com.collectiveip.ledger.license;

import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.LicenseOffer;
import com.collectiveip.core.domain.LicenseStatus;
import com.collectiveip.core.exception.AuthorizationException;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;
import com.collectiveip.core.support.TextHashes;
import com.collectiveip.core.support.Timestamps;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.kernel.Guards;
import com.collectiveip.ledger.kernel.LedgerContext;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.revenue.RevenuePool;
import com.collectiveip.ledger.state.LicenseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * License state machine: offer, approval, execution, suspension, reactivation, transfer,
 * revocation, usage reporting and royalty payment.
 * <p>
 * Fees and royalties are pulled from the licensee into the pool and split among the asset's
 * owners immediately.
 */
public class LicenseRegistry {

    private static final Logger log = LoggerFactory.getLogger(LicenseRegistry.class);
    private static final int MAX_ROYALTY_BPS = 10_000;

    private final LedgerContext context;
    private final OwnershipLedger ownership;
    private final RevenuePool revenue;

    public LicenseRegistry(LedgerContext context, OwnershipLedger ownership, RevenuePool revenue) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
        this.ownership = Objects.requireNonNull(ownership, "Ownership ledger cannot be null");
        this.revenue = Objects.requireNonNull(revenue, "Revenue pool cannot be null");
    }

    // ==================== Offer & approval ====================

    /**
     * Creates a license offer from an owner of the asset to a licensee.
     *
     * @return the license id
     */
    public long createOffer(String caller, LicenseOffer offer) {
        return context.guard().mutate("createOffer", () -> {
            String licensor = Guards.caller(caller);
            LicenseOffer normalized = validateOffer(licensor, offer);
            boolean requiresApproval = normalized.type().alwaysRequiresApproval()
                    || normalized.fee().compareTo(context.config().approvalFeeThreshold()) > 0;
            License license = store(licensor, normalized, requiresApproval);

            context.emit(LedgerEventType.LICENSE_OFFERED, license.getAssetId(), license.getId(), licensor,
                    Map.of("licensee", license.getLicensee(), "requiresApproval", requiresApproval));
            log.info("License {} offered on asset {} to {} (approval required: {})",
                    license.getId(), license.getAssetId(), license.getLicensee(), requiresApproval);
            return license.getId();
        });
    }

    /**
     * Resolves a pending approval. Rejection is permanent.
     */
    public void approve(String caller, long licenseId, boolean approve) {
        context.guard().mutate("approve", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            if (!license.isRequiresApproval()) {
                throw new StateException(ErrorReason.APPROVAL_NOT_REQUIRED, "License " + licenseId + " needs no approval");
            }
            if (license.isApprovalResolved()) {
                throw new StateException(ErrorReason.APPROVAL_ALREADY_RESOLVED,
                        "Approval of license " + licenseId + " is already resolved");
            }
            ownership.requireOwner(license.getAssetId(), actor);
            license.resolveApproval(approve);

            context.emit(approve ? LedgerEventType.LICENSE_APPROVED : LedgerEventType.LICENSE_REJECTED,
                    license.getAssetId(), licenseId, actor);
            log.info("License {} {} by {}", licenseId, approve ? "approved" : "rejected", actor);
            return null;
        });
    }

    // ==================== Activation ====================

    /**
     * Licensee accepts an approved license, paying the fee if one is set.
     */
    public void execute(String caller, long licenseId) {
        context.guard().mutate("execute", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            requireLicensee(license, actor);
            if (license.isRevoked()) {
                throw new StateException(ErrorReason.LICENSE_REVOKED, "License " + licenseId + " was revoked");
            }
            if (!license.isApproved()) {
                throw new StateException(ErrorReason.LICENSE_NOT_APPROVED, "License " + licenseId + " is not approved");
            }
            if (license.isActive()) {
                throw new StateException(ErrorReason.LICENSE_ALREADY_ACTIVE, "License " + licenseId + " is already active");
            }
            if (license.isSuspended()) {
                throw new StateException(ErrorReason.LICENSE_SUSPENDED, "License " + licenseId + " is suspended");
            }
            long now = context.now();
            if (license.isExpiredAt(now)) {
                throw new StateException(ErrorReason.LICENSE_EXPIRED, "License " + licenseId + " has expired");
            }

            if (license.getFee().signum() > 0) {
                collect(license, actor, license.getFee());
            }
            license.activate(now, context.config().royaltyPaymentInterval());

            context.emit(LedgerEventType.LICENSE_EXECUTED, license.getAssetId(), licenseId, actor,
                    Map.of("fee", license.getFee()));
            log.info("License {} executed by {}", licenseId, actor);
            return null;
        });
    }

    // ==================== Owner actions ====================

    public void revoke(String caller, long licenseId, String reason) {
        context.guard().mutate("revoke", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            ownership.requireOwner(license.getAssetId(), actor);
            requireActiveFlag(license);
            license.revoke(reason);

            context.emit(LedgerEventType.LICENSE_REVOKED, license.getAssetId(), licenseId, actor,
                    Map.of("reason", reason == null ? "" : reason));
            log.info("License {} revoked by {}: {}", licenseId, actor, reason);
            return null;
        });
    }

    public void suspend(String caller, long licenseId, long durationSeconds) {
        context.guard().mutate("suspend", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            ownership.requireOwner(license.getAssetId(), actor);
            suspendLicense(license, durationSeconds, actor);
            return null;
        });
    }

    /**
     * Reactivates a suspended license once its suspension window has elapsed. Anyone may call it.
     */
    public void checkAndReactivate(String caller, long licenseId) {
        context.guard().mutate("checkAndReactivate", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            requireSuspended(license);
            if (!license.isSuspensionElapsedAt(context.now())) {
                throw new StateException(ErrorReason.SUSPENSION_NOT_ELAPSED,
                        "Suspension of license " + licenseId + " ends at " + license.getSuspensionEnd());
            }
            reactivate(license, actor);
            return null;
        });
    }

    public void manualReactivate(String caller, long licenseId) {
        context.guard().mutate("manualReactivate", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            ownership.requireOwner(license.getAssetId(), actor);
            requireSuspended(license);
            reactivate(license, actor);
            return null;
        });
    }

    // ==================== Licensee actions ====================

    public void transfer(String caller, long licenseId, String newLicensee) {
        context.guard().mutate("transfer", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            requireLicensee(license, actor);
            requireActiveFlag(license);
            String recipient = Addresses.normalize(newLicensee, "new licensee");
            if (recipient.equals(actor)) {
                throw new ValidationException(ErrorReason.SELF_TRANSFER, "License " + licenseId + " already belongs to " + actor);
            }
            license.transferTo(recipient);

            context.emit(LedgerEventType.LICENSE_TRANSFERRED, license.getAssetId(), licenseId, actor, Map.of("to", recipient));
            log.info("License {} transferred from {} to {}", licenseId, actor, recipient);
            return null;
        });
    }

    public void reportUsage(String caller, long licenseId, BigInteger revenueAmount, long usageCount) {
        context.guard().mutate("reportUsage", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            requireLicensee(license, actor);
            requireEffectivelyActive(license);
            Guards.requireNonNegative(revenueAmount, "Reported revenue");
            if (usageCount < 0) {
                throw new ValidationException(ErrorReason.NEGATIVE_AMOUNT, "Usage count cannot be negative");
            }
            license.recordUsage(revenueAmount, usageCount);

            context.emit(LedgerEventType.USAGE_REPORTED, license.getAssetId(), licenseId, actor,
                    Map.of("revenue", revenueAmount, "usage", usageCount));
            return null;
        });
    }

    public void payRoyalties(String caller, long licenseId, BigInteger amount) {
        context.guard().mutate("payRoyalties", () -> {
            String actor = Guards.caller(caller);
            License license = requireLicense(licenseId);
            requireLicensee(license, actor);
            if (!license.hasBeenActivated()) {
                throw new StateException(ErrorReason.LICENSE_NEVER_ACTIVATED, "License " + licenseId + " was never activated");
            }
            Guards.requirePositive(amount, "Royalty amount");
            collect(license, actor, amount);
            license.recordRoyaltyPayment(amount, context.now());

            context.emit(LedgerEventType.ROYALTIES_PAID, license.getAssetId(), licenseId, actor, Map.of("amount", amount));
            log.debug("License {} paid {} in royalties", licenseId, amount);
            return null;
        });
    }

    // ==================== Queries ====================

    public BigInteger dueRoyalties(long licenseId) {
        return context.guard().read(() -> requireLicense(licenseId).dueRoyalties());
    }

    public LicenseStatus getStatus(long licenseId) {
        return context.guard().read(() -> licenses().license(licenseId)
                .map(license -> license.statusAt(context.now()))
                .orElse(LicenseStatus.NOT_FOUND));
    }

    public Optional<License> license(long licenseId) {
        return context.guard().read(() -> licenses().license(licenseId).map(License::copy));
    }

    public List<License> licensesOf(long assetId) {
        return context.guard().read(() -> {
            List<License> result = new ArrayList<>();
            for (License license : licenses().licensesOf(assetId)) {
                result.add(license.copy());
            }
            return result;
        });
    }

    // ==================== Internal ====================

    /**
     * Validates an offer made by {@code licensor} and returns it with normalized addresses.
     */
    public LicenseOffer validateOffer(String licensor, LicenseOffer offer) {
        Guards.requirePresent(offer, "License offer");
        ownership.requireOwner(offer.assetId(), licensor);
        String licensee = Addresses.normalize(offer.licensee(), "licensee");
        if (licensee.equals(licensor)) {
            throw new ValidationException(ErrorReason.LICENSEE_IS_LICENSOR, "Licensee cannot be the licensor");
        }
        Guards.requirePresent(offer.type(), "License type");
        if (offer.royaltyRateBps() < 0 || offer.royaltyRateBps() > MAX_ROYALTY_BPS) {
            throw new ValidationException(ErrorReason.ROYALTY_RATE_OUT_OF_RANGE,
                    "Royalty rate must be within 0..10000 bps, got " + offer.royaltyRateBps());
        }
        Guards.requireNonNegative(offer.fee(), "License fee");
        Timestamps.after(context.now(), offer.durationSeconds(), "License duration");
        String currency = context.paymentTokens().resolve(offer.currency()).currency();
        return offer.withParties(licensee, currency);
    }

    /**
     * Creates an approved license from a passed license proposal. The caller must already hold
     * the guard.
     */
    public long issueApproved(String licensor, LicenseOffer blueprint) {
        License license = store(licensor, blueprint, false);
        context.emit(LedgerEventType.LICENSE_OFFERED, license.getAssetId(), license.getId(), licensor,
                Map.of("licensee", license.getLicensee(), "requiresApproval", false));
        return license.getId();
    }

    /**
     * Suspends one license on behalf of governance. The caller must already hold the guard.
     */
    public void suspendForGovernance(long licenseId, long durationSeconds) {
        suspendLicense(requireLicense(licenseId), durationSeconds, null);
    }

    /**
     * Suspends every active license of an asset. The caller must already hold the guard.
     *
     * @return number of licenses suspended
     */
    public int suspendAllForAsset(long assetId, long durationSeconds) {
        int suspended = 0;
        for (License license : licenses().licensesOf(assetId)) {
            if (license.isActive()) {
                suspendLicense(license, durationSeconds, null);
                suspended++;
            }
        }
        log.info("Suspended {} licenses of asset {}", suspended, assetId);
        return suspended;
    }

    public License requireLicense(long licenseId) {
        return licenses().license(licenseId)
                .orElseThrow(() -> new StateException(ErrorReason.LICENSE_NOT_FOUND, "License not found: " + licenseId));
    }

    private License store(String licensor, LicenseOffer offer, boolean requiresApproval) {
        LicenseTable table = licenses();
        License license = License.offer(table.nextLicenseId(), licensor, offer, requiresApproval,
                TextHashes.keccak(offer.termsUri()), context.now());
        table.putLicense(license);
        return license;
    }

    private void collect(License license, String payer, BigInteger amount) {
        context.paymentTokens().resolve(license.getCurrency())
                .transferFrom(context.config().poolAddress(), payer, context.config().poolAddress(), amount);
        revenue.routeFee(license.getAssetId(), license.getCurrency(), amount);
    }

    private void suspendLicense(License license, long durationSeconds, String actor) {
        requireActiveFlag(license);
        if (durationSeconds <= 0) {
            throw new ValidationException(ErrorReason.INVALID_DURATION, "Suspension duration must be positive");
        }
        long until = Timestamps.after(context.now(), durationSeconds, "Suspension duration");
        license.suspendUntil(until);

        context.emit(LedgerEventType.LICENSE_SUSPENDED, license.getAssetId(), license.getId(), actor,
                Map.of("until", until));
        log.info("License {} suspended until {}", license.getId(), until);
    }

    private void reactivate(License license, String actor) {
        license.reactivate();
        context.emit(LedgerEventType.LICENSE_REACTIVATED, license.getAssetId(), license.getId(), actor);
        log.info("License {} reactivated", license.getId());
    }

    private void requireLicensee(License license, String caller) {
        if (!license.getLicensee().equals(caller)) {
            throw new AuthorizationException(ErrorReason.NOT_LICENSEE,
                    caller + " is not the licensee of license " + license.getId());
        }
    }

    private void requireActiveFlag(License license) {
        if (!license.isActive()) {
            throw new StateException(ErrorReason.LICENSE_NOT_ACTIVE, "License " + license.getId() + " is not active");
        }
    }

    private void requireSuspended(License license) {
        if (!license.isSuspended()) {
            throw new StateException(ErrorReason.LICENSE_NOT_SUSPENDED, "License " + license.getId() + " is not suspended");
        }
    }

    private void requireEffectivelyActive(License license) {
        LicenseStatus status = license.statusAt(context.now());
        if (status == LicenseStatus.ACTIVE) {
            return;
        }
        ErrorReason reason = switch (status) {
            case EXPIRED -> ErrorReason.LICENSE_EXPIRED;
            case SUSPENDED, SUSPENSION_EXPIRED -> ErrorReason.LICENSE_SUSPENDED;
            case REVOKED -> ErrorReason.LICENSE_REVOKED;
            default -> ErrorReason.LICENSE_NOT_ACTIVE;
        };
        throw new StateException(reason, "License " + license.getId() + " is " + status);
    }

    private LicenseTable licenses() {
        return context.state().licenses();
    }
}

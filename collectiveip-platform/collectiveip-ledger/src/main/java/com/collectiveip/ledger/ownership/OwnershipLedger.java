package com.collectiveip.ledger.ownership;

import com.collectiveip.core.domain.Asset;
import com.collectiveip.core.domain.OwnerEntry;
import com.collectiveip.core.exception.AuthorizationException;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.InsufficientFundsException;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.kernel.Guards;
import com.collectiveip.ledger.kernel.LedgerContext;
import com.collectiveip.ledger.state.OwnershipTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fractional ownership of assets: economic percentages, governance weights and the owner-set
 * enumeration.
 * <p>
 * The percentages of every registered asset sum to exactly 100 after each committed call.
 */
public class OwnershipLedger {

    private static final Logger log = LoggerFactory.getLogger(OwnershipLedger.class);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final LedgerContext context;

    public OwnershipLedger(LedgerContext context) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
    }

    /**
     * Stake of one owner as seen from outside the ledger.
     */
    public record OwnerShare(String owner, int percentage, long governanceWeight) {}

    /**
     * Which asset fields a change actually modified.
     */
    public record AssetChange(long assetId, boolean metadataChanged, boolean complianceChanged) {}

    // ==================== Registration ====================

    /**
     * Registers a new asset with its initial owner set and mints the default supply pro-rata.
     *
     * @return the new asset id
     */
    public long registerAsset(String caller, String assetType, String metadataUri,
                              List<String> owners, List<Integer> percentages, List<Long> weights) {
        return context.guard().mutate("registerAsset", () -> {
            String actor = Guards.caller(caller);
            Guards.requirePresent(assetType, "Asset type");
            Guards.requirePresent(metadataUri, "Metadata URI");
            LinkedHashMap<String, OwnerEntry> entries = validateOwnerSet(owners, percentages, weights);

            OwnershipTable table = table();
            long assetId = table.nextAssetId();
            BigInteger supply = context.config().defaultAssetSupply();
            table.putAsset(Asset.register(assetId, assetType, metadataUri, supply, context.now()));
            table.replaceOwners(assetId, entries);
            mintProRata(assetId, supply, entries.values());

            context.emit(LedgerEventType.ASSET_REGISTERED, assetId, 0, actor,
                    Map.of("assetType", assetType, "owners", entries.size()));
            log.info("Registered asset {} of type {} with {} owners", assetId, assetType, entries.size());
            return assetId;
        });
    }

    /**
     * Replaces the entire owner set of an existing asset. Administrator only.
     */
    public void registerOwnership(String caller, long assetId,
                                  List<String> owners, List<Integer> percentages, List<Long> weights) {
        context.guard().mutate("registerOwnership", () -> {
            String actor = Guards.caller(caller);
            requireAsset(assetId);
            Guards.requireAdministrator(context.config(), actor);
            LinkedHashMap<String, OwnerEntry> entries = validateOwnerSet(owners, percentages, weights);
            table().replaceOwners(assetId, entries);

            context.emit(LedgerEventType.OWNERSHIP_REGISTERED, assetId, 0, actor, Map.of("owners", entries.size()));
            log.info("Replaced owner set of asset {} with {} owners", assetId, entries.size());
            return null;
        });
    }

    // ==================== Transfers ====================

    /**
     * Moves {@code percentage} points of economic share and the proportional governance weight
     * from {@code from} to {@code to}.
     *
     * @return the governance weight moved
     */
    public long transferShare(String caller, long assetId, String from, String to, int percentage) {
        return context.guard().mutate("transferShare", () -> {
            String actor = Guards.caller(caller);
            String sender = Addresses.normalize(from, "sender");
            requireAsset(assetId);
            if (!actor.equals(sender)) {
                throw new AuthorizationException(ErrorReason.NOT_SHARE_HOLDER,
                        "Only " + sender + " can transfer its own share");
            }
            if (percentage <= 0 || percentage > 100) {
                throw new ValidationException(ErrorReason.PERCENTAGE_OUT_OF_RANGE,
                        "Transferred percentage must be within 1..100, got " + percentage);
            }
            String recipient = Addresses.normalize(to, "recipient");
            if (recipient.equals(sender)) {
                throw new ValidationException(ErrorReason.SELF_TRANSFER, "Cannot transfer a share to oneself");
            }
            OwnerEntry source = table().entry(assetId, sender)
                    .filter(entry -> entry.getPercentage() >= percentage)
                    .orElseThrow(() -> new InsufficientFundsException(ErrorReason.INSUFFICIENT_SHARE,
                            sender + " holds less than " + percentage + "% of asset " + assetId));

            long weightMoved = BigInteger.valueOf(source.getGovernanceWeight())
                    .multiply(BigInteger.valueOf(percentage))
                    .divide(BigInteger.valueOf(source.getPercentage()))
                    .longValueExact();
            source.debit(percentage, weightMoved);

            OwnerEntry target = table().entry(assetId, recipient).orElse(null);
            if (target == null) {
                target = OwnerEntry.create(recipient, 0, 0);
                table().addEntry(assetId, target);
            }
            target.credit(percentage, weightMoved);

            context.emit(LedgerEventType.SHARE_TRANSFERRED, assetId, 0, actor,
                    Map.of("to", recipient, "percentage", percentage, "weight", weightMoved));
            log.debug("Asset {}: {} transferred {}% and weight {} to {}", assetId, sender, percentage, weightMoved, recipient);
            return weightMoved;
        });
    }

    // ==================== Asset maintenance ====================

    public boolean updateMetadata(String caller, long assetId, String metadataUri) {
        return context.guard().mutate("updateMetadata", () -> {
            String actor = Guards.caller(caller);
            requireOwner(assetId, actor);
            return applyAssetChange(assetId, actor, metadataUri, null).metadataChanged();
        });
    }

    public boolean updateComplianceStatus(String caller, long assetId, String complianceStatus) {
        return context.guard().mutate("updateComplianceStatus", () -> {
            String actor = Guards.caller(caller);
            requireOwner(assetId, actor);
            return applyAssetChange(assetId, actor, null, complianceStatus).complianceChanged();
        });
    }

    /**
     * Grows the nominal supply of an asset and mints the increase pro-rata to current owners.
     */
    public BigInteger mintAdditionalSupply(String caller, long assetId, BigInteger amount) {
        return context.guard().mutate("mintAdditionalSupply", () -> {
            String actor = Guards.caller(caller);
            Asset asset = requireAsset(assetId);
            requireOwner(assetId, actor);
            Guards.requirePositive(amount, "Supply increase");
            asset.increaseSupply(amount);
            mintProRata(assetId, amount, table().entries(assetId));

            context.emit(LedgerEventType.SUPPLY_MINTED, assetId, 0, actor, Map.of("amount", amount));
            log.info("Minted {} additional units of asset {}", amount, assetId);
            return asset.getTotalSupply();
        });
    }

    /**
     * Applies metadata and/or compliance changes; a null value leaves that field alone. Used by
     * owner updates and governance execution; the caller must already hold the guard.
     */
    public AssetChange applyAssetChange(long assetId, String actor, String metadataUri, String complianceStatus) {
        Asset asset = requireAsset(assetId);
        boolean metadataChanged = metadataUri != null && asset.updateMetadata(metadataUri);
        boolean complianceChanged = complianceStatus != null && asset.updateComplianceStatus(complianceStatus);
        if (metadataChanged) {
            context.emit(LedgerEventType.METADATA_UPDATED, assetId, 0, actor, Map.of("metadataUri", metadataUri));
        }
        if (complianceChanged) {
            context.emit(LedgerEventType.COMPLIANCE_STATUS_UPDATED, assetId, 0, actor,
                    Map.of("complianceStatus", complianceStatus));
        }
        return new AssetChange(assetId, metadataChanged, complianceChanged);
    }

    // ==================== Queries ====================

    public boolean isOwner(long assetId, String address) {
        return context.guard().read(() -> Addresses.isValid(address)
                && table().entry(assetId, Addresses.normalize(address, "owner")).map(OwnerEntry::holdsShare).orElse(false));
    }

    public boolean isMember(long assetId, String address) {
        return context.guard().read(() -> Addresses.isValid(address)
                && table().entry(assetId, Addresses.normalize(address, "owner")).map(OwnerEntry::isMember).orElse(false));
    }

    public boolean hasGovernanceRights(long assetId, String address) {
        return context.guard().read(() -> Addresses.isValid(address)
                && table().entry(assetId, Addresses.normalize(address, "owner"))
                        .map(entry -> entry.holdsShare() && entry.getGovernanceWeight() > 0)
                        .orElse(false));
    }

    public int percentageOf(long assetId, String address) {
        return context.guard().read(() -> findEntry(assetId, address).map(OwnerEntry::getPercentage).orElse(0));
    }

    public long governanceWeightOf(long assetId, String address) {
        return context.guard().read(() -> findEntry(assetId, address).map(OwnerEntry::getGovernanceWeight).orElse(0L));
    }

    /**
     * Owner set in enumeration order, including members whose percentage dropped to zero.
     */
    public List<OwnerShare> owners(long assetId) {
        return context.guard().read(() -> {
            List<OwnerShare> shares = new ArrayList<>();
            for (OwnerEntry entry : table().entries(assetId)) {
                shares.add(new OwnerShare(entry.getOwner(), entry.getPercentage(), entry.getGovernanceWeight()));
            }
            return shares;
        });
    }

    public int ownerCount(long assetId) {
        return context.guard().read(() -> table().entries(assetId).size());
    }

    public long totalGovernanceWeight(long assetId) {
        return context.guard().read(() -> totalWeight(assetId));
    }

    public Optional<Asset> asset(long assetId) {
        return context.guard().read(() -> table().asset(assetId).map(Asset::copy));
    }

    public List<Long> assetsByComplianceStatus(String complianceStatus) {
        return context.guard().read(() -> {
            List<Long> ids = new ArrayList<>();
            for (Asset asset : table().assets()) {
                if (asset.getComplianceStatus().equals(complianceStatus)) {
                    ids.add(asset.getId());
                }
            }
            return ids;
        });
    }

    // ==================== Internal helpers ====================

    public Asset requireAsset(long assetId) {
        return table().asset(assetId)
                .orElseThrow(() -> new StateException(ErrorReason.ASSET_NOT_FOUND, "Asset not found: " + assetId));
    }

    /**
     * @throws AuthorizationException unless {@code owner} holds a non-zero share of the asset
     */
    public OwnerEntry requireOwner(long assetId, String owner) {
        requireAsset(assetId);
        return table().entry(assetId, owner)
                .filter(OwnerEntry::holdsShare)
                .orElseThrow(() -> new AuthorizationException(ErrorReason.NOT_ASSET_OWNER,
                        owner + " is not an owner of asset " + assetId));
    }

    public Optional<OwnerEntry> memberEntry(long assetId, String member) {
        return table().entry(assetId, member).filter(OwnerEntry::isMember);
    }

    public Collection<OwnerEntry> entries(long assetId) {
        return table().entries(assetId);
    }

    public long totalWeight(long assetId) {
        long total = 0;
        for (OwnerEntry entry : table().entries(assetId)) {
            total = Math.addExact(total, entry.getGovernanceWeight());
        }
        return total;
    }

    private Optional<OwnerEntry> findEntry(long assetId, String address) {
        if (!Addresses.isValid(address)) {
            return Optional.empty();
        }
        return table().entry(assetId, Addresses.normalize(address, "owner"));
    }

    private void mintProRata(long assetId, BigInteger supply, Collection<OwnerEntry> entries) {
        for (OwnerEntry entry : entries) {
            BigInteger share = supply.multiply(BigInteger.valueOf(entry.getPercentage())).divide(HUNDRED);
            if (share.signum() > 0) {
                context.assetTokens().mint(entry.getOwner(), assetId, share);
            }
        }
    }

    private LinkedHashMap<String, OwnerEntry> validateOwnerSet(List<String> owners, List<Integer> percentages,
                                                               List<Long> weights) {
        Guards.requirePresent(owners, "Owners");
        Guards.requirePresent(percentages, "Percentages");
        Guards.requirePresent(weights, "Governance weights");
        if (owners.size() != percentages.size() || owners.size() != weights.size()) {
            throw new ValidationException(ErrorReason.ARRAY_LENGTH_MISMATCH,
                    "Owners, percentages and weights must have equal length");
        }
        if (owners.isEmpty()) {
            throw new ValidationException(ErrorReason.EMPTY_OWNER_SET, "At least one owner is required");
        }

        var entries = new LinkedHashMap<String, OwnerEntry>();
        int total = 0;
        for (int i = 0; i < owners.size(); i++) {
            String owner = Addresses.normalize(owners.get(i), "owner");
            Integer percentage = Guards.requirePresent(percentages.get(i), "Percentage");
            Long weight = Guards.requirePresent(weights.get(i), "Governance weight");
            if (percentage < 0 || percentage > 100) {
                throw new ValidationException(ErrorReason.PERCENTAGE_OUT_OF_RANGE,
                        "Percentage of " + owner + " must be within 0..100, got " + percentage);
            }
            if (weight < 0) {
                throw new ValidationException(ErrorReason.NEGATIVE_WEIGHT, "Governance weight of " + owner + " is negative");
            }
            if (entries.containsKey(owner)) {
                throw new ValidationException(ErrorReason.DUPLICATE_OWNER, "Duplicate owner " + owner);
            }
            entries.put(owner, OwnerEntry.create(owner, percentage, weight));
            total += percentage;
        }
        if (total != 100) {
            throw new ValidationException(ErrorReason.PERCENTAGES_NOT_100, "Percentages sum to " + total + ", expected 100");
        }
        return entries;
    }

    private OwnershipTable table() {
        return context.state().ownership();
    }
}

package com.collectiveip.ledger.state;

import com.collectiveip.core.domain.Asset;
import com.collectiveip.core.domain.OwnerEntry;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Assets and their owner sets. Owner enumeration order is insertion order.
 */
public class OwnershipTable {

    private final Map<Long, Asset> assets;
    private final Map<Long, LinkedHashMap<String, OwnerEntry>> owners;
    private long lastAssetId;

    public OwnershipTable() {
        this.assets = new LinkedHashMap<>();
        this.owners = new LinkedHashMap<>();
    }

    public long nextAssetId() {
        return ++lastAssetId;
    }

    public void putAsset(Asset asset) {
        assets.put(asset.getId(), asset);
    }

    public Optional<Asset> asset(long assetId) {
        return Optional.ofNullable(assets.get(assetId));
    }

    public Collection<Asset> assets() {
        return Collections.unmodifiableCollection(assets.values());
    }

    /**
     * Live owner entries of an asset, empty when none were registered.
     */
    public Collection<OwnerEntry> entries(long assetId) {
        LinkedHashMap<String, OwnerEntry> set = owners.get(assetId);
        return set == null ? List.of() : Collections.unmodifiableCollection(set.values());
    }

    public Optional<OwnerEntry> entry(long assetId, String owner) {
        LinkedHashMap<String, OwnerEntry> set = owners.get(assetId);
        return set == null ? Optional.empty() : Optional.ofNullable(set.get(owner));
    }

    public void addEntry(long assetId, OwnerEntry entry) {
        owners.computeIfAbsent(assetId, k -> new LinkedHashMap<>()).put(entry.getOwner(), entry);
    }

    public void replaceOwners(long assetId, LinkedHashMap<String, OwnerEntry> newOwners) {
        owners.put(assetId, newOwners);
    }

    public OwnershipTable copy() {
        var copy = new OwnershipTable();
        assets.forEach((id, asset) -> copy.assets.put(id, asset.copy()));
        owners.forEach((id, set) -> {
            var entries = new LinkedHashMap<String, OwnerEntry>();
            set.forEach((owner, entry) -> entries.put(owner, entry.copy()));
            copy.owners.put(id, entries);
        });
        copy.lastAssetId = lastAssetId;
        return copy;
    }
}

package com.collectiveip.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A collectively-owned intangible asset.
 * <p>
 * Registered once and never deleted. Metadata and the cached compliance-status tag may change
 * through owner action or governance execution; the nominal supply only grows.
 */
public class Asset {

    public static final String DEFAULT_COMPLIANCE_STATUS = "PENDING";

    private long id;
    private String assetType;
    private String metadataUri;
    private BigInteger totalSupply;
    private long createdAt;
    private String complianceStatus;

    private Asset() {}

    public static Asset register(long id, String assetType, String metadataUri, BigInteger totalSupply, long createdAt) {
        if (id <= 0) {
            throw new IllegalArgumentException("Asset id must be positive");
        }
        var asset = new Asset();
        asset.id = id;
        asset.assetType = Objects.requireNonNull(assetType, "Asset type cannot be null");
        asset.metadataUri = Objects.requireNonNull(metadataUri, "Metadata URI cannot be null");
        asset.totalSupply = Objects.requireNonNull(totalSupply, "Total supply cannot be null");
        asset.createdAt = createdAt;
        asset.complianceStatus = DEFAULT_COMPLIANCE_STATUS;
        return asset;
    }

    /**
     * @return true if the stored value changed
     */
    public boolean updateMetadata(String newMetadataUri) {
        Objects.requireNonNull(newMetadataUri, "Metadata URI cannot be null");
        if (newMetadataUri.equals(metadataUri)) {
            return false;
        }
        this.metadataUri = newMetadataUri;
        return true;
    }

    /**
     * @return true if the stored value changed
     */
    public boolean updateComplianceStatus(String newStatus) {
        Objects.requireNonNull(newStatus, "Compliance status cannot be null");
        if (newStatus.equals(complianceStatus)) {
            return false;
        }
        this.complianceStatus = newStatus;
        return true;
    }

    public void increaseSupply(BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Supply increase must be positive");
        }
        this.totalSupply = this.totalSupply.add(amount);
    }

    public Asset copy() {
        var copy = new Asset();
        copy.id = id;
        copy.assetType = assetType;
        copy.metadataUri = metadataUri;
        copy.totalSupply = totalSupply;
        copy.createdAt = createdAt;
        copy.complianceStatus = complianceStatus;
        return copy;
    }

    // Getters
    public long getId() { return id; }
    public String getAssetType() { return assetType; }
    public String getMetadataUri() { return metadataUri; }
    public BigInteger getTotalSupply() { return totalSupply; }
    public long getCreatedAt() { return createdAt; }
    public String getComplianceStatus() { return complianceStatus; }
}

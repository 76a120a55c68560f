package com.collectiveip.core.domain;

import java.math.BigInteger;

/**
 * Category-specific change carried by a governance proposal.
 */
public sealed interface ProposalPayload
        permits ProposalPayload.AssetManagementChange, ProposalPayload.RevenuePolicyChange,
        ProposalPayload.EmergencyActionRequest {

    ProposalCategory category();

    /**
     * Metadata and/or compliance-status change. At least one of the update flags must be set.
     */
    record AssetManagementChange(
            String newMetadataUri,
            String newComplianceStatus,
            boolean updateMetadata,
            boolean updateCompliance
    ) implements ProposalPayload {
        @Override
        public ProposalCategory category() {
            return ProposalCategory.ASSET_MANAGEMENT;
        }
    }

    /**
     * New minimum-distribution floor for one currency of the asset.
     */
    record RevenuePolicyChange(String currency, BigInteger newMinimumDistribution) implements ProposalPayload {
        @Override
        public ProposalCategory category() {
            return ProposalCategory.REVENUE_POLICY;
        }
    }

    /**
     * @param targetLicenseId license to suspend, only used by {@link EmergencyActionType#SUSPEND_LICENSE}
     * @param suspensionDuration seconds, only used by the suspend actions
     */
    record EmergencyActionRequest(
            EmergencyActionType action,
            long targetLicenseId,
            long suspensionDuration,
            String reason
    ) implements ProposalPayload {
        @Override
        public ProposalCategory category() {
            return ProposalCategory.EMERGENCY;
        }
    }
}

package com.collectiveip.core.domain;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;

/**
 * Per-asset voting parameters. Quorums are basis points of the snapshotted total governance
 * weight; durations are seconds.
 */
public record GovernanceSettings(
        int defaultQuorumBps,
        int emergencyQuorumBps,
        int licenseQuorumBps,
        int assetManagementQuorumBps,
        int revenuePolicyQuorumBps,
        long defaultVotingDuration,
        long emergencyVotingDuration,
        long executionDelay
) {
    public static final long MIN_EXECUTION_DELAY = 3_600;
    private static final int MAX_BPS = 10_000;
    private static final long DAY = 86_400;

    public static GovernanceSettings defaults() {
        return new GovernanceSettings(5_000, 3_000, 4_000, 5_000, 5_000, 3 * DAY, DAY, DAY);
    }

    /**
     * @throws ValidationException on the first rule the settings break
     */
    public GovernanceSettings validate() {
        requireQuorum("default", defaultQuorumBps);
        requireQuorum("emergency", emergencyQuorumBps);
        requireQuorum("license", licenseQuorumBps);
        requireQuorum("asset management", assetManagementQuorumBps);
        requireQuorum("revenue policy", revenuePolicyQuorumBps);
        if (emergencyQuorumBps > defaultQuorumBps) {
            throw new ValidationException(ErrorReason.EMERGENCY_QUORUM_ABOVE_DEFAULT,
                    "Emergency quorum " + emergencyQuorumBps + " exceeds default quorum " + defaultQuorumBps);
        }
        if (executionDelay < MIN_EXECUTION_DELAY) {
            throw new ValidationException(ErrorReason.EXECUTION_DELAY_TOO_SHORT,
                    "Execution delay must be at least " + MIN_EXECUTION_DELAY + " seconds");
        }
        if (defaultVotingDuration <= 0 || emergencyVotingDuration <= 0) {
            throw new ValidationException(ErrorReason.INVALID_DURATION, "Voting durations must be positive");
        }
        return this;
    }

    public int quorumBpsFor(ProposalCategory category) {
        return switch (category) {
            case ASSET_MANAGEMENT -> assetManagementQuorumBps;
            case REVENUE_POLICY -> revenuePolicyQuorumBps;
            case EMERGENCY -> emergencyQuorumBps;
        };
    }

    public long votingDurationFor(ProposalCategory category) {
        return category == ProposalCategory.EMERGENCY ? emergencyVotingDuration : defaultVotingDuration;
    }

    private static void requireQuorum(String name, int bps) {
        if (bps <= 0 || bps > MAX_BPS) {
            throw new ValidationException(ErrorReason.QUORUM_OUT_OF_RANGE,
                    "The " + name + " quorum must be within (0, " + MAX_BPS + "] bps, got " + bps);
        }
    }
}

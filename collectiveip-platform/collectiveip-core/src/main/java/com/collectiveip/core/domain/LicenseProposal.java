package com.collectiveip.core.domain;

import com.collectiveip.core.support.Timestamps;

import java.util.Objects;

/**
 * Owner vote on creating a new license from a blueprint.
 * <p>
 * Passes with more than half of the snapshotted governance weight voting for it and the license
 * quorum reached. Executable for a fixed window after the deadline.
 */
public class LicenseProposal {

    private long id;
    private long assetId;
    private String proposer;
    private LicenseOffer blueprint;
    private String description;
    private String descriptionHash;
    private Ballot ballot;
    private long createdAt;
    private long deadline;
    private long executionDeadline;
    private boolean executed;
    private long resultingLicenseId;

    private LicenseProposal() {}

    public static LicenseProposal create(long id, String proposer, LicenseOffer blueprint, Ballot ballot,
                                         long now, long votingPeriod, long executionWindow,
                                         String description, String descriptionHash) {
        var proposal = new LicenseProposal();
        proposal.id = id;
        proposal.blueprint = Objects.requireNonNull(blueprint, "Blueprint cannot be null");
        proposal.assetId = blueprint.assetId();
        proposal.proposer = Objects.requireNonNull(proposer, "Proposer cannot be null");
        proposal.ballot = Objects.requireNonNull(ballot, "Ballot cannot be null");
        proposal.createdAt = now;
        proposal.deadline = Timestamps.after(now, votingPeriod, "Voting period");
        proposal.executionDeadline = Timestamps.after(proposal.deadline, executionWindow, "Execution window");
        proposal.description = description;
        proposal.descriptionHash = descriptionHash;
        return proposal;
    }

    public boolean isVotingOpenAt(long now) {
        return now < deadline;
    }

    public boolean isInExecutionWindowAt(long now) {
        return now > deadline && now <= executionDeadline;
    }

    public boolean hasPassed() {
        return ballot.absoluteMajority() && ballot.quorumReached();
    }

    public void markExecuted(long licenseId) {
        if (executed) {
            throw new IllegalStateException("License proposal " + id + " already executed");
        }
        this.executed = true;
        this.resultingLicenseId = licenseId;
    }

    public LicenseProposal copy() {
        var copy = new LicenseProposal();
        copy.id = id;
        copy.assetId = assetId;
        copy.proposer = proposer;
        copy.blueprint = blueprint;
        copy.description = description;
        copy.descriptionHash = descriptionHash;
        copy.ballot = ballot.copy();
        copy.createdAt = createdAt;
        copy.deadline = deadline;
        copy.executionDeadline = executionDeadline;
        copy.executed = executed;
        copy.resultingLicenseId = resultingLicenseId;
        return copy;
    }

    public long getId() { return id; }
    public long getAssetId() { return assetId; }
    public String getProposer() { return proposer; }
    public LicenseOffer getBlueprint() { return blueprint; }
    public String getDescription() { return description; }
    public String getDescriptionHash() { return descriptionHash; }
    public Ballot getBallot() { return ballot; }
    public long getCreatedAt() { return createdAt; }
    public long getDeadline() { return deadline; }
    public long getExecutionDeadline() { return executionDeadline; }
    public boolean isExecuted() { return executed; }
    public long getResultingLicenseId() { return resultingLicenseId; }
}

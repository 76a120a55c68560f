package com.collectiveip.core.domain;

import com.collectiveip.core.support.Timestamps;

import java.util.Objects;

/**
 * A time-boxed, quorum-gated collective decision over one asset.
 * <p>
 * Voting is open while {@code now < votingDeadline}; execution is possible in
 * {@code (votingDeadline, executionDeadline]}. Apart from the tally and the executed/cancelled
 * flags a proposal never changes after creation.
 */
public class GovernanceProposal {

    private long id;
    private long assetId;
    private String proposer;
    private ProposalPayload payload;
    private Ballot ballot;
    private long createdAt;
    private long votingDeadline;
    private long executionDeadline;
    private boolean executed;
    private boolean cancelled;
    private long executedAt;
    private String description;
    private String descriptionHash;

    private GovernanceProposal() {}

    public static GovernanceProposal create(long id, long assetId, String proposer, ProposalPayload payload,
                                            Ballot ballot, long now, long votingDuration, long executionDelay,
                                            String description, String descriptionHash) {
        var proposal = new GovernanceProposal();
        proposal.id = id;
        proposal.assetId = assetId;
        proposal.proposer = Objects.requireNonNull(proposer, "Proposer cannot be null");
        proposal.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        proposal.ballot = Objects.requireNonNull(ballot, "Ballot cannot be null");
        proposal.createdAt = now;
        proposal.votingDeadline = Timestamps.after(now, votingDuration, "Voting duration");
        proposal.executionDeadline = Timestamps.after(proposal.votingDeadline, executionDelay, "Execution delay");
        proposal.description = description;
        proposal.descriptionHash = descriptionHash;
        return proposal;
    }

    public ProposalCategory getCategory() {
        return payload.category();
    }

    public boolean isOpen() {
        return !executed && !cancelled;
    }

    public boolean isVotingOpenAt(long now) {
        return now < votingDeadline;
    }

    public boolean isInExecutionWindowAt(long now) {
        return now > votingDeadline && now <= executionDeadline;
    }

    public boolean canExecuteAt(long now) {
        return isOpen()
                && isInExecutionWindowAt(now)
                && ballot.quorumReached()
                && ballot.relativeMajority();
    }

    public void markExecuted(long now) {
        if (!isOpen()) {
            throw new IllegalStateException("Proposal " + id + " is already closed");
        }
        this.executed = true;
        this.executedAt = now;
    }

    public void cancel() {
        if (!isOpen()) {
            throw new IllegalStateException("Proposal " + id + " is already closed");
        }
        this.cancelled = true;
    }

    public GovernanceProposal copy() {
        var copy = new GovernanceProposal();
        copy.id = id;
        copy.assetId = assetId;
        copy.proposer = proposer;
        copy.payload = payload;
        copy.ballot = ballot.copy();
        copy.createdAt = createdAt;
        copy.votingDeadline = votingDeadline;
        copy.executionDeadline = executionDeadline;
        copy.executed = executed;
        copy.cancelled = cancelled;
        copy.executedAt = executedAt;
        copy.description = description;
        copy.descriptionHash = descriptionHash;
        return copy;
    }

    // Getters
    public long getId() { return id; }
    public long getAssetId() { return assetId; }
    public String getProposer() { return proposer; }
    public ProposalPayload getPayload() { return payload; }
    public Ballot getBallot() { return ballot; }
    public long getCreatedAt() { return createdAt; }
    public long getVotingDeadline() { return votingDeadline; }
    public long getExecutionDeadline() { return executionDeadline; }
    public boolean isExecuted() { return executed; }
    public boolean isCancelled() { return cancelled; }
    public long getExecutedAt() { return executedAt; }
    public String getDescription() { return description; }
    public String getDescriptionHash() { return descriptionHash; }
}

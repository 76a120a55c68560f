package com.collectiveip.ledger.license;

import com.collectiveip.core.domain.Ballot;
import com.collectiveip.core.domain.GovernanceSettings;
import com.collectiveip.core.domain.LicenseOffer;
import com.collectiveip.core.domain.LicenseProposal;
import com.collectiveip.core.domain.OwnerEntry;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.TextHashes;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.kernel.Guards;
import com.collectiveip.ledger.kernel.LedgerContext;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.state.LicenseTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owner vote on new licenses.
 * <p>
 * A proposal carries a license blueprint. It passes when more than half of the governance weight
 * snapshotted at creation voted for it and participation reached the asset's license quorum; it
 * can then be executed by anyone during the execution window, creating an already approved
 * license with the proposer as licensor.
 */
public class LicenseProposalBoard {

    private static final Logger log = LoggerFactory.getLogger(LicenseProposalBoard.class);

    private final LedgerContext context;
    private final OwnershipLedger ownership;
    private final LicenseRegistry registry;

    public LicenseProposalBoard(LedgerContext context, OwnershipLedger ownership, LicenseRegistry registry) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
        this.ownership = Objects.requireNonNull(ownership, "Ownership ledger cannot be null");
        this.registry = Objects.requireNonNull(registry, "License registry cannot be null");
    }

    public long proposeLicenseTerms(String caller, long assetId, LicenseOffer blueprint, String description) {
        return context.guard().mutate("proposeLicenseTerms", () -> {
            String proposer = Guards.caller(caller);
            Guards.requirePresent(blueprint, "License blueprint");
            if (blueprint.assetId() != assetId) {
                throw new ValidationException(ErrorReason.LICENSE_NOT_OF_ASSET,
                        "Blueprint targets asset " + blueprint.assetId() + ", not " + assetId);
            }
            LicenseOffer normalized = registry.validateOffer(proposer, blueprint);

            GovernanceSettings settings = context.state().governance()
                    .settingsFor(assetId, context.config().defaultGovernanceSettings());
            Ballot ballot = Ballot.open(ownership.totalWeight(assetId), settings.licenseQuorumBps());
            LicenseTable table = table();
            LicenseProposal proposal = LicenseProposal.create(table.nextProposalId(), proposer, normalized, ballot,
                    context.now(), context.config().licenseVotingPeriod(), context.config().licenseExecutionWindow(),
                    description, TextHashes.keccak(description));
            table.putProposal(proposal);

            context.emit(LedgerEventType.LICENSE_PROPOSAL_CREATED, assetId, proposal.getId(), proposer,
                    Map.of("quorum", ballot.getQuorum(), "deadline", proposal.getDeadline()));
            log.info("License proposal {} created on asset {} by {}", proposal.getId(), assetId, proposer);
            return proposal.getId();
        });
    }

    public void voteOnLicenseProposal(String caller, long proposalId, boolean inFavor) {
        context.guard().mutate("voteOnLicenseProposal", () -> {
            String voter = Guards.caller(caller);
            LicenseProposal proposal = requireProposal(proposalId);
            OwnerEntry entry = ownership.requireOwner(proposal.getAssetId(), voter);
            if (proposal.isExecuted()) {
                throw new StateException(ErrorReason.PROPOSAL_ALREADY_EXECUTED,
                        "License proposal " + proposalId + " already executed");
            }
            if (proposal.getBallot().hasVoted(voter)) {
                throw new StateException(ErrorReason.ALREADY_VOTED, voter + " already voted on license proposal " + proposalId);
            }
            long now = context.now();
            if (!proposal.isVotingOpenAt(now)) {
                throw new StateException(ErrorReason.VOTING_CLOSED, "Voting on license proposal " + proposalId + " is closed");
            }
            proposal.getBallot().cast(voter, inFavor, entry.getGovernanceWeight(), now);

            context.emit(LedgerEventType.LICENSE_PROPOSAL_VOTED, proposal.getAssetId(), proposalId, voter,
                    Map.of("inFavor", inFavor, "weight", entry.getGovernanceWeight()));
            return null;
        });
    }

    /**
     * Executes a passed proposal.
     *
     * @return id of the license created
     */
    public long executeLicenseProposal(String caller, long proposalId) {
        return context.guard().mutate("executeLicenseProposal", () -> {
            String actor = Guards.caller(caller);
            LicenseProposal proposal = requireProposal(proposalId);
            if (proposal.isExecuted()) {
                throw new StateException(ErrorReason.PROPOSAL_ALREADY_EXECUTED,
                        "License proposal " + proposalId + " already executed");
            }
            long now = context.now();
            if (now <= proposal.getDeadline()) {
                throw new StateException(ErrorReason.VOTING_STILL_OPEN,
                        "Voting on license proposal " + proposalId + " ends at " + proposal.getDeadline());
            }
            if (now > proposal.getExecutionDeadline()) {
                throw new StateException(ErrorReason.EXECUTION_WINDOW_PASSED,
                        "Execution window of license proposal " + proposalId + " closed at " + proposal.getExecutionDeadline());
            }
            if (!proposal.getBallot().quorumReached()) {
                throw new StateException(ErrorReason.QUORUM_NOT_REACHED, "License proposal " + proposalId + " missed its quorum");
            }
            if (!proposal.getBallot().absoluteMajority()) {
                throw new StateException(ErrorReason.MAJORITY_NOT_REACHED,
                        "License proposal " + proposalId + " lacks a majority of the governance weight");
            }

            long licenseId = registry.issueApproved(proposal.getProposer(), proposal.getBlueprint());
            proposal.markExecuted(licenseId);

            context.emit(LedgerEventType.LICENSE_PROPOSAL_EXECUTED, proposal.getAssetId(), proposalId, actor,
                    Map.of("licenseId", licenseId));
            log.info("License proposal {} executed, created license {}", proposalId, licenseId);
            return licenseId;
        });
    }

    public Optional<LicenseProposal> proposal(long proposalId) {
        return context.guard().read(() -> table().proposal(proposalId).map(LicenseProposal::copy));
    }

    private LicenseProposal requireProposal(long proposalId) {
        return table().proposal(proposalId)
                .orElseThrow(() -> new StateException(ErrorReason.PROPOSAL_NOT_FOUND,
                        "License proposal not found: " + proposalId));
    }

    private LicenseTable table() {
        return context.state().licenses();
    }
}

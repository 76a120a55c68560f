package com.collectiveip.ledger.governance;

import com.collectiveip.core.domain.Ballot;
import com.collectiveip.core.domain.EmergencyActionType;
import com.collectiveip.core.domain.GovernanceProposal;
import com.collectiveip.core.domain.GovernanceSettings;
import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.OwnerEntry;
import com.collectiveip.core.domain.ProposalCategory;
import com.collectiveip.core.domain.ProposalPayload;
import com.collectiveip.core.domain.ProposalPayload.AssetManagementChange;
import com.collectiveip.core.domain.ProposalPayload.EmergencyActionRequest;
import com.collectiveip.core.domain.ProposalPayload.RevenuePolicyChange;
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
import com.collectiveip.ledger.license.LicenseRegistry;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.ownership.OwnershipLedger.AssetChange;
import com.collectiveip.ledger.revenue.RevenuePool;
import com.collectiveip.ledger.state.GovernanceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Weighted proposal, vote and execute cycle for asset management, revenue policy and emergency
 * actions.
 * <p>
 * The quorum is derived from the total governance weight at creation. Each vote counts the
 * voter's weight at the time it is cast, so transfers during the voting period change how much
 * weight an owner can cast without moving the quorum target.
 */
public class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final LedgerContext context;
    private final OwnershipLedger ownership;
    private final RevenuePool revenue;
    private final LicenseRegistry licenses;

    public GovernanceEngine(LedgerContext context, OwnershipLedger ownership, RevenuePool revenue,
                            LicenseRegistry licenses) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
        this.ownership = Objects.requireNonNull(ownership, "Ownership ledger cannot be null");
        this.revenue = Objects.requireNonNull(revenue, "Revenue pool cannot be null");
        this.licenses = Objects.requireNonNull(licenses, "License registry cannot be null");
    }

    /**
     * Outcome of an emergency execution.
     *
     * @param licensesSuspended number of licenses suspended, 0 for a pause
     */
    public record EmergencyOutcome(EmergencyActionType action, int licensesSuspended) {}

    // ==================== Proposals ====================

    /**
     * Opens a proposal.
     *
     * @param votingDuration seconds, 0 for the category default
     * @return the proposal id
     */
    public long createProposal(String caller, long assetId, ProposalPayload payload, long votingDuration,
                               String description) {
        return context.guard().mutate("createProposal", () -> {
            String proposer = Guards.caller(caller);
            ownership.requireOwner(assetId, proposer);
            if (payload == null) {
                throw new ValidationException(ErrorReason.EMPTY_PROPOSAL_PAYLOAD, "Proposal payload is required");
            }
            ProposalPayload normalized = validatePayload(assetId, payload);
            if (votingDuration < 0) {
                throw new ValidationException(ErrorReason.INVALID_DURATION, "Voting duration cannot be negative");
            }

            ProposalCategory category = normalized.category();
            GovernanceSettings settings = settingsFor(assetId);
            long duration = votingDuration == 0 ? settings.votingDurationFor(category) : votingDuration;
            Ballot ballot = Ballot.open(ownership.totalWeight(assetId), settings.quorumBpsFor(category));

            GovernanceTable table = table();
            GovernanceProposal proposal = GovernanceProposal.create(table.nextProposalId(), assetId, proposer,
                    normalized, ballot, context.now(), duration, settings.executionDelay(),
                    description, TextHashes.keccak(description));
            table.putProposal(proposal);

            context.emit(LedgerEventType.PROPOSAL_CREATED, assetId, proposal.getId(), proposer,
                    Map.of("category", category.name(), "quorum", ballot.getQuorum(),
                            "votingDeadline", proposal.getVotingDeadline()));
            log.info("Proposal {} ({}) created on asset {} by {}, quorum {} of {}",
                    proposal.getId(), category, assetId, proposer, ballot.getQuorum(), ballot.getTotalWeightSnapshot());
            return proposal.getId();
        });
    }

    public long proposeAssetManagement(String caller, long assetId, AssetManagementChange change,
                                       long votingDuration, String description) {
        return createProposal(caller, assetId, change, votingDuration, description);
    }

    public long proposeRevenuePolicy(String caller, long assetId, RevenuePolicyChange change,
                                     long votingDuration, String description) {
        return createProposal(caller, assetId, change, votingDuration, description);
    }

    public long proposeEmergencyAction(String caller, long assetId, EmergencyActionRequest request,
                                       long votingDuration, String description) {
        return createProposal(caller, assetId, request, votingDuration, description);
    }

    public void vote(String caller, long proposalId, boolean inFavor) {
        context.guard().mutate("vote", () -> {
            String voter = Guards.caller(caller);
            GovernanceProposal proposal = requireProposal(proposalId);
            OwnerEntry entry = ownership.requireOwner(proposal.getAssetId(), voter);
            requireOpen(proposal);
            if (proposal.getBallot().hasVoted(voter)) {
                throw new StateException(ErrorReason.ALREADY_VOTED, voter + " already voted on proposal " + proposalId);
            }
            long now = context.now();
            if (!proposal.isVotingOpenAt(now)) {
                throw new StateException(ErrorReason.VOTING_CLOSED,
                        "Voting on proposal " + proposalId + " closed at " + proposal.getVotingDeadline());
            }
            proposal.getBallot().cast(voter, inFavor, entry.getGovernanceWeight(), now);

            context.emit(LedgerEventType.VOTE_CAST, proposal.getAssetId(), proposalId, voter,
                    Map.of("inFavor", inFavor, "weight", entry.getGovernanceWeight()));
            log.debug("Proposal {}: {} voted {} with weight {}", proposalId, voter, inFavor ? "for" : "against",
                    entry.getGovernanceWeight());
            return null;
        });
    }

    public void cancelProposal(String caller, long proposalId) {
        context.guard().mutate("cancelProposal", () -> {
            String actor = Guards.caller(caller);
            GovernanceProposal proposal = requireProposal(proposalId);
            if (!proposal.getProposer().equals(actor)) {
                throw new AuthorizationException(ErrorReason.NOT_PROPOSER, actor + " did not create proposal " + proposalId);
            }
            requireOpen(proposal);
            proposal.cancel();

            context.emit(LedgerEventType.PROPOSAL_CANCELLED, proposal.getAssetId(), proposalId, actor);
            log.info("Proposal {} cancelled by {}", proposalId, actor);
            return null;
        });
    }

    public boolean canExecute(long proposalId) {
        return context.guard().read(() -> table().proposal(proposalId)
                .map(proposal -> proposal.canExecuteAt(context.now()))
                .orElse(false));
    }

    // ==================== Execution ====================

    /**
     * Applies a passed asset-management proposal.
     *
     * @return which fields actually changed
     */
    public AssetChange executeAssetManagement(String caller, long proposalId) {
        return context.guard().mutate("executeAssetManagement", () -> {
            String actor = Guards.caller(caller);
            GovernanceProposal proposal = beginExecution(proposalId, ProposalCategory.ASSET_MANAGEMENT, actor);
            AssetManagementChange change = (AssetManagementChange) proposal.getPayload();
            return ownership.applyAssetChange(proposal.getAssetId(), actor,
                    change.updateMetadata() ? change.newMetadataUri() : null,
                    change.updateCompliance() ? change.newComplianceStatus() : null);
        });
    }

    /**
     * Applies a passed revenue-policy proposal.
     *
     * @return the new minimum distribution
     */
    public BigInteger executeRevenuePolicy(String caller, long proposalId) {
        return context.guard().mutate("executeRevenuePolicy", () -> {
            String actor = Guards.caller(caller);
            GovernanceProposal proposal = beginExecution(proposalId, ProposalCategory.REVENUE_POLICY, actor);
            RevenuePolicyChange change = (RevenuePolicyChange) proposal.getPayload();
            revenue.applyMinimumDistribution(proposal.getAssetId(), change.currency(), change.newMinimumDistribution(), actor);
            return change.newMinimumDistribution();
        });
    }

    public EmergencyOutcome executeEmergency(String caller, long proposalId) {
        return context.guard().mutate("executeEmergency", () -> {
            String actor = Guards.caller(caller);
            GovernanceProposal proposal = beginExecution(proposalId, ProposalCategory.EMERGENCY, actor);
            EmergencyActionRequest request = (EmergencyActionRequest) proposal.getPayload();
            EmergencyOutcome outcome = switch (request.action()) {
                case SUSPEND_LICENSE -> {
                    licenses.suspendForGovernance(request.targetLicenseId(), request.suspensionDuration());
                    yield new EmergencyOutcome(request.action(), 1);
                }
                case SUSPEND_ALL_LICENSES -> new EmergencyOutcome(request.action(),
                        licenses.suspendAllForAsset(proposal.getAssetId(), request.suspensionDuration()));
                case PAUSE -> {
                    context.state().setPaused(true);
                    context.emit(LedgerEventType.SYSTEM_PAUSED, proposal.getAssetId(), proposalId, actor);
                    log.warn("Ledger paused by emergency proposal {}: {}", proposalId, request.reason());
                    yield new EmergencyOutcome(request.action(), 0);
                }
            };
            return outcome;
        });
    }

    /**
     * Active proposals of an asset: neither executed nor cancelled, and still within their
     * execution window.
     */
    public List<GovernanceProposal> activeProposals(long assetId) {
        return context.guard().read(() -> {
            long now = context.now();
            List<GovernanceProposal> active = new ArrayList<>();
            for (GovernanceProposal proposal : table().proposalsOf(assetId)) {
                if (proposal.isOpen() && now <= proposal.getExecutionDeadline()) {
                    active.add(proposal.copy());
                }
            }
            return active;
        });
    }

    public Optional<GovernanceProposal> proposal(long proposalId) {
        return context.guard().read(() -> table().proposal(proposalId).map(GovernanceProposal::copy));
    }

    // ==================== Settings ====================

    public void setGovernanceSettings(String caller, long assetId, GovernanceSettings settings) {
        context.guard().mutate("setGovernanceSettings", () -> {
            String actor = Guards.caller(caller);
            ownership.requireOwner(assetId, actor);
            Guards.requirePresent(settings, "Governance settings").validate();
            table().putSettings(assetId, settings);

            context.emit(LedgerEventType.GOVERNANCE_SETTINGS_UPDATED, assetId, 0, actor);
            log.info("Governance settings of asset {} updated by {}", assetId, actor);
            return null;
        });
    }

    public GovernanceSettings getGovernanceSettings(long assetId) {
        return context.guard().read(() -> settingsFor(assetId));
    }

    // ==================== Internal ====================

    private GovernanceProposal beginExecution(long proposalId, ProposalCategory category, String actor) {
        GovernanceProposal proposal = requireProposal(proposalId);
        if (proposal.getCategory() != category) {
            throw new ValidationException(ErrorReason.WRONG_PROPOSAL_CATEGORY,
                    "Proposal " + proposalId + " is " + proposal.getCategory() + ", not " + category);
        }
        requireOpen(proposal);
        long now = context.now();
        if (now <= proposal.getVotingDeadline()) {
            throw new StateException(ErrorReason.VOTING_STILL_OPEN,
                    "Voting on proposal " + proposalId + " ends at " + proposal.getVotingDeadline());
        }
        if (now > proposal.getExecutionDeadline()) {
            throw new StateException(ErrorReason.EXECUTION_WINDOW_PASSED,
                    "Execution window of proposal " + proposalId + " closed at " + proposal.getExecutionDeadline());
        }
        Ballot ballot = proposal.getBallot();
        if (!ballot.quorumReached()) {
            throw new StateException(ErrorReason.QUORUM_NOT_REACHED,
                    "Proposal " + proposalId + " has " + ballot.participation() + " of " + ballot.getQuorum() + " quorum");
        }
        if (!ballot.relativeMajority()) {
            throw new StateException(ErrorReason.MAJORITY_NOT_REACHED,
                    "Proposal " + proposalId + " has " + ballot.getVotesFor() + " for and " + ballot.getVotesAgainst() + " against");
        }
        proposal.markExecuted(now);

        context.emit(LedgerEventType.PROPOSAL_EXECUTED, proposal.getAssetId(), proposalId, actor,
                Map.of("category", category.name()));
        log.info("Proposal {} ({}) executed on asset {}", proposalId, category, proposal.getAssetId());
        return proposal;
    }

    private ProposalPayload validatePayload(long assetId, ProposalPayload payload) {
        if (payload instanceof AssetManagementChange change) {
            if (!change.updateMetadata() && !change.updateCompliance()) {
                throw new ValidationException(ErrorReason.EMPTY_PROPOSAL_PAYLOAD, "Asset change updates nothing");
            }
            if (change.updateMetadata()) {
                Guards.requirePresent(change.newMetadataUri(), "New metadata URI");
            }
            if (change.updateCompliance()) {
                Guards.requirePresent(change.newComplianceStatus(), "New compliance status");
            }
            return change;
        }
        if (payload instanceof RevenuePolicyChange change) {
            String currency = Addresses.normalize(change.currency(), "currency");
            Guards.requireNonNegative(change.newMinimumDistribution(), "Minimum distribution");
            return new RevenuePolicyChange(currency, change.newMinimumDistribution());
        }
        EmergencyActionRequest request = (EmergencyActionRequest) payload;
        Guards.requirePresent(request.action(), "Emergency action");
        if (request.action() == EmergencyActionType.SUSPEND_LICENSE) {
            License license = licenses.requireLicense(request.targetLicenseId());
            if (license.getAssetId() != assetId) {
                throw new ValidationException(ErrorReason.LICENSE_NOT_OF_ASSET,
                        "License " + license.getId() + " does not belong to asset " + assetId);
            }
        }
        if (request.action() != EmergencyActionType.PAUSE && request.suspensionDuration() <= 0) {
            throw new ValidationException(ErrorReason.INVALID_DURATION, "Suspension duration must be positive");
        }
        if (request.action() != EmergencyActionType.PAUSE) {
            Timestamps.after(context.now(), request.suspensionDuration(), "Suspension duration");
        }
        return request;
    }

    private void requireOpen(GovernanceProposal proposal) {
        if (proposal.isExecuted()) {
            throw new StateException(ErrorReason.PROPOSAL_ALREADY_EXECUTED, "Proposal " + proposal.getId() + " already executed");
        }
        if (proposal.isCancelled()) {
            throw new StateException(ErrorReason.PROPOSAL_CANCELLED, "Proposal " + proposal.getId() + " was cancelled");
        }
    }

    private GovernanceProposal requireProposal(long proposalId) {
        return table().proposal(proposalId)
                .orElseThrow(() -> new StateException(ErrorReason.PROPOSAL_NOT_FOUND, "Proposal not found: " + proposalId));
    }

    private GovernanceSettings settingsFor(long assetId) {
        return table().settingsFor(assetId, context.config().defaultGovernanceSettings());
    }

    private GovernanceTable table() {
        return context.state().governance();
    }
}

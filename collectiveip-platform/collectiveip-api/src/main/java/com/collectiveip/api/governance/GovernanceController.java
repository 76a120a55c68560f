package com.collectiveip.api.governance;

import com.collectiveip.core.domain.Ballot;
import com.collectiveip.core.domain.EmergencyActionType;
import com.collectiveip.core.domain.GovernanceProposal;
import com.collectiveip.core.domain.GovernanceSettings;
import com.collectiveip.core.domain.ProposalCategory;
import com.collectiveip.core.domain.ProposalPayload;
import com.collectiveip.core.domain.ProposalPayload.AssetManagementChange;
import com.collectiveip.core.domain.ProposalPayload.EmergencyActionRequest;
import com.collectiveip.core.domain.ProposalPayload.RevenuePolicyChange;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.ledger.governance.GovernanceEngine;
import com.collectiveip.ledger.governance.GovernanceEngine.EmergencyOutcome;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.ownership.OwnershipLedger.AssetChange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Owner governance: proposals, weighted votes, execution and per-asset settings.
 */
@RestController
@RequestMapping("/api/v1/governance")
public class GovernanceController {

    private final GovernanceEngine governance;

    public GovernanceController(CollectiveLedger ledger) {
        this.governance = ledger.governance();
    }

    // ==================== Proposals ====================

    /**
     * Propose a metadata and/or compliance-status change.
     * POST /api/v1/governance/proposals/asset-management
     */
    @PostMapping("/proposals/asset-management")
    public ResponseEntity<ProposalResponse> proposeAssetManagement(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody AssetManagementProposalRequest request) {
        var change = new AssetManagementChange(request.newMetadataUri(), request.newComplianceStatus(),
                request.updateMetadata(), request.updateCompliance());
        long proposalId = governance.proposeAssetManagement(caller, request.assetId(), change,
                request.votingDuration(), request.description());
        return created(proposalId);
    }

    @PostMapping("/proposals/revenue-policy")
    public ResponseEntity<ProposalResponse> proposeRevenuePolicy(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody RevenuePolicyProposalRequest request) {
        var change = new RevenuePolicyChange(request.currency(), request.newMinimumDistribution());
        long proposalId = governance.proposeRevenuePolicy(caller, request.assetId(), change,
                request.votingDuration(), request.description());
        return created(proposalId);
    }

    @PostMapping("/proposals/emergency")
    public ResponseEntity<ProposalResponse> proposeEmergency(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody EmergencyProposalRequest request) {
        var action = new EmergencyActionRequest(request.action(), request.targetLicenseId(),
                request.suspensionDuration(), request.reason());
        long proposalId = governance.proposeEmergencyAction(caller, request.assetId(), action,
                request.votingDuration(), request.description());
        return created(proposalId);
    }

    @GetMapping("/proposals/{proposalId}")
    public ResponseEntity<ProposalResponse> getProposal(@PathVariable long proposalId) {
        return governance.proposal(proposalId)
                .map(proposal -> ResponseEntity.ok(ProposalResponse.from(proposal)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/assets/{assetId}/proposals")
    public ResponseEntity<List<ProposalResponse>> getActiveProposals(@PathVariable long assetId) {
        return ResponseEntity.ok(governance.activeProposals(assetId).stream()
                .map(ProposalResponse::from)
                .toList());
    }

    @PostMapping("/proposals/{proposalId}/votes")
    public ResponseEntity<ProposalResponse> vote(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long proposalId,
            @Valid @RequestBody VoteRequest request) {
        governance.vote(caller, proposalId, request.inFavor());
        return ResponseEntity.ok(describe(proposalId));
    }

    @PostMapping("/proposals/{proposalId}/cancellation")
    public ResponseEntity<ProposalResponse> cancel(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long proposalId) {
        governance.cancelProposal(caller, proposalId);
        return ResponseEntity.ok(describe(proposalId));
    }

    @GetMapping("/proposals/{proposalId}/executable")
    public ResponseEntity<ExecutableResponse> canExecute(@PathVariable long proposalId) {
        return ResponseEntity.ok(new ExecutableResponse(proposalId, governance.canExecute(proposalId)));
    }

    /**
     * Execute a passed proposal. The handler is picked by the proposal's category.
     * POST /api/v1/governance/proposals/{proposalId}/execution
     */
    @PostMapping("/proposals/{proposalId}/execution")
    public ResponseEntity<ExecutionResponse> execute(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long proposalId) {
        GovernanceProposal proposal = governance.proposal(proposalId)
                .orElseThrow(() -> new StateException(ErrorReason.PROPOSAL_NOT_FOUND,
                        "Proposal " + proposalId + " does not exist"));
        ExecutionResponse response = switch (proposal.getCategory()) {
            case ASSET_MANAGEMENT -> {
                AssetChange change = governance.executeAssetManagement(caller, proposalId);
                yield new ExecutionResponse(proposalId, ProposalCategory.ASSET_MANAGEMENT,
                        change.metadataChanged(), change.complianceChanged(), null, null, 0);
            }
            case REVENUE_POLICY -> {
                BigInteger minimum = governance.executeRevenuePolicy(caller, proposalId);
                yield new ExecutionResponse(proposalId, ProposalCategory.REVENUE_POLICY,
                        false, false, minimum, null, 0);
            }
            case EMERGENCY -> {
                EmergencyOutcome outcome = governance.executeEmergency(caller, proposalId);
                yield new ExecutionResponse(proposalId, ProposalCategory.EMERGENCY,
                        false, false, null, outcome.action(), outcome.licensesSuspended());
            }
        };
        return ResponseEntity.ok(response);
    }

    // ==================== Settings ====================

    @GetMapping("/assets/{assetId}/settings")
    public ResponseEntity<GovernanceSettings> getSettings(@PathVariable long assetId) {
        return ResponseEntity.ok(governance.getGovernanceSettings(assetId));
    }

    @PutMapping("/assets/{assetId}/settings")
    public ResponseEntity<GovernanceSettings> updateSettings(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody SettingsRequest request) {
        governance.setGovernanceSettings(caller, assetId, request.toSettings());
        return ResponseEntity.ok(governance.getGovernanceSettings(assetId));
    }

    private ResponseEntity<ProposalResponse> created(long proposalId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(describe(proposalId));
    }

    private ProposalResponse describe(long proposalId) {
        return ProposalResponse.from(governance.proposal(proposalId).orElseThrow());
    }

    // DTOs
    public record AssetManagementProposalRequest(
        @NotNull Long assetId,
        String newMetadataUri,
        String newComplianceStatus,
        boolean updateMetadata,
        boolean updateCompliance,
        @Min(0) long votingDuration,
        String description
    ) {}

    public record RevenuePolicyProposalRequest(
        @NotNull Long assetId,
        @NotBlank String currency,
        @NotNull BigInteger newMinimumDistribution,
        @Min(0) long votingDuration,
        String description
    ) {}

    public record EmergencyProposalRequest(
        @NotNull Long assetId,
        @NotNull EmergencyActionType action,
        long targetLicenseId,
        long suspensionDuration,
        String reason,
        @Min(0) long votingDuration,
        String description
    ) {}

    public record VoteRequest(@NotNull Boolean inFavor) {}

    public record SettingsRequest(
        int defaultQuorumBps,
        int emergencyQuorumBps,
        int licenseQuorumBps,
        int assetManagementQuorumBps,
        int revenuePolicyQuorumBps,
        long defaultVotingDuration,
        long emergencyVotingDuration,
        long executionDelay
    ) {
        GovernanceSettings toSettings() {
            return new GovernanceSettings(defaultQuorumBps, emergencyQuorumBps, licenseQuorumBps,
                    assetManagementQuorumBps, revenuePolicyQuorumBps, defaultVotingDuration,
                    emergencyVotingDuration, executionDelay);
        }
    }

    public record ExecutableResponse(long proposalId, boolean executable) {}

    public record ExecutionResponse(
        long proposalId,
        ProposalCategory category,
        boolean metadataChanged,
        boolean complianceChanged,
        BigInteger newMinimumDistribution,
        EmergencyActionType emergencyAction,
        int licensesSuspended
    ) {}

    public record ProposalResponse(
        long proposalId,
        long assetId,
        String proposer,
        ProposalCategory category,
        ProposalPayload payload,
        String description,
        String descriptionHash,
        long totalWeightSnapshot,
        long quorum,
        long votesFor,
        long votesAgainst,
        long createdAt,
        long votingDeadline,
        long executionDeadline,
        boolean executed,
        boolean cancelled
    ) {
        static ProposalResponse from(GovernanceProposal proposal) {
            Ballot ballot = proposal.getBallot();
            return new ProposalResponse(proposal.getId(), proposal.getAssetId(), proposal.getProposer(),
                    proposal.getCategory(), proposal.getPayload(), proposal.getDescription(),
                    proposal.getDescriptionHash(), ballot.getTotalWeightSnapshot(), ballot.getQuorum(),
                    ballot.getVotesFor(), ballot.getVotesAgainst(), proposal.getCreatedAt(),
                    proposal.getVotingDeadline(), proposal.getExecutionDeadline(), proposal.isExecuted(),
                    proposal.isCancelled());
        }
    }
}

package com.collectiveip.api.license;

import com.collectiveip.core.domain.Ballot;
import com.collectiveip.core.domain.LicenseProposal;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.license.LicenseProposalBoard;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Owner-voted license proposals. A passed proposal issues a pre-approved license.
 */
@RestController
@RequestMapping("/api/v1/license-proposals")
public class LicenseProposalController {

    private final LicenseProposalBoard board;

    public LicenseProposalController(CollectiveLedger ledger) {
        this.board = ledger.licenseProposals();
    }

    /**
     * Propose license terms for a vote among the asset owners.
     * POST /api/v1/license-proposals
     */
    @PostMapping
    public ResponseEntity<ProposalResponse> propose(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody ProposeLicenseRequest request) {
        long proposalId = board.proposeLicenseTerms(caller, request.offer().assetId(),
                request.offer().toOffer(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(describe(proposalId));
    }

    @GetMapping("/{proposalId}")
    public ResponseEntity<ProposalResponse> getProposal(@PathVariable long proposalId) {
        return board.proposal(proposalId)
                .map(proposal -> ResponseEntity.ok(ProposalResponse.from(proposal)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{proposalId}/votes")
    public ResponseEntity<ProposalResponse> vote(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long proposalId,
            @Valid @RequestBody VoteRequest request) {
        board.voteOnLicenseProposal(caller, proposalId, request.inFavor());
        return ResponseEntity.ok(describe(proposalId));
    }

    /**
     * Execute a passed proposal during its execution window.
     * POST /api/v1/license-proposals/{proposalId}/execution
     */
    @PostMapping("/{proposalId}/execution")
    public ResponseEntity<ExecutionResponse> execute(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long proposalId) {
        long licenseId = board.executeLicenseProposal(caller, proposalId);
        return ResponseEntity.ok(new ExecutionResponse(proposalId, licenseId));
    }

    private ProposalResponse describe(long proposalId) {
        return ProposalResponse.from(board.proposal(proposalId).orElseThrow());
    }

    // DTOs
    public record ProposeLicenseRequest(@NotNull @Valid LicenseOfferRequest offer, String description) {}

    public record VoteRequest(@NotNull Boolean inFavor) {}

    public record ExecutionResponse(long proposalId, long licenseId) {}

    public record ProposalResponse(
        long proposalId,
        long assetId,
        String proposer,
        String description,
        String descriptionHash,
        long totalWeightSnapshot,
        long quorum,
        long votesFor,
        long votesAgainst,
        long deadline,
        long executionDeadline,
        boolean executed,
        long resultingLicenseId
    ) {
        static ProposalResponse from(LicenseProposal proposal) {
            Ballot ballot = proposal.getBallot();
            return new ProposalResponse(proposal.getId(), proposal.getAssetId(), proposal.getProposer(),
                    proposal.getDescription(), proposal.getDescriptionHash(), ballot.getTotalWeightSnapshot(),
                    ballot.getQuorum(), ballot.getVotesFor(), ballot.getVotesAgainst(), proposal.getDeadline(),
                    proposal.getExecutionDeadline(), proposal.isExecuted(), proposal.getResultingLicenseId());
        }
    }
}

package com.collectiveip.ledger.state;

import com.collectiveip.core.domain.GovernanceProposal;
import com.collectiveip.core.domain.GovernanceSettings;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Governance proposals and per-asset settings overrides.
 */
public class GovernanceTable {

    private final Map<Long, GovernanceProposal> proposals;
    private final Map<Long, GovernanceSettings> settings;
    private long lastProposalId;

    public GovernanceTable() {
        this.proposals = new LinkedHashMap<>();
        this.settings = new LinkedHashMap<>();
    }

    public long nextProposalId() {
        return ++lastProposalId;
    }

    public void putProposal(GovernanceProposal proposal) {
        proposals.put(proposal.getId(), proposal);
    }

    public Optional<GovernanceProposal> proposal(long proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    public List<GovernanceProposal> proposalsOf(long assetId) {
        List<GovernanceProposal> result = new ArrayList<>();
        for (GovernanceProposal proposal : proposals.values()) {
            if (proposal.getAssetId() == assetId) {
                result.add(proposal);
            }
        }
        return result;
    }

    public GovernanceSettings settingsFor(long assetId, GovernanceSettings defaults) {
        return settings.getOrDefault(assetId, defaults);
    }

    public void putSettings(long assetId, GovernanceSettings value) {
        settings.put(assetId, value);
    }

    public GovernanceTable copy() {
        var copy = new GovernanceTable();
        proposals.forEach((id, proposal) -> copy.proposals.put(id, proposal.copy()));
        copy.settings.putAll(settings);
        copy.lastProposalId = lastProposalId;
        return copy;
    }
}

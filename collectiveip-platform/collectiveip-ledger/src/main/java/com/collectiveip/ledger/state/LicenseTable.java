package com.collectiveip.ledger.state;

import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.LicenseProposal;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Licenses and license proposals.
 */
public class LicenseTable {

    private final Map<Long, License> licenses;
    private final Map<Long, List<Long>> licensesByAsset;
    private final Map<Long, LicenseProposal> proposals;
    private long lastLicenseId;
    private long lastProposalId;

    public LicenseTable() {
        this.licenses = new LinkedHashMap<>();
        this.licensesByAsset = new LinkedHashMap<>();
        this.proposals = new LinkedHashMap<>();
    }

    public long nextLicenseId() {
        return ++lastLicenseId;
    }

    public long nextProposalId() {
        return ++lastProposalId;
    }

    public void putLicense(License license) {
        if (licenses.put(license.getId(), license) == null) {
            licensesByAsset.computeIfAbsent(license.getAssetId(), k -> new ArrayList<>()).add(license.getId());
        }
    }

    public Optional<License> license(long licenseId) {
        return Optional.ofNullable(licenses.get(licenseId));
    }

    public List<License> licensesOf(long assetId) {
        List<License> result = new ArrayList<>();
        for (Long id : licensesByAsset.getOrDefault(assetId, List.of())) {
            result.add(licenses.get(id));
        }
        return result;
    }

    public void putProposal(LicenseProposal proposal) {
        proposals.put(proposal.getId(), proposal);
    }

    public Optional<LicenseProposal> proposal(long proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    public LicenseTable copy() {
        var copy = new LicenseTable();
        licenses.forEach((id, license) -> copy.licenses.put(id, license.copy()));
        licensesByAsset.forEach((id, ids) -> copy.licensesByAsset.put(id, new ArrayList<>(ids)));
        proposals.forEach((id, proposal) -> copy.proposals.put(id, proposal.copy()));
        copy.lastLicenseId = lastLicenseId;
        copy.lastProposalId = lastProposalId;
        return copy;
    }
}

package com.collectiveip.api.asset;

import com.collectiveip.core.domain.Asset;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.ownership.OwnershipLedger.OwnerShare;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Asset registration, ownership and maintenance.
 */
@RestController
@RequestMapping("/api/v1/assets")
public class AssetController {

    private final OwnershipLedger ownership;

    public AssetController(CollectiveLedger ledger) {
        this.ownership = ledger.ownership();
    }

    /**
     * Register an asset with its initial owners.
     * POST /api/v1/assets
     */
    @PostMapping
    public ResponseEntity<AssetResponse> registerAsset(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody RegisterAssetRequest request) {
        long assetId = ownership.registerAsset(caller, request.assetType(), request.metadataUri(),
                request.owners().stream().map(OwnerShareRequest::owner).toList(),
                request.owners().stream().map(OwnerShareRequest::percentage).toList(),
                request.owners().stream().map(OwnerShareRequest::governanceWeight).toList());
        return ResponseEntity.status(HttpStatus.CREATED).body(describe(assetId));
    }

    @GetMapping("/{assetId}")
    public ResponseEntity<AssetResponse> getAsset(@PathVariable long assetId) {
        return ownership.asset(assetId)
                .map(asset -> ResponseEntity.ok(AssetResponse.from(asset, ownership.owners(assetId))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<Long>> findByComplianceStatus(@RequestParam String complianceStatus) {
        return ResponseEntity.ok(ownership.assetsByComplianceStatus(complianceStatus));
    }

    /**
     * Replace the owner set. Administrator only.
     * PUT /api/v1/assets/{assetId}/owners
     */
    @PutMapping("/{assetId}/owners")
    public ResponseEntity<AssetResponse> registerOwnership(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody ReplaceOwnersRequest request) {
        ownership.registerOwnership(caller, assetId,
                request.owners().stream().map(OwnerShareRequest::owner).toList(),
                request.owners().stream().map(OwnerShareRequest::percentage).toList(),
                request.owners().stream().map(OwnerShareRequest::governanceWeight).toList());
        return ResponseEntity.ok(describe(assetId));
    }

    @GetMapping("/{assetId}/owners/{address}")
    public ResponseEntity<OwnerStatusResponse> getOwnerStatus(@PathVariable long assetId, @PathVariable String address) {
        return ResponseEntity.ok(new OwnerStatusResponse(
                ownership.isOwner(assetId, address),
                ownership.isMember(assetId, address),
                ownership.hasGovernanceRights(assetId, address),
                ownership.percentageOf(assetId, address),
                ownership.governanceWeightOf(assetId, address)));
    }

    @PostMapping("/{assetId}/transfers")
    public ResponseEntity<TransferResponse> transferShare(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody TransferShareRequest request) {
        long weight = ownership.transferShare(caller, assetId, request.from(), request.to(), request.percentage());
        return ResponseEntity.ok(new TransferResponse(assetId, request.percentage(), weight));
    }

    @PutMapping("/{assetId}/metadata")
    public ResponseEntity<ChangeResponse> updateMetadata(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody UpdateMetadataRequest request) {
        return ResponseEntity.ok(new ChangeResponse(ownership.updateMetadata(caller, assetId, request.metadataUri())));
    }

    @PutMapping("/{assetId}/compliance-status")
    public ResponseEntity<ChangeResponse> updateComplianceStatus(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody UpdateComplianceRequest request) {
        return ResponseEntity.ok(new ChangeResponse(
                ownership.updateComplianceStatus(caller, assetId, request.complianceStatus())));
    }

    @PostMapping("/{assetId}/supply")
    public ResponseEntity<SupplyResponse> mintAdditionalSupply(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody MintSupplyRequest request) {
        return ResponseEntity.ok(new SupplyResponse(ownership.mintAdditionalSupply(caller, assetId, request.amount())));
    }

    private AssetResponse describe(long assetId) {
        Asset asset = ownership.asset(assetId).orElseThrow();
        return AssetResponse.from(asset, ownership.owners(assetId));
    }

    // DTOs
    public record OwnerShareRequest(
        @NotBlank String owner,
        @NotNull @Min(0) @Max(100) Integer percentage,
        @NotNull @Min(0) Long governanceWeight
    ) {}

    public record RegisterAssetRequest(
        @NotBlank String assetType,
        @NotBlank String metadataUri,
        @NotEmpty List<@Valid OwnerShareRequest> owners
    ) {}

    public record ReplaceOwnersRequest(@NotEmpty List<@Valid OwnerShareRequest> owners) {}

    public record TransferShareRequest(@NotBlank String from, @NotBlank String to, @NotNull Integer percentage) {}

    public record UpdateMetadataRequest(@NotBlank String metadataUri) {}

    public record UpdateComplianceRequest(@NotBlank String complianceStatus) {}

    public record MintSupplyRequest(@NotNull BigInteger amount) {}

    public record AssetResponse(
        long assetId,
        String assetType,
        String metadataUri,
        BigInteger totalSupply,
        long createdAt,
        String complianceStatus,
        List<OwnerShare> owners
    ) {
        static AssetResponse from(Asset asset, List<OwnerShare> owners) {
            return new AssetResponse(asset.getId(), asset.getAssetType(), asset.getMetadataUri(),
                    asset.getTotalSupply(), asset.getCreatedAt(), asset.getComplianceStatus(), owners);
        }
    }

    public record OwnerStatusResponse(
        boolean owner,
        boolean member,
        boolean governanceRights,
        int percentage,
        long governanceWeight
    ) {}

    public record TransferResponse(long assetId, int percentage, long governanceWeightMoved) {}

    public record ChangeResponse(boolean changed) {}

    public record SupplyResponse(BigInteger totalSupply) {}
}

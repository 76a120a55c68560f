package com.collectiveip.api.license;

import com.collectiveip.core.domain.License;
import com.collectiveip.core.domain.LicenseStatus;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.license.LicenseRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.List;

/**
 * License lifecycle: offer, approval, execution, suspension, transfer, usage and royalties.
 */
@RestController
@RequestMapping("/api/v1/licenses")
public class LicenseController {

    private final LicenseRegistry licenses;

    public LicenseController(CollectiveLedger ledger) {
        this.licenses = ledger.licenses();
    }

    /**
     * Offer a license on an asset the caller owns.
     * POST /api/v1/licenses
     */
    @PostMapping
    public ResponseEntity<LicenseResponse> createOffer(
            @RequestHeader("X-Caller-Address") String caller,
            @Valid @RequestBody LicenseOfferRequest request) {
        long licenseId = licenses.createOffer(caller, request.toOffer());
        return ResponseEntity.status(HttpStatus.CREATED).body(describe(licenseId));
    }

    @GetMapping("/{licenseId}")
    public ResponseEntity<LicenseResponse> getLicense(@PathVariable long licenseId) {
        return licenses.license(licenseId)
                .map(license -> ResponseEntity.ok(LicenseResponse.from(license, licenses.getStatus(licenseId))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping
    public ResponseEntity<List<LicenseResponse>> getLicensesOfAsset(@RequestParam long assetId) {
        List<LicenseResponse> result = licenses.licensesOf(assetId).stream()
                .map(license -> LicenseResponse.from(license, licenses.getStatus(license.getId())))
                .toList();
        return ResponseEntity.ok(result);
    }

    /**
     * Status is NOT_FOUND rather than 404 for unknown ids.
     */
    @GetMapping("/{licenseId}/status")
    public ResponseEntity<StatusResponse> getStatus(@PathVariable long licenseId) {
        return ResponseEntity.ok(new StatusResponse(licenseId, licenses.getStatus(licenseId)));
    }

    @PostMapping("/{licenseId}/approval")
    public ResponseEntity<LicenseResponse> approve(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @Valid @RequestBody ApprovalRequest request) {
        licenses.approve(caller, licenseId, request.approve());
        return ResponseEntity.ok(describe(licenseId));
    }

    /**
     * Licensee accepts the license and pays its fee.
     * POST /api/v1/licenses/{licenseId}/execution
     */
    @PostMapping("/{licenseId}/execution")
    public ResponseEntity<LicenseResponse> execute(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId) {
        licenses.execute(caller, licenseId);
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/revocation")
    public ResponseEntity<LicenseResponse> revoke(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @RequestBody RevokeRequest request) {
        licenses.revoke(caller, licenseId, request.reason());
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/suspension")
    public ResponseEntity<LicenseResponse> suspend(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @Valid @RequestBody SuspendRequest request) {
        licenses.suspend(caller, licenseId, request.durationSeconds());
        return ResponseEntity.ok(describe(licenseId));
    }

    /**
     * Reactivate once the suspension has elapsed. Open to any caller.
     */
    @PostMapping("/{licenseId}/reactivation")
    public ResponseEntity<LicenseResponse> checkAndReactivate(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId) {
        licenses.checkAndReactivate(caller, licenseId);
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/manual-reactivation")
    public ResponseEntity<LicenseResponse> manualReactivate(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId) {
        licenses.manualReactivate(caller, licenseId);
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/transfer")
    public ResponseEntity<LicenseResponse> transfer(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @Valid @RequestBody TransferLicenseRequest request) {
        licenses.transfer(caller, licenseId, request.newLicensee());
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/usage")
    public ResponseEntity<LicenseResponse> reportUsage(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @Valid @RequestBody UsageReportRequest request) {
        licenses.reportUsage(caller, licenseId, request.revenue(), request.usageCount());
        return ResponseEntity.ok(describe(licenseId));
    }

    @PostMapping("/{licenseId}/royalties")
    public ResponseEntity<LicenseResponse> payRoyalties(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long licenseId,
            @Valid @RequestBody RoyaltyPaymentRequest request) {
        licenses.payRoyalties(caller, licenseId, request.amount());
        return ResponseEntity.ok(describe(licenseId));
    }

    private LicenseResponse describe(long licenseId) {
        License license = licenses.license(licenseId).orElseThrow();
        LicenseStatus status = licenses.getStatus(licenseId);
        return LicenseResponse.from(license, status);
    }

    // DTOs
    public record ApprovalRequest(@NotNull Boolean approve) {}

    public record RevokeRequest(String reason) {}

    public record SuspendRequest(@NotNull Long durationSeconds) {}

    public record TransferLicenseRequest(@NotBlank String newLicensee) {}

    public record UsageReportRequest(@NotNull BigInteger revenue, @NotNull Long usageCount) {}

    public record RoyaltyPaymentRequest(@NotNull BigInteger amount) {}

    public record StatusResponse(long licenseId, LicenseStatus status) {}
}

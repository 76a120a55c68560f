package com.collectiveip.api.audit;

import com.collectiveip.api.audit.AuditService.AuditReceipt;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read access to the ledger audit trail.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private static final int MAX_LIMIT = 500;

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * Get recent receipts, newest first.
     * GET /api/v1/audit/receipts?assetId=&limit=
     */
    @GetMapping("/receipts")
    public ResponseEntity<List<AuditReceipt>> getReceipts(
            @RequestParam(required = false) Long assetId,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("Limit must be within 1.." + MAX_LIMIT);
        }
        return ResponseEntity.ok(auditService.recent(assetId, limit));
    }

    @GetMapping("/receipts/{sequence}")
    public ResponseEntity<AuditReceipt> getReceipt(@PathVariable long sequence) {
        return auditService.receipt(sequence)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/chain/verification")
    public ResponseEntity<ChainVerification> verifyChain() {
        return ResponseEntity.ok(new ChainVerification(auditService.verifyChain()));
    }

    public record ChainVerification(boolean valid) {}
}

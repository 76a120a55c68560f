package com.collectiveip.api.admin;

import com.collectiveip.ledger.kernel.CollectiveLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Global pause switch. Only the configured administrator may flip it.
 */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private final CollectiveLedger ledger;

    public AdminController(CollectiveLedger ledger) {
        this.ledger = ledger;
    }

    @PostMapping("/pause")
    public ResponseEntity<PauseStatus> pause(@RequestHeader("X-Caller-Address") String caller) {
        ledger.pause(caller);
        return ResponseEntity.ok(new PauseStatus(ledger.isPaused()));
    }

    @PostMapping("/unpause")
    public ResponseEntity<PauseStatus> unpause(@RequestHeader("X-Caller-Address") String caller) {
        ledger.unpause(caller);
        return ResponseEntity.ok(new PauseStatus(ledger.isPaused()));
    }

    /**
     * Get the pause flag.
     * GET /api/v1/admin/status
     */
    @GetMapping("/status")
    public ResponseEntity<PauseStatus> getStatus() {
        return ResponseEntity.ok(new PauseStatus(ledger.isPaused()));
    }

    public record PauseStatus(boolean paused) {}
}

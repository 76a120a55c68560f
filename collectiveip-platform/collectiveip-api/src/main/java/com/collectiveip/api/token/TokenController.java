package com.collectiveip.api.token;

import com.collectiveip.api.token.TokenService.Position;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/tokens/{currency}")
public class TokenController {

    private final TokenService tokenService;

    public TokenController(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    /**
     * Mint payment tokens to an address.
     * POST /api/v1/tokens/{currency}/mints
     */
    @PostMapping("/mints")
    public ResponseEntity<Position> mint(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable String currency,
            @Valid @RequestBody MintRequest request) {
        return ResponseEntity.ok(tokenService.mint(caller, currency, request.recipient(), request.amount()));
    }

    /**
     * Let the pool pull up to {@code amount} from the caller.
     * POST /api/v1/tokens/{currency}/approvals
     */
    @PostMapping("/approvals")
    public ResponseEntity<Position> approve(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable String currency,
            @Valid @RequestBody ApproveRequest request) {
        return ResponseEntity.ok(tokenService.approvePool(caller, currency, request.amount()));
    }

    @GetMapping("/balances/{holder}")
    public ResponseEntity<Position> getPosition(@PathVariable String currency, @PathVariable String holder) {
        return ResponseEntity.ok(tokenService.position(currency, holder));
    }

    // DTOs
    public record MintRequest(@NotBlank String recipient, @NotNull BigInteger amount) {}

    public record ApproveRequest(@NotNull BigInteger amount) {}
}

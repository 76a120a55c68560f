package com.collectiveip.api.revenue;

import com.collectiveip.core.domain.RevenueAccount;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import com.collectiveip.ledger.revenue.DistributionSummary;
import com.collectiveip.ledger.revenue.RevenuePool;
import com.collectiveip.ledger.revenue.RevenuePool.Earnings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * Revenue pool of an asset: receipts, pro-rata distribution and owner withdrawals.
 */
@RestController
@RequestMapping("/api/v1/assets/{assetId}/revenue")
public class RevenueController {

    private final RevenuePool revenue;

    public RevenueController(CollectiveLedger ledger) {
        this.revenue = ledger.revenue();
    }

    /**
     * Pull revenue from the caller into the pool. The caller must have approved the pool.
     * POST /api/v1/assets/{assetId}/revenue/receipts
     */
    @PostMapping("/receipts")
    public ResponseEntity<AccountResponse> receiveRevenue(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody ReceiveRevenueRequest request) {
        revenue.receiveRevenue(caller, assetId, request.currency(), request.amount());
        return ResponseEntity.ok(AccountResponse.from(revenue.account(assetId, request.currency()).orElseThrow()));
    }

    /**
     * Split accumulated revenue among owners; without an amount the whole balance is split.
     * POST /api/v1/assets/{assetId}/revenue/distributions
     */
    @PostMapping("/distributions")
    public ResponseEntity<DistributionSummary> distributeRevenue(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody DistributeRevenueRequest request) {
        DistributionSummary summary = request.amount() == null
                ? revenue.distributeAllRevenue(caller, assetId, request.currency())
                : revenue.distributeRevenue(caller, assetId, request.currency(), request.amount());
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<WithdrawalResponse> withdraw(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody WithdrawRequest request) {
        BigInteger amount = revenue.withdrawPendingRevenue(caller, assetId, request.currency());
        return ResponseEntity.ok(new WithdrawalResponse(request.currency(), amount));
    }

    @PutMapping("/minimum-distribution")
    public ResponseEntity<AccountResponse> setMinimumDistribution(
            @RequestHeader("X-Caller-Address") String caller,
            @PathVariable long assetId,
            @Valid @RequestBody MinimumDistributionRequest request) {
        revenue.setMinimumDistribution(caller, assetId, request.currency(), request.amount());
        return ResponseEntity.ok(AccountResponse.from(revenue.account(assetId, request.currency()).orElseThrow()));
    }

    @GetMapping
    public ResponseEntity<AccountResponse> getAccount(@PathVariable long assetId, @RequestParam String currency) {
        return revenue.account(assetId, currency)
                .map(account -> ResponseEntity.ok(AccountResponse.from(account)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/earnings/{owner}")
    public ResponseEntity<Earnings> getEarnings(@PathVariable long assetId, @PathVariable String owner,
                                                @RequestParam String currency) {
        return ResponseEntity.ok(revenue.earnings(assetId, owner, currency));
    }

    // DTOs
    public record ReceiveRevenueRequest(@NotBlank String currency, @NotNull BigInteger amount) {}

    public record DistributeRevenueRequest(@NotBlank String currency, BigInteger amount) {}

    public record WithdrawRequest(@NotBlank String currency) {}

    public record MinimumDistributionRequest(@NotBlank String currency, @NotNull BigInteger amount) {}

    public record WithdrawalResponse(String currency, BigInteger amount) {}

    public record AccountResponse(
        long assetId,
        String currency,
        BigInteger totalReceived,
        BigInteger totalDistributed,
        BigInteger accumulated,
        BigInteger minimumDistribution,
        long distributionCount,
        long lastDistributionAt,
        long routedPaymentCount
    ) {
        static AccountResponse from(RevenueAccount account) {
            return new AccountResponse(account.getAssetId(), account.getCurrency(), account.getTotalReceived(),
                    account.getTotalDistributed(), account.getAccumulated(), account.getMinimumDistribution(),
                    account.getDistributionCount(), account.getLastDistributionAt(), account.getRoutedPaymentCount());
        }
    }
}

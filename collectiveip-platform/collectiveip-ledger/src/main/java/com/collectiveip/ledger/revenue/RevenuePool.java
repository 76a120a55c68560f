package com.collectiveip.ledger.revenue;

import com.collectiveip.core.domain.OwnerEntry;
import com.collectiveip.core.domain.PendingBalance;
import com.collectiveip.core.domain.RevenueAccount;
import com.collectiveip.core.exception.AuthorizationException;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.InsufficientFundsException;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.core.support.Addresses;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.kernel.Guards;
import com.collectiveip.ledger.kernel.LedgerContext;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.state.RevenueTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Pooled multi-currency revenue of each asset and the pending balances of its owners.
 * <p>
 * Splits are pro-rata on economic percentage with floor division. The rounding residue of a split
 * stays in the pool's accumulated balance and is distributable later.
 */
public class RevenuePool {

    private static final Logger log = LoggerFactory.getLogger(RevenuePool.class);
    private static final BigInteger HUNDRED = BigInteger.valueOf(100);

    private final LedgerContext context;
    private final OwnershipLedger ownership;

    public RevenuePool(LedgerContext context, OwnershipLedger ownership) {
        this.context = Objects.requireNonNull(context, "Context cannot be null");
        this.ownership = Objects.requireNonNull(ownership, "Ownership ledger cannot be null");
    }

    /**
     * Lifetime figures of one owner in one currency.
     */
    public record Earnings(BigInteger pending, BigInteger totalEarned, BigInteger totalWithdrawn) {}

    // ==================== Inflows ====================

    /**
     * Pulls {@code amount} from the caller into the pool.
     */
    public void receiveRevenue(String caller, long assetId, String currency, BigInteger amount) {
        context.guard().mutate("receiveRevenue", () -> {
            String payer = Guards.caller(caller);
            String token = Addresses.normalize(currency, "currency");
            Guards.requirePositive(amount, "Revenue amount");
            ownership.requireAsset(assetId);
            if (ownership.entries(assetId).isEmpty()) {
                throw new StateException(ErrorReason.ASSET_NOT_FOUND, "Asset " + assetId + " has no owners");
            }

            context.paymentTokens().resolve(token)
                    .transferFrom(context.config().poolAddress(), payer, context.config().poolAddress(), amount);
            table().accountOrOpen(assetId, token).recordReceipt(amount);

            context.emit(LedgerEventType.REVENUE_RECEIVED, assetId, 0, payer, Map.of("currency", token, "amount", amount));
            log.debug("Asset {} received {} of {} from {}", assetId, amount, token, payer);
            return null;
        });
    }

    // ==================== Distribution ====================

    public DistributionSummary distributeRevenue(String caller, long assetId, String currency, BigInteger amount) {
        return context.guard().mutate("distributeRevenue", () -> {
            String actor = Guards.caller(caller);
            String token = Addresses.normalize(currency, "currency");
            ownership.requireOwner(assetId, actor);
            Guards.requirePositive(amount, "Distribution amount");
            return distribute(actor, assetId, token, amount);
        });
    }

    /**
     * Distributes everything accumulated; returns an empty summary when nothing is.
     */
    public DistributionSummary distributeAllRevenue(String caller, long assetId, String currency) {
        return context.guard().mutate("distributeAllRevenue", () -> {
            String actor = Guards.caller(caller);
            String token = Addresses.normalize(currency, "currency");
            ownership.requireOwner(assetId, actor);
            BigInteger accumulated = table().account(assetId, token)
                    .map(RevenueAccount::getAccumulated)
                    .orElse(BigInteger.ZERO);
            if (accumulated.signum() == 0) {
                return DistributionSummary.empty(assetId, token);
            }
            return distribute(actor, assetId, token, accumulated);
        });
    }

    private DistributionSummary distribute(String actor, long assetId, String currency, BigInteger amount) {
        RevenueAccount account = table().account(assetId, currency).orElse(null);
        BigInteger accumulated = account == null ? BigInteger.ZERO : account.getAccumulated();
        if (amount.compareTo(accumulated) > 0) {
            throw new InsufficientFundsException(ErrorReason.INSUFFICIENT_ACCUMULATED_REVENUE,
                    "Requested " + amount + " but only " + accumulated + " accumulated for asset " + assetId);
        }
        if (amount.compareTo(account.getMinimumDistribution()) < 0) {
            throw new ValidationException(ErrorReason.BELOW_MINIMUM_DISTRIBUTION,
                    "Distribution " + amount + " is below the minimum " + account.getMinimumDistribution());
        }

        DistributionSummary summary = split(assetId, currency, amount);
        account.recordDistribution(summary.distributed(), context.now());

        context.emit(LedgerEventType.REVENUE_DISTRIBUTED, assetId, 0, actor,
                Map.of("currency", currency, "distributed", summary.distributed(), "residue", summary.residue()));
        log.debug("Asset {} distributed {} of {} ({} residue)", assetId, summary.distributed(), currency, summary.residue());
        return summary;
    }

    /**
     * Splits an incoming fee or royalty among owners without the minimum-distribution floor. The
     * caller must already hold the guard.
     */
    public DistributionSummary routeFee(long assetId, String currency, BigInteger amount) {
        DistributionSummary summary = split(assetId, currency, amount);
        table().accountOrOpen(assetId, currency).recordRoutedPayment(amount, summary.distributed());

        context.emit(LedgerEventType.FEE_ROUTED, assetId, 0, null,
                Map.of("currency", currency, "amount", amount, "distributed", summary.distributed()));
        return summary;
    }

    private DistributionSummary split(long assetId, String currency, BigInteger amount) {
        Collection<OwnerEntry> entries = ownership.entries(assetId);
        List<DistributionSummary.OwnerCredit> credits = new ArrayList<>();
        BigInteger distributed = BigInteger.ZERO;
        for (OwnerEntry entry : entries) {
            BigInteger share = amount.multiply(BigInteger.valueOf(entry.getPercentage())).divide(HUNDRED);
            if (share.signum() == 0) {
                continue;
            }
            table().balanceOrOpen(assetId, entry.getOwner(), currency).credit(share);
            credits.add(new DistributionSummary.OwnerCredit(entry.getOwner(), entry.getPercentage(), share));
            distributed = distributed.add(share);
        }
        return new DistributionSummary(assetId, currency, amount, distributed, amount.subtract(distributed), List.copyOf(credits));
    }

    // ==================== Withdrawal ====================

    /**
     * Pays out the caller's whole pending balance.
     *
     * @return the amount paid
     */
    public BigInteger withdrawPendingRevenue(String caller, long assetId, String currency) {
        return context.guard().mutate("withdrawPendingRevenue", () -> {
            String member = Guards.caller(caller);
            String token = Addresses.normalize(currency, "currency");
            ownership.requireAsset(assetId);
            if (ownership.memberEntry(assetId, member).isEmpty()) {
                throw new AuthorizationException(ErrorReason.NOT_ASSET_OWNER,
                        member + " is not a member of asset " + assetId);
            }
            PendingBalance balance = table().balance(assetId, member, token)
                    .filter(b -> b.getPending().signum() > 0)
                    .orElseThrow(() -> new InsufficientFundsException(ErrorReason.NOTHING_TO_WITHDRAW,
                            "No pending revenue for " + member + " on asset " + assetId));

            BigInteger amount = balance.withdrawAll(context.now());
            context.paymentTokens().resolve(token).transfer(context.config().poolAddress(), member, amount);

            context.emit(LedgerEventType.REVENUE_WITHDRAWN, assetId, 0, member, Map.of("currency", token, "amount", amount));
            log.debug("Asset {}: {} withdrew {} of {}", assetId, member, amount, token);
            return amount;
        });
    }

    // ==================== Policy ====================

    public void setMinimumDistribution(String caller, long assetId, String currency, BigInteger amount) {
        context.guard().mutate("setMinimumDistribution", () -> {
            String actor = Guards.caller(caller);
            String token = Addresses.normalize(currency, "currency");
            ownership.requireOwner(assetId, actor);
            applyMinimumDistribution(assetId, token, amount, actor);
            return null;
        });
    }

    /**
     * Sets the distribution floor on behalf of governance. The caller must already hold the guard.
     */
    public void applyMinimumDistribution(long assetId, String currency, BigInteger amount, String actor) {
        Guards.requireNonNegative(amount, "Minimum distribution");
        table().accountOrOpen(assetId, currency).setMinimumDistribution(amount);
        context.emit(LedgerEventType.MINIMUM_DISTRIBUTION_SET, assetId, 0, actor,
                Map.of("currency", currency, "amount", amount));
    }

    // ==================== Queries ====================

    public Optional<RevenueAccount> account(long assetId, String currency) {
        return context.guard().read(() -> table().account(assetId, Addresses.normalize(currency, "currency"))
                .map(RevenueAccount::copy));
    }

    public BigInteger pendingRevenue(long assetId, String owner, String currency) {
        return earnings(assetId, owner, currency).pending();
    }

    public Earnings earnings(long assetId, String owner, String currency) {
        return context.guard().read(() -> table()
                .balance(assetId, Addresses.normalize(owner, "owner"), Addresses.normalize(currency, "currency"))
                .map(b -> new Earnings(b.getPending(), b.getTotalEarned(), b.getTotalWithdrawn()))
                .orElse(new Earnings(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO)));
    }

    private RevenueTable table() {
        return context.state().revenue();
    }
}

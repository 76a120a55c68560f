package com.collectiveip.ledger.kernel;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.ledger.event.LedgerEventBus;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.governance.GovernanceEngine;
import com.collectiveip.ledger.license.LicenseProposalBoard;
import com.collectiveip.ledger.license.LicenseRegistry;
import com.collectiveip.ledger.ownership.OwnershipLedger;
import com.collectiveip.ledger.revenue.RevenuePool;
import com.collectiveip.ledger.state.LedgerState;
import com.collectiveip.ledger.token.AssetTokenLedger;
import com.collectiveip.ledger.token.PaymentTokens;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One collective ledger instance: the shared state, the call guard, the event bus and the four
 * subsystems wired on top of them.
 */
public class CollectiveLedger {

    private static final Logger log = LoggerFactory.getLogger(CollectiveLedger.class);

    private final LedgerContext context;
    private final LedgerEventBus eventBus;
    private final OwnershipLedger ownership;
    private final RevenuePool revenue;
    private final LicenseRegistry licenses;
    private final LicenseProposalBoard licenseProposals;
    private final GovernanceEngine governance;

    public CollectiveLedger(LedgerConfiguration config, Clock clock, AssetTokenLedger assetTokens,
                            PaymentTokens paymentTokens) {
        this(config, clock, assetTokens, paymentTokens, new LedgerEventBus());
    }

    public CollectiveLedger(LedgerConfiguration config, Clock clock, AssetTokenLedger assetTokens,
                            PaymentTokens paymentTokens, LedgerEventBus eventBus) {
        LedgerState state = new LedgerState();
        this.eventBus = eventBus;
        this.context = new LedgerContext(state, new CallGuard(state, eventBus), config, clock, assetTokens, paymentTokens);
        this.ownership = new OwnershipLedger(context);
        this.revenue = new RevenuePool(context, ownership);
        this.licenses = new LicenseRegistry(context, ownership, revenue);
        this.licenseProposals = new LicenseProposalBoard(context, ownership, licenses);
        this.governance = new GovernanceEngine(context, ownership, revenue, licenses);
        log.info("Collective ledger started with pool {} and administrator {}", config.poolAddress(), config.administrator());
    }

    // ==================== Pause control ====================

    public void pause(String caller) {
        context.guard().mutate("pause", () -> {
            String actor = Guards.caller(caller);
            Guards.requireAdministrator(context.config(), actor);
            context.state().setPaused(true);
            context.emit(LedgerEventType.SYSTEM_PAUSED, 0, 0, actor);
            log.warn("Ledger paused by administrator {}", actor);
            return null;
        });
    }

    /**
     * Lifts the pause. The only mutation accepted while the ledger is paused.
     */
    public void unpause(String caller) {
        context.guard().mutateWhilePaused("unpause", () -> {
            String actor = Guards.caller(caller);
            Guards.requireAdministrator(context.config(), actor);
            if (!context.state().isPaused()) {
                throw new StateException(ErrorReason.SYSTEM_NOT_PAUSED, "Ledger is not paused");
            }
            context.state().setPaused(false);
            context.emit(LedgerEventType.SYSTEM_UNPAUSED, 0, 0, actor);
            log.info("Ledger unpaused by administrator {}", actor);
            return null;
        });
    }

    public boolean isPaused() {
        return context.guard().read(() -> context.state().isPaused());
    }

    // Getters
    public OwnershipLedger ownership() { return ownership; }
    public RevenuePool revenue() { return revenue; }
    public LicenseRegistry licenses() { return licenses; }
    public LicenseProposalBoard licenseProposals() { return licenseProposals; }
    public GovernanceEngine governance() { return governance; }
    public LedgerEventBus events() { return eventBus; }
    public LedgerConfiguration configuration() { return context.config(); }
}

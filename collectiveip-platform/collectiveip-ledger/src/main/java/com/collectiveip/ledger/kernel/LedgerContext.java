package com.collectiveip.ledger.kernel;

import com.collectiveip.ledger.event.LedgerEvent;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.state.LedgerState;
import com.collectiveip.ledger.token.AssetTokenLedger;
import com.collectiveip.ledger.token.PaymentTokens;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;

/**
 * Collaborators shared by the ledger subsystems.
 */
public class LedgerContext {

    private final LedgerState state;
    private final CallGuard guard;
    private final LedgerConfiguration config;
    private final Clock clock;
    private final AssetTokenLedger assetTokens;
    private final PaymentTokens paymentTokens;

    public LedgerContext(LedgerState state, CallGuard guard, LedgerConfiguration config, Clock clock,
                         AssetTokenLedger assetTokens, PaymentTokens paymentTokens) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.guard = Objects.requireNonNull(guard, "Guard cannot be null");
        this.config = Objects.requireNonNull(config, "Configuration cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.assetTokens = Objects.requireNonNull(assetTokens, "Asset token ledger cannot be null");
        this.paymentTokens = Objects.requireNonNull(paymentTokens, "Payment tokens cannot be null");
    }

    /**
     * Current time in epoch seconds.
     */
    public long now() {
        return clock.instant().getEpochSecond();
    }

    public void emit(LedgerEventType type, long assetId, long subjectId, String actor) {
        guard.emit(new LedgerEvent(type, assetId, subjectId, actor, now()));
    }

    public void emit(LedgerEventType type, long assetId, long subjectId, String actor, Map<String, Object> attributes) {
        guard.emit(new LedgerEvent(type, assetId, subjectId, actor, now(), attributes));
    }

    public LedgerState state() { return state; }
    public CallGuard guard() { return guard; }
    public LedgerConfiguration config() { return config; }
    public AssetTokenLedger assetTokens() { return assetTokens; }
    public PaymentTokens paymentTokens() { return paymentTokens; }
}

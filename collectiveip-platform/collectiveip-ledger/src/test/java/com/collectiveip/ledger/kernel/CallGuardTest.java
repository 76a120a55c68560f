package com.collectiveip.ledger.kernel;

import com.collectiveip.core.domain.Asset;
import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ValidationException;
import com.collectiveip.ledger.event.LedgerEvent;
import com.collectiveip.ledger.event.LedgerEventBus;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.state.LedgerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.collectiveip.ledger.LedgerFixture.assertFails;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallGuardTest {

    private LedgerState state;
    private LedgerEventBus eventBus;
    private CallGuard guard;
    private List<LedgerEvent> published;

    @BeforeEach
    void setUp() {
        state = new LedgerState();
        eventBus = new LedgerEventBus();
        guard = new CallGuard(state, eventBus);
        published = new ArrayList<>();
        eventBus.subscribe(LedgerEventType.ALL, published::add);
    }

    private void putAsset() {
        long id = state.ownership().nextAssetId();
        state.ownership().putAsset(Asset.register(id, "PATENT", "ipfs://a", BigInteger.TEN, 0));
    }

    @Test
    void failedBody_restoresStateAndDropsEvents() {
        assertThatThrownBy(() -> guard.mutate("failing", () -> {
            putAsset();
            state.setPaused(true);
            guard.emit(new LedgerEvent(LedgerEventType.ASSET_REGISTERED, 1, 0, null, 0));
            throw new ValidationException(ErrorReason.MISSING_FIELD, "boom");
        })).isInstanceOf(ValidationException.class);

        assertThat(state.ownership().assets()).isEmpty();
        assertThat(state.isPaused()).isFalse();
        assertThat(state.ownership().nextAssetId()).isEqualTo(1L);
        assertThat(published).isEmpty();
        assertThat(guard.isInFlight()).isFalse();
    }

    @Test
    void committedBody_publishesStagedEventsAfterReturning() {
        List<Boolean> inFlightAtDelivery = new ArrayList<>();
        eventBus.subscribe(LedgerEventType.ASSET_REGISTERED, event -> inFlightAtDelivery.add(guard.isInFlight()));

        String result = guard.mutate("register", () -> {
            putAsset();
            guard.emit(new LedgerEvent(LedgerEventType.ASSET_REGISTERED, 1, 0, null, 0));
            assertThat(published).isEmpty();
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(published).extracting(LedgerEvent::eventType).containsExactly(LedgerEventType.ASSET_REGISTERED);
        assertThat(inFlightAtDelivery).containsExactly(false);
        assertThat(state.ownership().assets()).hasSize(1);
    }

    @Test
    void nestedCall_isRejected() {
        assertFails(ErrorReason.REENTRANT_CALL, () -> guard.mutate("outer", () -> {
            putAsset();
            return guard.mutate("inner", () -> null);
        }));
        assertThat(state.ownership().assets()).isEmpty();
    }

    @Test
    void pausedState_blocksOnlyPausableCalls() {
        state.setPaused(true);

        assertFails(ErrorReason.SYSTEM_PAUSED, () -> guard.mutate("blocked", () -> null));
        assertThat(guard.mutateWhilePaused("allowed", () -> 42)).isEqualTo(42);
        assertThat(guard.read(() -> "read")).isEqualTo("read");
    }

    @Test
    void emitOutsideCall_publishesImmediately() {
        guard.emit(new LedgerEvent(LedgerEventType.SYSTEM_PAUSED, 0, 0, null, 0));

        assertThat(published).hasSize(1);
    }
}

package com.collectiveip.ledger.kernel;

import com.collectiveip.core.exception.ErrorReason;
import com.collectiveip.core.exception.ReentrancyException;
import com.collectiveip.core.exception.StateException;
import com.collectiveip.ledger.event.LedgerEvent;
import com.collectiveip.ledger.event.LedgerEventBus;
import com.collectiveip.ledger.state.LedgerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs every public ledger operation as one all-or-nothing unit.
 * <p>
 * Calls are serialized on this guard's monitor. While a mutating call is in flight any nested
 * call, including one re-entering from a token-ledger callback on the same thread, is rejected.
 * State is snapshotted before the body runs and restored if it throws; events emitted by the body
 * are published only after it returns normally.
 */
public class CallGuard {

    private static final Logger log = LoggerFactory.getLogger(CallGuard.class);

    private final LedgerState state;
    private final LedgerEventBus eventBus;

    private String inFlight;
    private List<LedgerEvent> staged;

    public CallGuard(LedgerState state, LedgerEventBus eventBus) {
        this.state = Objects.requireNonNull(state, "State cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
    }

    /**
     * Runs a mutating operation that is blocked while the ledger is paused.
     */
    public <T> T mutate(String operation, Supplier<T> body) {
        return run(operation, true, body);
    }

    /**
     * Runs a mutating operation that remains available while the ledger is paused.
     */
    public <T> T mutateWhilePaused(String operation, Supplier<T> body) {
        return run(operation, false, body);
    }

    public synchronized <T> T read(Supplier<T> query) {
        return query.get();
    }

    /**
     * Queues an event for publication once the current call commits. Outside a guarded call the
     * event is published immediately.
     */
    public synchronized void emit(LedgerEvent event) {
        if (staged != null) {
            staged.add(event);
        } else {
            eventBus.publish(event);
        }
    }

    public synchronized boolean isInFlight() {
        return inFlight != null;
    }

    private synchronized <T> T run(String operation, boolean pausable, Supplier<T> body) {
        if (inFlight != null) {
            throw new ReentrancyException(ErrorReason.REENTRANT_CALL,
                    "Call to " + operation + " while " + inFlight + " is in flight");
        }
        if (pausable && state.isPaused()) {
            throw new StateException(ErrorReason.SYSTEM_PAUSED, "Ledger is paused, " + operation + " rejected");
        }

        inFlight = operation;
        LedgerState.Snapshot snapshot = state.snapshot();
        List<LedgerEvent> events = new ArrayList<>();
        staged = events;

        T result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            state.restore(snapshot);
            log.debug("Rolled back {}: {}", operation, e.getMessage());
            throw e;
        } finally {
            inFlight = null;
            staged = null;
        }

        for (LedgerEvent event : events) {
            eventBus.publish(event);
        }
        return result;
    }
}

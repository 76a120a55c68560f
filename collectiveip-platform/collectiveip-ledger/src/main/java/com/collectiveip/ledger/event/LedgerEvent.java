package com.collectiveip.ledger.event;

import java.util.Map;

/**
 * Record of a committed state transition.
 *
 * @param assetId asset the event concerns, 0 for system events
 * @param subjectId license or proposal id where relevant, otherwise 0
 * @param actor normalized address of the caller, null for internal transitions
 * @param timestamp epoch seconds of the call that produced the event
 */
public record LedgerEvent(
        LedgerEventType eventType,
        long assetId,
        long subjectId,
        String actor,
        long timestamp,
        Map<String, Object> attributes
) {
    public LedgerEvent(LedgerEventType eventType, long assetId, long subjectId, String actor, long timestamp) {
        this(eventType, assetId, subjectId, actor, timestamp, Map.of());
    }

    public LedgerEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}

package com.collectiveip.ledger.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Publishes committed ledger events to subscribers.
 * <p>
 * Delivery is synchronous on the publishing thread, in subscription order. A failing handler is
 * logged and skipped; it never affects the call that produced the event.
 */
public class LedgerEventBus {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventBus.class);

    private final Map<LedgerEventType, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final Map<String, Subscription> subscriptionById;

    public LedgerEventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.subscriptionById = new ConcurrentHashMap<>();
    }

    /**
     * Delivers an event to subscribers of its type, then to wildcard subscribers.
     */
    public void publish(LedgerEvent event) {
        if (event == null) {
            return;
        }
        deliver(subscriptions.get(event.eventType()), event);
        deliver(subscriptions.get(LedgerEventType.ALL), event);
    }

    /**
     * Subscribes to events of a specific type, or to every event with {@link LedgerEventType#ALL}.
     *
     * @return subscription id
     */
    public String subscribe(LedgerEventType eventType, Consumer<LedgerEvent> handler) {
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, eventType, handler);

        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscriptionId, subscription);

        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.eventType());
            if (subs != null) {
                subs.remove(subscription);
            }
        }
    }

    public int getSubscriberCount(LedgerEventType eventType) {
        CopyOnWriteArrayList<Subscription> subs = subscriptions.get(eventType);
        return subs != null ? subs.size() : 0;
    }

    private void deliver(CopyOnWriteArrayList<Subscription> subs, LedgerEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                sub.handler().accept(event);
            } catch (RuntimeException e) {
                log.warn("Event handler {} failed for {}: {}", sub.id(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    private record Subscription(
            String id,
            LedgerEventType eventType,
            Consumer<LedgerEvent> handler
    ) {}
}

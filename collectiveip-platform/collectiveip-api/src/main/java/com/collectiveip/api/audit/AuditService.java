package com.collectiveip.api.audit;

import com.collectiveip.core.support.TextHashes;
import com.collectiveip.ledger.event.LedgerEvent;
import com.collectiveip.ledger.event.LedgerEventType;
import com.collectiveip.ledger.kernel.CollectiveLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Audit trail of committed ledger events.
 * <p>
 * Every event becomes a receipt chained to its predecessor by keccak hash. Only the most recent
 * {@code collectiveip.audit.retained-receipts} receipts are kept; the chain head survives eviction.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    static final String GENESIS = "GENESIS";

    private final int retainedReceipts;
    private final Deque<AuditReceipt> receipts = new ArrayDeque<>();
    private long nextSequence = 1;
    private String headHash = GENESIS;

    public AuditService(CollectiveLedger ledger,
                        @Value("${collectiveip.audit.retained-receipts:1000}") int retainedReceipts) {
        if (retainedReceipts <= 0) {
            throw new IllegalArgumentException("Retained receipts must be positive");
        }
        this.retainedReceipts = retainedReceipts;
        ledger.events().subscribe(LedgerEventType.ALL, this::append);
    }

    public record AuditReceipt(
        long sequence,
        LedgerEventType eventType,
        long assetId,
        long subjectId,
        String actor,
        long timestamp,
        Map<String, Object> attributes,
        String previousHash,
        String receiptHash
    ) {}

    /**
     * Appends a receipt for {@code event}, evicting the oldest one when full.
     */
    synchronized AuditReceipt append(LedgerEvent event) {
        long sequence = nextSequence++;
        String receiptData = String.join("|",
                Long.toString(sequence),
                event.eventType().name(),
                Long.toString(event.assetId()),
                Long.toString(event.subjectId()),
                String.valueOf(event.actor()),
                Long.toString(event.timestamp()),
                new TreeMap<>(event.attributes()).toString(),
                headHash);
        AuditReceipt receipt = new AuditReceipt(sequence, event.eventType(), event.assetId(), event.subjectId(),
                event.actor(), event.timestamp(), event.attributes(), headHash, TextHashes.keccak(receiptData));

        receipts.addLast(receipt);
        if (receipts.size() > retainedReceipts) {
            receipts.removeFirst();
        }
        headHash = receipt.receiptHash();
        log.info("Audit #{} {} asset={} subject={} actor={}", sequence, event.eventType(), event.assetId(),
                event.subjectId(), event.actor());
        return receipt;
    }

    /**
     * Newest first, optionally restricted to one asset.
     */
    public synchronized List<AuditReceipt> recent(Long assetId, int limit) {
        List<AuditReceipt> result = new ArrayList<>();
        var iterator = receipts.descendingIterator();
        while (iterator.hasNext() && result.size() < limit) {
            AuditReceipt receipt = iterator.next();
            if (assetId == null || receipt.assetId() == assetId) {
                result.add(receipt);
            }
        }
        return result;
    }

    public synchronized Optional<AuditReceipt> receipt(long sequence) {
        return receipts.stream().filter(receipt -> receipt.sequence() == sequence).findFirst();
    }

    /**
     * Checks that every retained receipt links to the one before it.
     */
    public synchronized boolean verifyChain() {
        String expectedPrevious = null;
        for (AuditReceipt receipt : receipts) {
            if (expectedPrevious != null && !expectedPrevious.equals(receipt.previousHash())) {
                return false;
            }
            expectedPrevious = receipt.receiptHash();
        }
        return expectedPrevious == null || expectedPrevious.equals(headHash);
    }
}

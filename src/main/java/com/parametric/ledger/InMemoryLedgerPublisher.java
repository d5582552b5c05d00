package com.parametric.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Process-local ledger: one append-only log per channel and a fixed confirmation
 * count for every transaction it has accepted. Lets the service run and be tested
 * without a network.
 */
public class InMemoryLedgerPublisher implements LedgerPublisher, FinalityMonitor {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerPublisher.class);

    private final Clock clock;
    private final long confirmationsPerTransaction;
    private final AtomicLong sequence = new AtomicLong(0);
    private final Map<LedgerChannel, CopyOnWriteArrayList<Entry>> channels = new EnumMap<>(LedgerChannel.class);

    public InMemoryLedgerPublisher(Clock clock, long confirmationsPerTransaction) {
        this.clock = clock;
        this.confirmationsPerTransaction = confirmationsPerTransaction;
        for (LedgerChannel channel : LedgerChannel.values()) {
            channels.put(channel, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public LedgerReceipt publish(LedgerChannel channel, LedgerMessage message) {
        Instant now = clock.instant();
        LedgerReceipt receipt = new LedgerReceipt(
            channel.getValue() + "@" + now.getEpochSecond() + "." + UUID.randomUUID().toString().substring(0, 8),
            now,
            channel,
            sequence.incrementAndGet());
        channels.get(channel).add(new Entry(receipt, message));
        log.debug("Ledger append channel={} type={} seq={}", channel.getValue(), message.type(), receipt.sequenceNumber());
        return receipt;
    }

    @Override
    public long confirmations(String ledgerTransactionId) {
        boolean known = channels.values().stream()
            .flatMap(List::stream)
            .anyMatch(e -> e.receipt().transactionId().equals(ledgerTransactionId));
        return known ? confirmationsPerTransaction : 0;
    }

    public List<Entry> entries(LedgerChannel channel) {
        return Collections.unmodifiableList(new ArrayList<>(channels.get(channel)));
    }

    public List<LedgerMessage> messages(LedgerChannel channel, String type) {
        return channels.get(channel).stream()
            .map(Entry::message)
            .filter(m -> m.type().equals(type))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    public long latestSequence() {
        return sequence.get();
    }

    public record Entry(LedgerReceipt receipt, LedgerMessage message) {}
}

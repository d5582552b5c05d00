package com.parametric.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-process journal and dispatcher for {@link SettlementEvent}s.
 *
 * <p>Every published event gets the next sequence number and is delivered to
 * subscribers in sequence order by a single drainer at a time. Events published
 * from inside a handler are queued behind the current one, never delivered
 * re-entrantly.
 */
@Component
public class SettlementBus {

    private static final Logger log = LoggerFactory.getLogger(SettlementBus.class);

    private final Clock clock;
    private final Object appendLock = new Object();
    private final CopyOnWriteArrayList<JournalEntry> journal = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedQueue<JournalEntry> pending = new ConcurrentLinkedQueue<>();
    private final CopyOnWriteArrayList<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private long sequence;

    public SettlementBus(Clock clock) {
        this.clock = clock;
    }

    public JournalEntry publish(SettlementEvent event) {
        JournalEntry entry;
        synchronized (appendLock) {
            entry = new JournalEntry(++sequence, clock.instant(), event);
            journal.add(entry);
            pending.add(entry);
        }
        drain();
        return entry;
    }

    public <E extends SettlementEvent> String subscribe(Class<E> type, Consumer<? super E> handler) {
        String id = UUID.randomUUID().toString();
        subscriptions.add(new Subscription<>(id, type, handler));
        return id;
    }

    public void unsubscribe(String id) {
        subscriptions.removeIf(s -> s.id().equals(id));
    }

    public <E extends SettlementEvent> List<E> query(Class<E> type) {
        return journal.stream()
            .map(JournalEntry::event)
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    public List<JournalEntry> journal() {
        return List.copyOf(journal);
    }

    public long latestSequence() {
        synchronized (appendLock) {
            return sequence;
        }
    }

    private void drain() {
        do {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                JournalEntry next;
                while ((next = pending.poll()) != null) {
                    dispatch(next);
                }
            } finally {
                draining.set(false);
            }
        } while (!pending.isEmpty());
    }

    private void dispatch(JournalEntry entry) {
        for (Subscription<?> subscription : subscriptions) {
            try {
                subscription.deliver(entry.event());
            } catch (Exception ex) {
                log.error("Handler failed for event seq={} type={}",
                    entry.sequence(), entry.event().getClass().getSimpleName(), ex);
            }
        }
    }

    public record JournalEntry(long sequence, Instant publishedAt, SettlementEvent event) {}

    private record Subscription<E extends SettlementEvent>(String id, Class<E> type, Consumer<? super E> handler) {

        void deliver(SettlementEvent event) {
            if (type.isInstance(event)) {
                handler.accept(type.cast(event));
            }
        }
    }
}

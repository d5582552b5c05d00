package com.parametric.ledger;

import com.parametric.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryLedgerPublisherTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-07-01T00:00:00Z"));
    private final InMemoryLedgerPublisher ledger = new InMemoryLedgerPublisher(clock, 5000);

    @Test
    void publish_appendsPerChannelWithGlobalSequence() {
        LedgerReceipt first = ledger.publish(LedgerChannel.PAYOUTS, LedgerMessage.of(LedgerMessage.PAYOUT_EXECUTED)
            .with("payoutId", "PAY-1").build());
        LedgerReceipt second = ledger.publish(LedgerChannel.POOL_EVENTS, LedgerMessage.of(LedgerMessage.PAYOUT_DEBITED)
            .with("poolId", "POOL-1").build());

        assertEquals(1, first.sequenceNumber());
        assertEquals(2, second.sequenceNumber());
        assertEquals(LedgerChannel.PAYOUTS, first.channel());
        assertEquals(clock.instant(), first.consensusTimestamp());
        assertNotEquals(first.transactionId(), second.transactionId());
        assertEquals(1, ledger.entries(LedgerChannel.PAYOUTS).size());
        assertEquals(1, ledger.entries(LedgerChannel.POOL_EVENTS).size());
        assertTrue(ledger.entries(LedgerChannel.CESSION).isEmpty());
        assertEquals(2, ledger.latestSequence());
    }

    @Test
    void confirmations_onlyForAcceptedTransactions() {
        LedgerReceipt receipt = ledger.publish(LedgerChannel.TRIGGERS,
            LedgerMessage.of(LedgerMessage.TRIGGER_OBSERVED).build());

        assertEquals(5000, ledger.confirmations(receipt.transactionId()));
        assertEquals(0, ledger.confirmations("triggers@0.unknown"));
    }

    @Test
    void message_dropsNullFieldsAndKeepsOrder() {
        LedgerMessage message = LedgerMessage.of(LedgerMessage.STOP_LOSS_BREACHED)
            .with("policyId", "POL-1")
            .with("ruleRef", null)
            .with("lossCum", "100000")
            .build();

        assertFalse(message.body().containsKey("ruleRef"));
        Map<String, Object> wire = message.toWire();
        assertEquals(List.of("type", "policyId", "lossCum"), List.copyOf(wire.keySet()));
        assertEquals("StopLossBreached", wire.get("type"));
        assertThrows(UnsupportedOperationException.class, () -> message.body().put("x", "y"));
    }

    @Test
    void receiptRef_rendersChannelAndTransaction() {
        LedgerReceipt receipt = ledger.publish(LedgerChannel.RULES, LedgerMessage.of(LedgerMessage.RULE_CREATED).build());
        LedgerRef ref = receipt.toRef();

        assertEquals("rules/" + receipt.transactionId(), ref.toWire());
        assertNull(LedgerRef.toWire(null));
        assertEquals(List.of(LedgerMessage.RULE_CREATED),
            ledger.messages(LedgerChannel.RULES, LedgerMessage.RULE_CREATED).stream().map(LedgerMessage::type).toList());
    }
}

package com.txscope.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransactionEventsTest {

    @Test
    void listenersRunInSubscriptionOrder() {
        TransactionEvents events = new TransactionEvents();
        List<String> calls = new ArrayList<>();
        events.subscribe(TransactionEvent.START_TRANSACTION, () -> calls.add("first"));
        events.subscribe(TransactionEvent.START_TRANSACTION, () -> calls.add("second"));

        events.notify(TransactionEvent.START_TRANSACTION);

        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    void failingListenerDoesNotStopOthers() {
        TransactionEvents events = new TransactionEvents();
        List<String> calls = new ArrayList<>();
        events.subscribe(TransactionEvent.START_TRANSACTION, () -> { throw new IllegalStateException("bad listener"); });
        events.subscribe(TransactionEvent.START_TRANSACTION, () -> calls.add("after"));

        assertDoesNotThrow(() -> events.notify(TransactionEvent.START_TRANSACTION));
        assertEquals(List.of("after"), calls);
    }

    @Test
    void notifyWithoutListenersIsNoOp() {
        assertDoesNotThrow(() -> new TransactionEvents().notify(TransactionEvent.START_TRANSACTION));
    }
}

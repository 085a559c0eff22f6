package com.txscope.core;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener registry for transaction lifecycle events.
 *
 * A listener that throws is reported on stderr and the remaining listeners still run;
 * the thread that fired the event is never interrupted by a listener failure.
 */
public class TransactionEvents {

    private final Map<TransactionEvent, List<Runnable>> listeners = new EnumMap<>(TransactionEvent.class);

    public TransactionEvents() {
        for (TransactionEvent event : TransactionEvent.values()) {
            listeners.put(event, new CopyOnWriteArrayList<>());
        }
    }

    public void subscribe(TransactionEvent event, Runnable listener) {
        listeners.get(event).add(listener);
    }

    public void notify(TransactionEvent event) {
        for (Runnable listener : listeners.get(event)) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                System.err.println("[txscope] ERROR in " + event + " listener: " + e);
            }
        }
    }
}

package com.txscope.core;

/**
 * Flags read on every push and pop. The transaction sampler is notified when either the
 * transaction tracer or developer mode is on.
 */
public record TracerConfig(boolean transactionTracerEnabled, boolean developerMode) {

    public static TracerConfig defaults() {
        return new TracerConfig(true, false);
    }

    public boolean samplerEnabled() {
        return transactionTracerEnabled || developerMode;
    }
}

package com.txscope.core;

/**
 * Receives scope push and pop events to build transaction traces.
 * Only called while {@link TracerConfig#samplerEnabled()} is true.
 */
public interface TransactionSampler {

    TransactionSampler NONE = new TransactionSampler() {
        @Override public void noticePushScope(double startTime) {}
        @Override public void noticePopScope(String name, double endTime) {}
    };

    void noticePushScope(double startTime);

    void noticePopScope(String name, double endTime);
}

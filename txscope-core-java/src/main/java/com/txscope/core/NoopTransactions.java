package com.txscope.core;

import com.txscope.core.stats.StatsHash;

import java.util.ArrayDeque;
import java.util.Deque;

/** Installed when tracing is turned off. Every operation succeeds and records nothing. */
public final class NoopTransactions implements Transactions {

    public static final NoopTransactions INSTANCE = new NoopTransactions();

    private NoopTransactions() {}

    @Override public ScopeFrame pushScope(Object tag) { return null; }
    @Override public ScopeFrame pushScope(Object tag, double startTime) { return null; }
    @Override public ScopeFrame pushScope(Object tag, double startTime, boolean deductCallTimeFromParent) { return null; }
    @Override public ScopeFrame popScope(ScopeFrame expected, String name) { return null; }
    @Override public ScopeFrame popScope(ScopeFrame expected, String name, double endTime) { return null; }
    @Override public void startTransaction() {}
    @Override public void endTransaction() {}
    @Override public void pushTransactionStats() {}
    @Override public StatsHash popTransactionStats(String transactionName) { return null; }
    @Override public StatsHash transactionStatsHash() { return null; }
    @Override public void recordMetric(String metricName, double duration, double exclusive) {}
    @Override public void setCurrentTransactionName(String name) {}
    @Override public String currentTransactionName() { return null; }

    // Fresh each call: callers may mutate what they get back.
    @Override public Deque<ScopeFrame> currentScopeStack() { return new ArrayDeque<>(); }
    @Override public Deque<StatsHash> currentStatsStack() { return new ArrayDeque<>(); }

    @Override
    @Deprecated
    public void setTransactionSampler(TransactionSampler sampler) {}
}

package com.txscope.core;

import com.txscope.core.stats.StatsHash;

import java.util.Deque;

/**
 * Scope and transaction-stats operations called from instrumented code.
 *
 * {@link StatsEngine} records; {@link NoopTransactions#INSTANCE} is installed when tracing is
 * turned off so that call sites never need to check.
 */
public interface Transactions {

    /**
     * Pushes a scope that deducts its time from its parent, starting now.
     * The returned frame must be handed back to the matching {@code popScope}.
     */
    ScopeFrame pushScope(Object tag);

    ScopeFrame pushScope(Object tag, double startTime);

    /**
     * @param tag                       identifies the frame in stack corruption errors only
     * @param startTime                 seconds
     * @param deductCallTimeFromParent  false for work that must not count against the caller's
     *                                  own time; only the frame's children time is passed up
     */
    ScopeFrame pushScope(Object tag, double startTime, boolean deductCallTimeFromParent);

    ScopeFrame popScope(ScopeFrame expected, String name);

    /**
     * Pops the top scope, charges its time to the new top of stack and names it.
     *
     * @throws StatsEngine.ScopeStackCorruptedException if the top of stack is not {@code expected}
     */
    ScopeFrame popScope(ScopeFrame expected, String name, double endTime);

    void startTransaction();

    /** Releases the execution context's scope state if its scope stack has drained. */
    void endTransaction();

    void pushTransactionStats();

    /**
     * Pops the current transaction's stats, resolves placeholder scopes to
     * {@code transactionName} and merges the result into the engine-wide store.
     *
     * @return the stats as recorded, before scope resolution; null if none were open
     */
    StatsHash popTransactionStats(String transactionName);

    /** The innermost open transaction stats, or null. */
    StatsHash transactionStatsHash();

    /**
     * Records one call of {@code metricName}, scoped to the current transaction if one is
     * recording and unscoped either way.
     */
    void recordMetric(String metricName, double duration, double exclusive);

    void setCurrentTransactionName(String name);

    String currentTransactionName();

    Deque<ScopeFrame> currentScopeStack();

    Deque<StatsHash> currentStatsStack();

    /** @deprecated the sampler is fixed when the engine is built; this only logs a warning. */
    @Deprecated
    void setTransactionSampler(TransactionSampler sampler);
}

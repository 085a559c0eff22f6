package com.txscope.core;

import com.txscope.core.stats.MetricSpec;
import com.txscope.core.stats.StatsHash;

import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.DoubleSupplier;

/**
 * Turns traced method calls and transaction roots into scope pushes, pops and metrics.
 *
 * Works against any {@link Transactions}; with {@link NoopTransactions} every frame is null
 * and the exit methods return immediately.
 */
public class MethodTracer {

    private final Transactions transactions;
    private final DoubleSupplier clock;

    public MethodTracer(Transactions transactions) {
        this(transactions, StatsEngine.WALL_CLOCK);
    }

    public MethodTracer(Transactions transactions, DoubleSupplier clock) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ScopeFrame traceMethodEnter(String metricName) {
        return transactions.pushScope(metricName, clock.getAsDouble(), true);
    }

    public void traceMethodExit(ScopeFrame frame, String metricName) {
        if (frame == null) return;
        double endTime = clock.getAsDouble();
        transactions.popScope(frame, metricName, endTime);
        double duration = endTime - frame.getStartTime();
        transactions.recordMetric(metricName, duration, duration - frame.getChildrenTime());
        // Outside any transaction, the outermost traced call releases the context's state.
        if (transactions.transactionStatsHash() == null && transactions.currentScopeStack().isEmpty()) {
            transactions.endTransaction();
        }
    }

    public <T> T traceExecutionScoped(String metricName, Callable<T> body) throws Exception {
        ScopeFrame frame = traceMethodEnter(metricName);
        try {
            return body.call();
        } finally {
            traceMethodExit(frame, metricName);
        }
    }

    /** Opens a transaction: fires the start event, opens its stats and pushes its root scope. */
    public ScopeFrame beginTransaction(Object tag) {
        transactions.startTransaction();
        transactions.pushTransactionStats();
        return transactions.pushScope(tag, clock.getAsDouble(), true);
    }

    /**
     * Closes a transaction opened by {@link #beginTransaction}. Its metrics recorded under the
     * scope placeholder are resolved to {@code transactionName} and merged into the engine store.
     *
     * If the root is not on top of the scope stack, the transaction's stats are discarded and
     * the stack is unwound through the root before the corruption error is rethrown, so later
     * calls on this context start clean.
     *
     * @return the transaction's stats before scope resolution, or null when tracing is off
     */
    public StatsHash finishTransaction(ScopeFrame root, String transactionName) {
        if (root == null) return null;
        transactions.setCurrentTransactionName(transactionName);
        try {
            double endTime = clock.getAsDouble();
            transactions.popScope(root, transactionName, endTime);
            double duration = endTime - root.getStartTime();
            StatsHash stats = transactions.transactionStatsHash();
            if (stats != null) {
                stats.record(MetricSpec.unscoped(transactionName), duration, duration - root.getChildrenTime());
            }
            return transactions.popTransactionStats(transactionName);
        } catch (StatsEngine.ScopeStackCorruptedException e) {
            transactions.currentStatsStack().poll();
            Deque<ScopeFrame> stack = transactions.currentScopeStack();
            while (stack.contains(root)) {
                stack.poll();
            }
            throw e;
        } finally {
            transactions.endTransaction();
        }
    }

    public Transactions getTransactions() {
        return transactions;
    }
}

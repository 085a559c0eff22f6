package com.txscope.core;

import com.txscope.core.stats.StatsHash;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-execution-context tracing state. Both stacks are created on first use and may be
 * dropped independently; only the owning execution context ever touches an instance.
 */
final class ExecutionContext {

    private Deque<ScopeFrame> scopeStack;
    private Deque<StatsHash> statsStack;
    private String transactionName;

    Deque<ScopeFrame> scopeStack() {
        if (scopeStack == null) scopeStack = new ArrayDeque<>();
        return scopeStack;
    }

    /** The scope stack without creating one; null if absent. */
    Deque<ScopeFrame> existingScopeStack() {
        return scopeStack;
    }

    Deque<StatsHash> statsStack() {
        if (statsStack == null) statsStack = new ArrayDeque<>();
        return statsStack;
    }

    boolean hasOpenStats() {
        return statsStack != null && !statsStack.isEmpty();
    }

    String transactionName() {
        return transactionName;
    }

    void setTransactionName(String transactionName) {
        this.transactionName = transactionName;
    }

    void clearScope() {
        scopeStack = null;
        transactionName = null;
    }
}

package com.txscope.core;

import com.txscope.core.stats.EngineStatsStore;
import com.txscope.core.stats.MethodStats;
import com.txscope.core.stats.MetricSpec;
import com.txscope.core.stats.StatsHash;

import java.time.Instant;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Tracks nested scopes and per-transaction metric stats for each execution context.
 *
 * Each execution context has its own scope stack and stats stack, so nothing here locks;
 * the only shared state is the {@link EngineStatsStore} that popped transaction stats are
 * merged into.
 */
public class StatsEngine implements Transactions {

    /** Wall clock in seconds since the epoch. */
    public static final DoubleSupplier WALL_CLOCK = () -> {
        Instant now = Instant.now();
        return now.getEpochSecond() + now.getNano() / 1_000_000_000.0;
    };

    private final ExecutionContextStore contexts;
    private final EngineStatsStore store;
    private final TransactionSampler sampler;
    private final TransactionEvents events;
    private final DoubleSupplier clock;
    private volatile TracerConfig config;

    public StatsEngine(TracerConfig config, TransactionSampler sampler) {
        this(config, sampler, new EngineStatsStore(), new TransactionEvents(), new ExecutionContextStore(), WALL_CLOCK);
    }

    public StatsEngine(TracerConfig config,
                       TransactionSampler sampler,
                       EngineStatsStore store,
                       TransactionEvents events,
                       ExecutionContextStore contexts,
                       DoubleSupplier clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.sampler = Objects.requireNonNull(sampler, "sampler");
        this.store = Objects.requireNonNull(store, "store");
        this.events = Objects.requireNonNull(events, "events");
        this.contexts = Objects.requireNonNull(contexts, "contexts");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // -----------------------------------------------------------------------
    // Scope stack
    // -----------------------------------------------------------------------

    @Override
    public ScopeFrame pushScope(Object tag) {
        return pushScope(tag, clock.getAsDouble(), true);
    }

    @Override
    public ScopeFrame pushScope(Object tag, double startTime) {
        return pushScope(tag, startTime, true);
    }

    @Override
    public ScopeFrame pushScope(Object tag, double startTime, boolean deductCallTimeFromParent) {
        Deque<ScopeFrame> stack = currentScopeStack();
        if (samplerEnabled()) sampler.noticePushScope(startTime);
        ScopeFrame frame = new ScopeFrame(tag, startTime, deductCallTimeFromParent);
        stack.push(frame);
        return frame;
    }

    @Override
    public ScopeFrame popScope(ScopeFrame expected, String name) {
        return popScope(expected, name, clock.getAsDouble());
    }

    @Override
    public ScopeFrame popScope(ScopeFrame expected, String name, double endTime) {
        Deque<ScopeFrame> stack = currentScopeStack();
        ScopeFrame frame = stack.poll();
        if (frame == null || frame != expected) {
            throw new ScopeStackCorruptedException(
                frame != null ? frame.getTag() : null,
                expected != null ? expected.getTag() : null);
        }

        ScopeFrame parent = stack.peek();
        if (parent != null) {
            if (frame.isDeductCallTimeFromParent()) {
                parent.addChildrenTime(endTime - frame.getStartTime());
            } else {
                parent.addChildrenTime(frame.getChildrenTime());
            }
        }
        if (samplerEnabled()) sampler.noticePopScope(name, endTime);
        frame.setName(name);
        return frame;
    }

    // -----------------------------------------------------------------------
    // Transaction lifecycle
    // -----------------------------------------------------------------------

    @Override
    public void startTransaction() {
        events.notify(TransactionEvent.START_TRANSACTION);
    }

    /**
     * A non-empty scope stack means an outer transaction is still running on this context,
     * so its state is left alone.
     */
    @Override
    public void endTransaction() {
        ExecutionContext ctx = contexts.peek();
        if (ctx == null) return;
        Deque<ScopeFrame> stack = ctx.existingScopeStack();
        if (stack == null || stack.isEmpty()) {
            contexts.release();
        }
    }

    // -----------------------------------------------------------------------
    // Transaction stats
    // -----------------------------------------------------------------------

    @Override
    public void pushTransactionStats() {
        currentStatsStack().push(new StatsHash());
    }

    @Override
    public StatsHash popTransactionStats(String transactionName) {
        ExecutionContext ctx = contexts.current();
        ctx.scopeStack();
        StatsHash stats = ctx.statsStack().poll();
        if (stats != null && !stats.isEmpty()) {
            store.merge(applyScopes(stats, transactionName));
        }
        return stats;
    }

    @Override
    public StatsHash transactionStatsHash() {
        return currentStatsStack().peek();
    }

    @Override
    public void recordMetric(String metricName, double duration, double exclusive) {
        StatsHash current = transactionStatsHash();
        if (current != null) {
            current.record(MetricSpec.placeholderScoped(metricName), duration, exclusive);
            current.record(MetricSpec.unscoped(metricName), duration, exclusive);
        } else {
            store.record(MetricSpec.unscoped(metricName), duration, exclusive);
        }
    }

    /**
     * Copies {@code stats}, re-keying every placeholder-scoped metric to {@code resolvedName}.
     * Entries that collide after re-keying are merged.
     */
    static StatsHash applyScopes(StatsHash stats, String resolvedName) {
        StatsHash resolved = new StatsHash();
        for (Map.Entry<MetricSpec, MethodStats> e : stats.entrySet()) {
            MetricSpec spec = e.getKey();
            if (spec.isPlaceholderScoped()) {
                spec = spec.withScope(resolvedName);
            }
            resolved.put(spec, e.getValue().copy());
        }
        return resolved;
    }

    // -----------------------------------------------------------------------
    // Execution context accessors
    // -----------------------------------------------------------------------

    @Override
    public void setCurrentTransactionName(String name) {
        contexts.current().setTransactionName(name);
    }

    @Override
    public String currentTransactionName() {
        ExecutionContext ctx = contexts.peek();
        return ctx == null ? null : ctx.transactionName();
    }

    @Override
    public Deque<ScopeFrame> currentScopeStack() {
        return contexts.current().scopeStack();
    }

    @Override
    public Deque<StatsHash> currentStatsStack() {
        return contexts.current().statsStack();
    }

    @Override
    @Deprecated
    public void setTransactionSampler(TransactionSampler sampler) {
        System.err.println("[txscope] WARNING: StatsEngine#setTransactionSampler is deprecated and has no effect");
    }

    // -----------------------------------------------------------------------
    // Configuration
    // -----------------------------------------------------------------------

    public boolean samplerEnabled() {
        return config.samplerEnabled();
    }

    public void setConfig(TracerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public EngineStatsStore getStore() {
        return store;
    }

    public TransactionEvents getEvents() {
        return events;
    }

    /**
     * A pop did not match the most recent push on the same execution context: a traced call site
     * returned without popping, or a frame crossed to another context.
     */
    public static class ScopeStackCorruptedException extends RuntimeException {

        private final String actualTag;
        private final String expectedTag;

        public ScopeStackCorruptedException(Object actualTag, Object expectedTag) {
            super("unbalanced pop from scope stack, got " + (actualTag != null ? actualTag : "nil")
                + ", expected " + (expectedTag != null ? expectedTag : "nil"));
            this.actualTag = actualTag != null ? String.valueOf(actualTag) : null;
            this.expectedTag = expectedTag != null ? String.valueOf(expectedTag) : null;
        }

        /** The top-of-stack tag that was actually popped, or null if the stack was empty. */
        public String getActualTag()   { return actualTag; }
        public String getExpectedTag() { return expectedTag; }
    }
}

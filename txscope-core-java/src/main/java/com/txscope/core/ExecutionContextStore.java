package com.txscope.core;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Binds tracing state to the running execution context.
 *
 * By default each thread owns its state through a {@link ThreadLocal}, so a thread that dies
 * without releasing takes its state with it. Callers running many logical tasks on one thread
 * (fibers, reactive pipelines) supply their own identity instead; those bindings live in a map
 * and stay until {@link #release()} is called for that identity.
 */
public class ExecutionContextStore {

    // Exactly one of perThread / byIdentity is in use.
    private final ThreadLocal<ExecutionContext> perThread;
    private final ConcurrentHashMap<Object, ExecutionContext> byIdentity;
    private final Supplier<?> identity;
    private final AtomicInteger bindings = new AtomicInteger();

    public ExecutionContextStore() {
        this.perThread = new ThreadLocal<>();
        this.byIdentity = null;
        this.identity = null;
    }

    public ExecutionContextStore(Supplier<?> identity) {
        this.perThread = null;
        this.byIdentity = new ConcurrentHashMap<>();
        this.identity = Objects.requireNonNull(identity, "identity");
    }

    ExecutionContext current() {
        if (perThread != null) {
            ExecutionContext ctx = perThread.get();
            if (ctx == null) {
                ctx = new ExecutionContext();
                perThread.set(ctx);
                bindings.incrementAndGet();
            }
            return ctx;
        }
        return byIdentity.computeIfAbsent(identity.get(), k -> {
            bindings.incrementAndGet();
            return new ExecutionContext();
        });
    }

    /** The current binding, or null without creating one. */
    ExecutionContext peek() {
        return perThread != null ? perThread.get() : byIdentity.get(identity.get());
    }

    /**
     * Drops the scope stack and transaction name of the current context. The binding itself is
     * removed unless transaction stats are still open on it.
     */
    void release() {
        ExecutionContext ctx = peek();
        if (ctx == null) return;
        ctx.clearScope();
        if (ctx.hasOpenStats()) return;
        if (perThread != null) {
            perThread.remove();
            bindings.decrementAndGet();
        } else if (byIdentity.remove(identity.get(), ctx)) {
            bindings.decrementAndGet();
        }
    }

    /**
     * Bindings created and not yet released. A thread that ends while still bound stays counted,
     * although its state is reclaimed with the thread.
     */
    public int bindingCount() {
        return bindings.get();
    }
}

package com.txscope.agent;

import com.txscope.core.MethodTracer;
import com.txscope.core.NoopTransactions;
import com.txscope.core.ScopeFrame;
import com.txscope.core.StatsEngine;
import com.txscope.core.Transactions;

import java.lang.reflect.Method;

/**
 * Static entry points for advice inlined into instrumented classes.
 *
 * Inlined advice runs in the instrumented class's own class loader and package, so everything
 * it calls here must be public and static. A scope stack corruption seen from instrumented code
 * is never thrown into the application: tracing is switched off for the rest of the process.
 */
public final class AgentRuntime {

    private static volatile MethodTracer tracer = new MethodTracer(NoopTransactions.INSTANCE);

    private AgentRuntime() {}

    static void install(Transactions transactions) {
        tracer = new MethodTracer(transactions);
    }

    static void reset() {
        tracer = new MethodTracer(NoopTransactions.INSTANCE);
    }

    public static MethodTracer tracer() {
        return tracer;
    }

    public static boolean isEnabled() {
        return tracer.getTransactions() != NoopTransactions.INSTANCE;
    }

    // -----------------------------------------------------------------------
    // Called from MethodAdvice
    // -----------------------------------------------------------------------

    public static ScopeFrame enterMethod(Method method) {
        return tracer.traceMethodEnter(metricName(method));
    }

    public static void exitMethod(ScopeFrame frame, Method method) {
        MethodTracer current = tracer;
        try {
            current.traceMethodExit(frame, metricName(method));
        } catch (StatsEngine.ScopeStackCorruptedException e) {
            disable(e);
        }
    }

    // -----------------------------------------------------------------------
    // Called from EntryPointAdvice
    // -----------------------------------------------------------------------

    public static ScopeFrame enterTransaction(Method method) {
        return tracer.beginTransaction(transactionName(method));
    }

    public static void exitTransaction(ScopeFrame root, Method method) {
        MethodTracer current = tracer;
        try {
            current.finishTransaction(root, transactionName(method));
        } catch (StatsEngine.ScopeStackCorruptedException e) {
            disable(e);
        }
    }

    // -----------------------------------------------------------------------
    // Naming
    // -----------------------------------------------------------------------

    public static String metricName(Method method) {
        return "Custom/" + method.getDeclaringClass().getSimpleName() + "/" + method.getName();
    }

    public static String transactionName(Method method) {
        return "OtherTransaction/" + method.getDeclaringClass().getSimpleName() + "/" + method.getName();
    }

    private static void disable(StatsEngine.ScopeStackCorruptedException e) {
        System.err.println("[txscope-agent] ERROR: " + e.getMessage() + "; tracing disabled");
        reset();
    }
}

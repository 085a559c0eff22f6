package com.txscope.agent;

import com.txscope.core.stats.EngineStatsStore;
import com.txscope.core.stats.MethodStats;
import com.txscope.core.stats.MetricSpec;
import com.txscope.core.stats.StatsHash;

import java.io.PrintStream;
import java.util.Map;

/**
 * Prints everything left in the engine store when the JVM exits.
 * Registered via Runtime.getRuntime().addShutdownHook().
 */
public class ShutdownHook implements Runnable {

    private final EngineStatsStore store;
    private final PrintStream out;

    public ShutdownHook(EngineStatsStore store) {
        this(store, System.err);
    }

    ShutdownHook(EngineStatsStore store, PrintStream out) {
        this.store = store;
        this.out = out;
    }

    @Override
    public void run() {
        try {
            report(store.harvest());
        } catch (RuntimeException e) {
            out.println("[txscope-agent] ERROR writing metric summary: " + e.getMessage());
        }
    }

    void report(StatsHash harvested) {
        out.println("[txscope-agent] " + harvested.size() + " metrics recorded");
        for (Map.Entry<MetricSpec, MethodStats> e : harvested.entrySet()) {
            out.println("[txscope-agent]   " + e.getKey() + " " + e.getValue());
        }
    }
}

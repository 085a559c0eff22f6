package com.txscope.core.stats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide statistics store that every execution context merges into.
 *
 * Merges are atomic per key: the per-key {@code compute} lock is the only synchronization.
 * {@link #harvest()} removes keys one at a time, so a merge racing a harvest lands either
 * in the harvested snapshot or in the next one, never in neither.
 */
public class EngineStatsStore {

    private final ConcurrentHashMap<MetricSpec, MethodStats> stats = new ConcurrentHashMap<>();

    public void merge(StatsHash other) {
        for (Map.Entry<MetricSpec, MethodStats> e : other.entrySet()) {
            MethodStats incoming = e.getValue();
            stats.compute(e.getKey(), (k, existing) -> {
                if (existing == null) return incoming.copy();
                existing.merge(incoming);
                return existing;
            });
        }
    }

    public void record(MetricSpec spec, double duration, double exclusive) {
        stats.compute(spec, (k, existing) -> {
            MethodStats s = existing != null ? existing : new MethodStats();
            s.recordDataPoint(duration, exclusive);
            return s;
        });
    }

    /** Returns a copy of the bucket for {@code spec}, or null if nothing was recorded. */
    public MethodStats statsFor(MetricSpec spec) {
        MethodStats[] out = new MethodStats[1];
        stats.computeIfPresent(spec, (k, existing) -> {
            out[0] = existing.copy();
            return existing;
        });
        return out[0];
    }

    /** Removes and returns everything recorded so far, ordered by metric name then scope. */
    public StatsHash harvest() {
        List<MetricSpec> keys = new ArrayList<>(stats.keySet());
        keys.sort(Comparator.comparing(MetricSpec::name).thenComparing(MetricSpec::scope));
        StatsHash snapshot = new StatsHash();
        for (MetricSpec key : keys) {
            MethodStats removed = stats.remove(key);
            if (removed != null) snapshot.put(key, removed);
        }
        return snapshot;
    }

    public int size() {
        return stats.size();
    }
}

package com.txscope.core.stats;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Insertion-ordered map from {@link MetricSpec} to {@link MethodStats}.
 * One instance accumulates the metrics of a single transaction recording.
 */
public class StatsHash {

    private final Map<MetricSpec, MethodStats> stats = new LinkedHashMap<>();

    /** Returns the stats bucket for {@code spec}, creating an empty one if absent. */
    public MethodStats statsFor(MetricSpec spec) {
        return stats.computeIfAbsent(spec, k -> new MethodStats());
    }

    public void record(MetricSpec spec, double duration, double exclusive) {
        statsFor(spec).recordDataPoint(duration, exclusive);
    }

    /** Adds {@code value} under {@code spec}, merging with any bucket already present. */
    public void put(MetricSpec spec, MethodStats value) {
        MethodStats existing = stats.get(spec);
        if (existing == null) {
            stats.put(spec, value);
        } else {
            existing.merge(value);
        }
    }

    public void merge(StatsHash other) {
        for (Map.Entry<MetricSpec, MethodStats> e : other.stats.entrySet()) {
            statsFor(e.getKey()).merge(e.getValue());
        }
    }

    public MethodStats get(MetricSpec spec) {
        return stats.get(spec);
    }

    public Set<Map.Entry<MetricSpec, MethodStats>> entrySet() {
        return Collections.unmodifiableMap(stats).entrySet();
    }

    public int size() {
        return stats.size();
    }

    public boolean isEmpty() {
        return stats.isEmpty();
    }

    @Override
    public String toString() {
        return stats.toString();
    }
}

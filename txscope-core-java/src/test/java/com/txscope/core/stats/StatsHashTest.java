package com.txscope.core.stats;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatsHashTest {

    @Test
    void recordCreatesOneBucketPerSpec() {
        StatsHash hash = new StatsHash();
        hash.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        hash.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        hash.record(MetricSpec.placeholderScoped("a"), 1.0, 1.0);

        assertEquals(2, hash.size());
        assertEquals(2, hash.get(MetricSpec.unscoped("a")).getCallCount());
    }

    @Test
    void putMergesIntoExistingBucket() {
        StatsHash hash = new StatsHash();
        hash.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        MethodStats extra = new MethodStats();
        extra.recordDataPoint(2.0, 2.0);

        hash.put(MetricSpec.unscoped("a"), extra);

        assertEquals(2, hash.get(MetricSpec.unscoped("a")).getCallCount());
        assertEquals(3.0, hash.get(MetricSpec.unscoped("a")).getTotalCallTime());
    }

    @Test
    void mergeCombinesCollidingKeys() {
        StatsHash left = new StatsHash();
        left.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        StatsHash right = new StatsHash();
        right.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        right.record(MetricSpec.unscoped("b"), 1.0, 1.0);

        left.merge(right);

        assertEquals(2, left.size());
        assertEquals(2, left.get(MetricSpec.unscoped("a")).getCallCount());
        assertEquals(1, right.get(MetricSpec.unscoped("a")).getCallCount());
    }

    @Test
    void entriesKeepInsertionOrder() {
        StatsHash hash = new StatsHash();
        hash.record(MetricSpec.unscoped("z"), 1.0, 1.0);
        hash.record(MetricSpec.unscoped("a"), 1.0, 1.0);

        List<String> names = new ArrayList<>();
        for (Map.Entry<MetricSpec, MethodStats> e : hash.entrySet()) names.add(e.getKey().name());

        assertEquals(List.of("z", "a"), names);
    }

    @Test
    void entrySetIsReadOnly() {
        StatsHash hash = new StatsHash();
        hash.record(MetricSpec.unscoped("a"), 1.0, 1.0);
        assertThrows(UnsupportedOperationException.class, () -> hash.entrySet().clear());
    }
}

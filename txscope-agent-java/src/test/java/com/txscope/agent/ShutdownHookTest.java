package com.txscope.agent;

import com.txscope.core.stats.EngineStatsStore;
import com.txscope.core.stats.MetricSpec;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class ShutdownHookTest {

    @Test
    void printsAndHarvestsEveryMetric() {
        EngineStatsStore store = new EngineStatsStore();
        store.record(MetricSpec.unscoped("Custom/B/run"), 1.0, 1.0);
        store.record(new MetricSpec("Custom/A/run", "OtherTransaction/Jobs/run"), 0.5, 0.25);
        ByteArrayOutputStream captured = new ByteArrayOutputStream();

        new ShutdownHook(store, new PrintStream(captured, true)).run();

        String output = captured.toString();
        assertTrue(output.contains("2 metrics recorded"), output);
        assertTrue(output.indexOf("Custom/A/run [OtherTransaction/Jobs/run]") < output.indexOf("Custom/B/run"), output);
        assertTrue(output.contains("calls=1"), output);
        assertEquals(0, store.size());
    }

    @Test
    void emptyStoreReportsZero() {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        new ShutdownHook(new EngineStatsStore(), new PrintStream(captured, true)).run();
        assertTrue(captured.toString().contains("0 metrics recorded"));
    }
}

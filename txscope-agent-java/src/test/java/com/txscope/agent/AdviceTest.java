package com.txscope.agent;

import com.txscope.core.MethodTracer;
import com.txscope.core.ScopeFrame;
import com.txscope.core.StatsEngine;
import com.txscope.core.TracerConfig;
import com.txscope.core.TransactionSampler;
import com.txscope.core.stats.EngineStatsStore;
import com.txscope.core.stats.MethodStats;
import com.txscope.core.stats.MetricSpec;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.reflect.InvocationTargetException;

import static net.bytebuddy.matcher.ElementMatchers.named;
import static net.bytebuddy.matcher.ElementMatchers.namedOneOf;
import static org.junit.jupiter.api.Assertions.*;

class AdviceTest {

    private static final String TX = "OtherTransaction/CheckoutFixture/checkout";

    private StatsEngine engine;
    private EngineStatsStore store;
    private Class<?> instrumented;

    @BeforeEach
    void setUp() {
        engine = new StatsEngine(TracerConfig.defaults(), TransactionSampler.NONE);
        store = engine.getStore();
        AgentRuntime.install(engine);

        // Same advice the agent installs, applied to a private copy of the fixture.
        instrumented = new ByteBuddy()
            .redefine(CheckoutFixture.class)
            .visit(Advice.to(EntryPointAdvice.class).on(named("checkout")))
            .visit(Advice.to(MethodAdvice.class).on(namedOneOf("price", "lookupRate", "reserve", "explode", "nestedCheckout")))
            .make()
            .load(CheckoutFixture.class.getClassLoader(), ClassLoadingStrategy.Default.CHILD_FIRST)
            .getLoaded();
    }

    @AfterEach
    void tearDown() {
        AgentRuntime.reset();
    }

    private Object call(String method) throws Exception {
        Object fixture = instrumented.getDeclaredConstructor().newInstance();
        return instrumented.getMethod(method).invoke(fixture);
    }

    @Test
    void entryPointRecordsTransactionAndScopedMethods() throws Exception {
        assertEquals("order-42", call("checkout"));

        assertEquals(1, store.statsFor(MetricSpec.unscoped(TX)).getCallCount());
        assertEquals(1, store.statsFor(new MetricSpec("Custom/CheckoutFixture/price", TX)).getCallCount());
        assertEquals(1, store.statsFor(new MetricSpec("Custom/CheckoutFixture/lookupRate", TX)).getCallCount());
        assertEquals(1, store.statsFor(new MetricSpec("Custom/CheckoutFixture/reserve", TX)).getCallCount());
        assertNull(store.statsFor(MetricSpec.placeholderScoped("Custom/CheckoutFixture/price")));

        assertTrue(engine.currentScopeStack().isEmpty());
        assertTrue(engine.currentStatsStack().isEmpty());
    }

    @Test
    void parentExclusiveTimeExcludesTracedChildren() throws Exception {
        call("checkout");

        MethodStats price = store.statsFor(new MetricSpec("Custom/CheckoutFixture/price", TX));
        assertTrue(price.getTotalExclusiveTime() <= price.getTotalCallTime());
        assertTrue(price.getTotalExclusiveTime() >= 0.0);
    }

    @Test
    void methodOutsideTransactionIsUnscoped() throws Exception {
        call("price");

        assertEquals(1, store.statsFor(MetricSpec.unscoped("Custom/CheckoutFixture/price")).getCallCount());
        assertEquals(1, store.statsFor(MetricSpec.unscoped("Custom/CheckoutFixture/lookupRate")).getCallCount());
        assertEquals(2, store.size());
    }

    @Test
    void exceptionalExitStillPops() {
        InvocationTargetException e = assertThrows(InvocationTargetException.class, () -> call("explode"));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(engine.currentScopeStack().isEmpty());
        assertEquals(1, store.statsFor(MetricSpec.unscoped("Custom/CheckoutFixture/explode")).getCallCount());
    }

    @Test
    void transactionCalledInsideTracedMethodIsInner() throws Exception {
        call("nestedCheckout");

        assertNotNull(store.statsFor(new MetricSpec("Custom/CheckoutFixture/price", TX)));
        assertEquals(1, store.statsFor(MetricSpec.unscoped("Custom/CheckoutFixture/nestedCheckout")).getCallCount());
        assertTrue(engine.currentScopeStack().isEmpty());
    }

    @Test
    void disabledRuntimeRecordsNothing() throws Exception {
        AgentRuntime.reset();

        assertEquals("order-42", call("checkout"));

        assertEquals(0, store.size());
    }

    @Test
    void corruptedStackDisablesTracingInsteadOfThrowing() throws Exception {
        MethodTracer tracer = AgentRuntime.tracer();
        ScopeFrame outer = tracer.traceMethodEnter("outer");
        tracer.traceMethodEnter("inner");

        assertDoesNotThrow(() -> AgentRuntime.exitMethod(outer, CheckoutFixture.class.getMethod("price")));

        assertFalse(AgentRuntime.isEnabled());
        assertEquals("order-42", call("checkout"));
    }
}

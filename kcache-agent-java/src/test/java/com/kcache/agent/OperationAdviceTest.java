package com.kcache.agent;

import com.kcache.agent.report.OperationStats;
import com.kcache.agent.sampler.FakeResourceProbe;
import com.kcache.agent.sampler.ResourceSampler;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.implementation.SuperMethodCall;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static net.bytebuddy.matcher.ElementMatchers.named;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs OperationAdvice woven into a generated subclass, the same bytecode path the agent installs.
 */
class OperationAdviceTest {

    public static class Workload {
        public int run(int n) {
            if (n < 0) throw new IllegalArgumentException("negative");
            return n * 2;
        }
    }

    private KcacheService saved;
    private KcacheService service;
    private Workload workload;

    @BeforeEach
    void setUp() throws Exception {
        saved = AgentBootstrap.service;
        service = new KcacheService(
            new ResourceSampler(new FakeResourceProbe(true), 100), TrackLevel.TOP, null, false);
        service.init(10);
        AgentBootstrap.service = service;

        workload = new ByteBuddy()
            .subclass(Workload.class)
            .method(named("run"))
            .intercept(Advice.to(OperationAdvice.class).wrap(SuperMethodCall.INSTANCE))
            .make()
            .load(getClass().getClassLoader(), ClassLoadingStrategy.Default.WRAPPER)
            .getLoaded()
            .getDeclaredConstructor()
            .newInstance();
    }

    @AfterEach
    void tearDown() {
        AgentBootstrap.service = saved;
    }

    @Test
    void completedCallIsRecordedUnderItsSymbol() {
        assertEquals(6, workload.run(3));
        assertEquals(8, workload.run(4));

        List<OperationStats> rows = service.enumerate();
        assertEquals(1, rows.size());
        assertEquals(2, rows.get(0).calls());
        String symbol = AgentBootstrap.symbols.nameOf(rows.get(0).identity().operationId());
        assertNotNull(symbol);
        assertTrue(symbol.endsWith(".run(int)"), symbol);
        assertEquals(0, service.pendingDepth());
    }

    @Test
    void throwingCallRecordsNothingAndStillPropagates() {
        assertThrows(IllegalArgumentException.class, () -> workload.run(-1));
        assertTrue(service.enumerate().isEmpty());
        assertEquals(0, service.pendingDepth());
    }
}

package com.cluster.state.metrics;

import com.cluster.state.core.model.Life;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordTransaction("destroy unit a/0", 1, Duration.ofMillis(3));
                noOp.incrementAborted("destroy unit a/0");
                noOp.incrementContention("destroy unit a/0");
                noOp.recordLifeTransition("unit", Life.DYING);
                noOp.incrementRemoved("unit");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record transactions per operation kind")
        void recordTransaction() {
            metrics.recordTransaction("destroy unit wordpress/0", 1, Duration.ofMillis(5));
            metrics.recordTransaction("destroy machine 3", 2, Duration.ofMillis(7));

            Timer timer = registry.find("state.txn.duration").tag("operation", "destroy").timer();
            assertNotNull(timer);
            assertEquals(2, timer.count());

            DistributionSummary attempts = registry.find("state.txn.attempts").summary();
            assertNotNull(attempts);
            assertEquals(3.0, attempts.totalAmount());
        }

        @Test
        @DisplayName("Should count aborted attempts and contention")
        void abortedAndContention() {
            metrics.incrementAborted("add unit wordpress/1");
            metrics.incrementAborted("add relation a:b c:d");
            metrics.incrementContention("remove unit wordpress/1");

            Counter aborted = registry.find("state.txn.aborted").tag("operation", "add").counter();
            assertNotNull(aborted);
            assertEquals(2.0, aborted.count());

            Counter contention = registry.find("state.txn.contention").tag("operation", "remove").counter();
            assertNotNull(contention);
            assertEquals(1.0, contention.count());
        }

        @Test
        @DisplayName("Should count life transitions by entity and life")
        void lifeTransitions() {
            metrics.recordLifeTransition("unit", Life.DYING);
            metrics.recordLifeTransition("unit", Life.DYING);
            metrics.recordLifeTransition("unit", Life.DEAD);
            metrics.recordLifeTransition("machine", Life.DYING);

            Counter unitDying = registry.find("state.life.transition")
                    .tag("entity", "unit")
                    .tag("life", "DYING")
                    .counter();
            assertNotNull(unitDying);
            assertEquals(2.0, unitDying.count());

            Counter machineDying = registry.find("state.life.transition")
                    .tag("entity", "machine")
                    .tag("life", "DYING")
                    .counter();
            assertNotNull(machineDying);
            assertEquals(1.0, machineDying.count());
        }

        @Test
        @DisplayName("Should count removals by entity")
        void removals() {
            metrics.incrementRemoved("relation");

            Counter removed = registry.find("state.entity.removed").tag("entity", "relation").counter();
            assertNotNull(removed);
            assertEquals(1.0, removed.count());
            assertNull(registry.find("state.entity.removed").tag("entity", "unit").counter());
        }

        @Test
        @DisplayName("Should take the first word of an operation as its kind")
        void kindOf() {
            assertEquals("destroy", MetricsService.kindOf("destroy unit wordpress/0"));
            assertEquals("cleanup", MetricsService.kindOf("cleanup"));
        }
    }
}

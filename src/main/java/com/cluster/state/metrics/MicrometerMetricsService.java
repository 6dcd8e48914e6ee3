package com.cluster.state.metrics;

import com.cluster.state.core.model.Life;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code state.txn.duration}: Timer (tag: operation)</li>
 *   <li>{@code state.txn.attempts}: DistributionSummary</li>
 *   <li>{@code state.txn.aborted}: Counter (tag: operation)</li>
 *   <li>{@code state.txn.contention}: Counter (tag: operation)</li>
 *   <li>{@code state.life.transition}: Counter (tags: entity, life)</li>
 *   <li>{@code state.entity.removed}: Counter (tag: entity)</li>
 * </ul>
 *
 * <p>The {@code operation} tag uses the operation kind (first word of the
 * operation name) so entity names do not explode tag cardinality.</p>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary attemptsSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.attemptsSummary = DistributionSummary.builder("state.txn.attempts")
                .description("Number of attempts needed per transaction run")
                .register(registry);
    }

    @Override
    public void recordTransaction(String operation, int attempts, Duration duration) {
        String kind = MetricsService.kindOf(operation);
        Timer timer = timerCache.computeIfAbsent(kind, k ->
                Timer.builder("state.txn.duration")
                        .description("Duration of transaction runs including retries")
                        .tag("operation", kind)
                        .register(registry));
        timer.record(duration);
        attemptsSummary.record(attempts);
    }

    @Override
    public void incrementAborted(String operation) {
        String kind = MetricsService.kindOf(operation);
        counter("aborted:" + kind, () -> Counter.builder("state.txn.aborted")
                .description("Number of aborted transaction attempts")
                .tag("operation", kind)).increment();
    }

    @Override
    public void incrementContention(String operation) {
        String kind = MetricsService.kindOf(operation);
        counter("contention:" + kind, () -> Counter.builder("state.txn.contention")
                .description("Number of transactions that ran out of attempts")
                .tag("operation", kind)).increment();
    }

    @Override
    public void recordLifeTransition(String entityKind, Life life) {
        counter("life:" + entityKind + ":" + life.name(), () -> Counter.builder("state.life.transition")
                .description("Number of life transitions")
                .tag("entity", entityKind)
                .tag("life", life.name())).increment();
    }

    @Override
    public void incrementRemoved(String entityKind) {
        counter("removed:" + entityKind, () -> Counter.builder("state.entity.removed")
                .description("Number of entities physically removed")
                .tag("entity", entityKind)).increment();
    }

    private Counter counter(String key, Supplier<Counter.Builder> builder) {
        return counterCache.computeIfAbsent(key, k -> builder.get().register(registry));
    }
}

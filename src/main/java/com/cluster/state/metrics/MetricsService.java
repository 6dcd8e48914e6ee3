package com.cluster.state.metrics;

import com.cluster.state.core.model.Life;

import java.time.Duration;

/**
 * Interface for recording state layer metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /**
     * Records a transaction run that completed, either applied or found nothing to do.
     */
    void recordTransaction(String operation, int attempts, Duration duration);

    void incrementAborted(String operation);

    void incrementContention(String operation);

    void recordLifeTransition(String entityKind, Life life);

    void incrementRemoved(String entityKind);

    /**
     * The first word of an operation description, e.g. "destroy" for "destroy unit a/0".
     */
    static String kindOf(String operation) {
        int space = operation.indexOf(' ');
        return space > 0 ? operation.substring(0, space) : operation;
    }
}

package com.cluster.state.metrics;

import com.cluster.state.core.model.Life;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, so the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordTransaction(String operation, int attempts, Duration duration) {
    }

    @Override
    public void incrementAborted(String operation) {
    }

    @Override
    public void incrementContention(String operation) {
    }

    @Override
    public void recordLifeTransition(String entityKind, Life life) {
    }

    @Override
    public void incrementRemoved(String entityKind) {
    }
}

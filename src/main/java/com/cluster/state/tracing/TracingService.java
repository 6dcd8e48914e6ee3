package com.cluster.state.tracing;

/**
 * Traces transaction runs. {@link NoOpTracingService} is the default;
 * {@link OpenTelemetryTracingService} reports runs when the OpenTelemetry API is present.
 */
public interface TracingService {

    /**
     * Opens the span for one run of {@code operation}.
     *
     * @param maxAttempts the attempt budget of the run
     */
    TxnSpan startTransaction(String operation, int maxAttempts);
}

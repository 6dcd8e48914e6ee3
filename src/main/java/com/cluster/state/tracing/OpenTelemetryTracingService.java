package com.cluster.state.tracing;

import com.cluster.state.metrics.MetricsService;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

/**
 * Reports transaction runs as OpenTelemetry spans named {@code state.txn}.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>The span carries the operation, its kind and the attempt budget. Each
 * attempt becomes a {@code txn.attempt} event with its number, op count and
 * outcome; the final attempt count is set when the run ends.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    static final String SPAN_NAME = "state.txn";
    static final String ATTEMPT_EVENT = "txn.attempt";

    static final AttributeKey<String> OPERATION = AttributeKey.stringKey("txn.operation");
    static final AttributeKey<String> KIND = AttributeKey.stringKey("txn.kind");
    static final AttributeKey<Long> MAX_ATTEMPTS = AttributeKey.longKey("txn.max_attempts");
    static final AttributeKey<Long> ATTEMPTS = AttributeKey.longKey("txn.attempts");
    static final AttributeKey<Long> ATTEMPT = AttributeKey.longKey("txn.attempt");
    static final AttributeKey<Long> OPS = AttributeKey.longKey("txn.ops");
    static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("txn.outcome");

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public TxnSpan startTransaction(String operation, int maxAttempts) {
        SpanBuilder builder = tracer.spanBuilder(SPAN_NAME);
        builder.setSpanKind(SpanKind.INTERNAL);
        builder.setAttribute(OPERATION, operation);
        builder.setAttribute(KIND, MetricsService.kindOf(operation));
        builder.setAttribute(MAX_ATTEMPTS, (long) maxAttempts);
        return new OTelTxnSpan(builder.startSpan());
    }

    private static class OTelTxnSpan implements TxnSpan {

        private final Span span;

        OTelTxnSpan(Span span) {
            this.span = span;
        }

        @Override
        public void attempt(int attempt, int opCount, AttemptOutcome outcome) {
            span.addEvent(ATTEMPT_EVENT, Attributes.of(
                    ATTEMPT, (long) attempt,
                    OPS, (long) opCount,
                    OUTCOME, outcome.label()));
        }

        @Override
        public void committed(int attempts) {
            span.setAttribute(ATTEMPTS, (long) attempts);
            span.setStatus(StatusCode.OK);
        }

        @Override
        public void contended(int attempts) {
            span.setAttribute(ATTEMPTS, (long) attempts);
            span.setStatus(StatusCode.ERROR, "state changing too quickly");
        }

        @Override
        public void failed(Throwable error) {
            span.recordException(error);
            span.setStatus(StatusCode.ERROR, error.getClass().getSimpleName());
        }

        @Override
        public void close() {
            span.end();
        }
    }
}

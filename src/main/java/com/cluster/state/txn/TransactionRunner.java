package com.cluster.state.txn;

import com.cluster.state.errors.ExcessiveContentionException;
import com.cluster.state.errors.StateException;
import com.cluster.state.logging.LogContext;
import com.cluster.state.metrics.MetricsService;
import com.cluster.state.store.BatchOutcome;
import com.cluster.state.store.DocumentStore;
import com.cluster.state.store.TxnOp;
import com.cluster.state.tracing.AttemptOutcome;
import com.cluster.state.tracing.TracingService;
import com.cluster.state.tracing.TxnSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Runs optimistic transactions against a {@link DocumentStore}.
 *
 * <p>Each attempt asks the {@link TransactionSource} for fresh ops and submits
 * them as one atomic batch. An aborted batch means some assertion no longer
 * held, so the source is called again with the next attempt number. Once the
 * attempt budget is spent the run fails with {@link ExcessiveContentionException}.</p>
 *
 * <p>The runner holds no locks; correctness comes entirely from the assertions
 * inside each batch.</p>
 */
public class TransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(TransactionRunner.class);

    private final DocumentStore store;
    private final TxnConfig config;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public TransactionRunner(DocumentStore store, TxnConfig config,
                             MetricsService metricsService, TracingService tracingService) {
        this.store = store;
        this.config = config;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
    }

    /**
     * Runs {@code source} with the configured attempt budget.
     *
     * @param operation human readable description used in logs and errors
     */
    public void run(String operation, TransactionSource source) {
        run(operation, source, config.maxAttempts());
    }

    /**
     * Runs {@code source} allowing at most {@code maxAttempts} attempts.
     */
    public void run(String operation, TransactionSource source, int maxAttempts) {
        long startNanos = System.nanoTime();
        try (LogContext ctx = LogContext.forTransaction(operation);
             TxnSpan span = tracingService.startTransaction(operation, maxAttempts)) {
            for (int attempt = 0; attempt < maxAttempts; attempt++) {
                List<TxnOp> ops;
                try {
                    ops = source.build(attempt);
                } catch (TransientFailureException e) {
                    log.debug("txn.transient operation={} attempt={} reason={}", operation, attempt, e.getMessage());
                    span.attempt(attempt, 0, AttemptOutcome.TRANSIENT);
                    pause(operation, attempt, maxAttempts);
                    continue;
                } catch (RuntimeException e) {
                    span.failed(e);
                    throw e;
                }

                if (ops == null || ops.isEmpty()) {
                    log.debug("txn.noop operation={} attempt={}", operation, attempt);
                    span.attempt(attempt, 0, AttemptOutcome.NOTHING_TO_DO);
                    finish(operation, attempt + 1, startNanos, span);
                    return;
                }

                BatchOutcome outcome;
                try {
                    outcome = store.runAtomicBatch(ops);
                } catch (RuntimeException e) {
                    span.failed(e);
                    throw e;
                }
                if (outcome == BatchOutcome.APPLIED) {
                    log.debug("txn.applied operation={} attempt={} ops={}", operation, attempt, ops.size());
                    span.attempt(attempt, ops.size(), AttemptOutcome.APPLIED);
                    finish(operation, attempt + 1, startNanos, span);
                    return;
                }

                log.debug("txn.aborted operation={} attempt={}", operation, attempt);
                span.attempt(attempt, ops.size(), AttemptOutcome.ASSERT_FAILED);
                metricsService.incrementAborted(operation);
                pause(operation, attempt, maxAttempts);
            }

            log.warn("txn.contention operation={} attempts={}", operation, maxAttempts);
            metricsService.incrementContention(operation);
            span.contended(maxAttempts);
            throw new ExcessiveContentionException(operation, maxAttempts);
        }
    }

    /**
     * Submits a single batch without retrying. Callers that need to explain
     * an abort to their own caller inspect the outcome themselves.
     */
    public BatchOutcome runOnce(String operation, List<TxnOp> ops) {
        try (TxnSpan span = tracingService.startTransaction(operation, 1)) {
            BatchOutcome outcome = store.runAtomicBatch(ops);
            log.debug("txn.once operation={} outcome={}", operation, outcome);
            if (outcome == BatchOutcome.APPLIED) {
                span.attempt(0, ops.size(), AttemptOutcome.APPLIED);
                span.committed(1);
            } else {
                span.attempt(0, ops.size(), AttemptOutcome.ASSERT_FAILED);
                metricsService.incrementAborted(operation);
            }
            return outcome;
        }
    }

    public TxnConfig getConfig() {
        return config;
    }

    private void finish(String operation, int attempts, long startNanos, TxnSpan span) {
        metricsService.recordTransaction(operation, attempts, Duration.ofNanos(System.nanoTime() - startNanos));
        span.committed(attempts);
    }

    private void pause(String operation, int attempt, int maxAttempts) {
        if (config.retryDelayMs() == 0 || attempt + 1 >= maxAttempts) {
            return;
        }
        try {
            Thread.sleep(ThreadLocalRandom.current().nextLong(config.retryDelayMs() + 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StateException("Interrupted while retrying " + operation, e);
        }
    }
}

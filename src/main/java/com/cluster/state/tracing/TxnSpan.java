package com.cluster.state.tracing;

/**
 * Trace of one transaction run, covering every attempt the runner makes.
 * Closing the span ends it, so runs are traced in try-with-resources blocks:
 *
 * <pre>
 * try (TxnSpan span = tracingService.startTransaction("destroy unit a/0", 3)) {
 *     span.attempt(0, ops.size(), AttemptOutcome.ASSERT_FAILED);
 *     span.attempt(1, ops.size(), AttemptOutcome.APPLIED);
 *     span.committed(2);
 * }
 * </pre>
 */
public interface TxnSpan extends AutoCloseable {

    /**
     * Records one attempt.
     *
     * @param attempt zero-based attempt number
     * @param opCount ops submitted in the batch, 0 when nothing was submitted
     */
    void attempt(int attempt, int opCount, AttemptOutcome outcome);

    /** The run finished after {@code attempts} attempts, applied or with nothing to do. */
    void committed(int attempts);

    /** Every attempt was aborted or transient. */
    void contended(int attempts);

    /** The builder or the store threw. */
    void failed(Throwable error);

    @Override
    void close();
}

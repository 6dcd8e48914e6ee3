package com.cluster.state.txn;

/**
 * Retry configuration for the transaction runner.
 *
 * @param maxAttempts         attempts allowed per transaction before giving up with contention
 * @param retryDelayMs        upper bound of the jittered pause between attempts; 0 disables pausing
 * @param sequenceMaxAttempts attempts allowed when allocating ids from a sequence
 */
public record TxnConfig(int maxAttempts, long retryDelayMs, int sequenceMaxAttempts) {

    public TxnConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (retryDelayMs < 0) {
            throw new IllegalArgumentException("retryDelayMs must be >= 0");
        }
        if (sequenceMaxAttempts <= 0) {
            throw new IllegalArgumentException("sequenceMaxAttempts must be > 0");
        }
    }

    /**
     * Default configuration: 3 attempts, no pause, 100 attempts for id allocation.
     */
    public static TxnConfig defaults() {
        return new TxnConfig(3, 0, 100);
    }

    public TxnConfig withMaxAttempts(int maxAttempts) {
        return new TxnConfig(maxAttempts, retryDelayMs, sequenceMaxAttempts);
    }

    public TxnConfig withRetryDelayMs(long retryDelayMs) {
        return new TxnConfig(maxAttempts, retryDelayMs, sequenceMaxAttempts);
    }
}

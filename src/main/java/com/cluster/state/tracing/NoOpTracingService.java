package com.cluster.state.tracing;

/**
 * Does nothing. Every run shares one inert span.
 */
public class NoOpTracingService implements TracingService {

    static final TxnSpan NO_OP_SPAN = new TxnSpan() {
        @Override
        public void attempt(int attempt, int opCount, AttemptOutcome outcome) {
        }

        @Override
        public void committed(int attempts) {
        }

        @Override
        public void contended(int attempts) {
        }

        @Override
        public void failed(Throwable error) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public TxnSpan startTransaction(String operation, int maxAttempts) {
        return NO_OP_SPAN;
    }
}

package com.cluster.state.txn;

import com.cluster.state.store.TxnOp;

import java.util.List;

/**
 * Builds the operations for one transaction attempt.
 *
 * <p>Implementations must read every piece of state they depend on inside
 * {@link #build(int)}; the runner calls it again after each aborted attempt
 * and expects the ops to reflect the current state. Returning an empty list
 * means there is nothing left to do. Throwing {@link TransientFailureException}
 * requests another attempt without submitting anything; any other exception
 * ends the run.</p>
 */
@FunctionalInterface
public interface TransactionSource {

    /**
     * @param attempt zero-based attempt number
     * @return the ops to submit atomically, or an empty list when no work remains
     */
    List<TxnOp> build(int attempt);
}

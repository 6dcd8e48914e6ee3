package com.cluster.state.txn;

import com.cluster.state.errors.StateException;

/**
 * Thrown by a {@link TransactionSource} when the state it read looked
 * momentarily inconsistent. The runner retries without submitting.
 */
public class TransientFailureException extends StateException {

    public TransientFailureException(String message) {
        super(message);
    }
}

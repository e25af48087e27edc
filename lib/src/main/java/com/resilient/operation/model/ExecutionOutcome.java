package com.resilient.operation.model;

import com.resilient.operation.exception.ResilientOperationException.CircuitOpenException;
import com.resilient.operation.exception.ResilientOperationException.MaxAttemptsExceededException;
import com.resilient.operation.exception.ResilientOperationException.MissingResultException;
import com.resilient.operation.exception.ResilientOperationException.OperationCanceledException;

/**
 * How an execution of a resilient operation terminated.
 */
public enum ExecutionOutcome {
    
    VALUE("value"),
    FAULT("fault"),
    CIRCUIT_OPEN("circuit_open"),
    EXHAUSTED("exhausted"),
    CANCELED("canceled"),
    MISSING_RESULT("missing_result");
    
    private final String tag;
    
    ExecutionOutcome(String tag) {
        this.tag = tag;
    }
    
    /**
     * Value used when tagging metrics.
     */
    public String getTag() {
        return tag;
    }
    
    public static ExecutionOutcome of(Throwable failure) {
        if (failure == null) {
            return VALUE;
        }
        if (failure instanceof CircuitOpenException) {
            return CIRCUIT_OPEN;
        }
        if (failure instanceof MaxAttemptsExceededException) {
            return EXHAUSTED;
        }
        if (failure instanceof OperationCanceledException) {
            return CANCELED;
        }
        if (failure instanceof MissingResultException) {
            return MISSING_RESULT;
        }
        return FAULT;
    }
}

package com.resilient.operation;

import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import com.resilient.operation.handler.Verdict;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-execution state handed to a {@link com.resilient.operation.handler.ResilientHandler}
 * after each attempt. Read-only; a handler communicates its decision by returning one
 * of the verdicts built here.
 *
 * @param <T> result type of the operation
 */
public interface ResilientOperationContext<T> {
    
    /**
     * Attempts made so far, including the one that just completed. Starts at 1.
     */
    int getCurrentAttempt();
    
    int getMaxAttempts();
    
    /**
     * True when a retry requested now would exceed the attempt limit.
     */
    default boolean isLastAttempt() {
        return getCurrentAttempt() >= getMaxAttempts();
    }
    
    String getOperationKey();
    
    /**
     * The breaker gating this operation; empty when circuit breaking is disabled.
     */
    Optional<CircuitBreaker> getCircuitBreaker();
    
    CancellationSignal getCancellation();
    
    /**
     * Fault of the attempt that just completed; empty if it succeeded.
     */
    Optional<Throwable> getFault();
    
    /**
     * Value of the most recent successful attempt of this execution, or {@code null}.
     */
    T getResult();
    
    /**
     * Whether any attempt of this execution has succeeded.
     */
    boolean hasResult();
    
    /**
     * How many times the handler now running has been invoked during this execution,
     * including the current invocation.
     */
    int getHandlerInvocations();
    
    /**
     * Time since the execution started.
     */
    Duration getElapsed();
    
    default Verdict<T> proceed() {
        return Verdict.proceed();
    }
    
    default Verdict<T> retry() {
        return Verdict.retry();
    }
    
    default Verdict<T> retryAfter(Duration delay) {
        return Verdict.retryAfter(delay);
    }
    
    default Verdict<T> breakOperation() {
        return Verdict.breakOperation();
    }
    
    default Verdict<T> returnValue(T value) {
        return Verdict.returnValue(value);
    }
}

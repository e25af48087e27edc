package com.resilient.operation;

import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of work wrapped with retries and circuit breaking. Built once by a
 * {@link ResilientOperationBuilder} and executed any number of times; every
 * execution gets its own attempt counter while sharing the operation's breaker.
 * <p>
 * An execution ends with exactly one of:
 * <ul>
 *   <li>a value;</li>
 *   <li>{@link com.resilient.operation.exception.ResilientOperationException.CircuitOpenException};</li>
 *   <li>{@link com.resilient.operation.exception.ResilientOperationException.MaxAttemptsExceededException};</li>
 *   <li>{@link com.resilient.operation.exception.ResilientOperationException.OperationCanceledException};</li>
 *   <li>the original fault of the last attempt, unchanged.</li>
 * </ul>
 *
 * @param <T> result type; {@code Void} for work that produces no value
 */
public interface ResilientOperation<T> {
    
    /**
     * Execute without external cancellation. Cancelling the returned future cancels the execution.
     */
    default CompletableFuture<T> executeAsync() {
        return executeAsync(CancellationSignal.none());
    }
    
    /**
     * Execute asynchronously. The returned future completes exceptionally with the
     * original fault, not a wrapper, when the operation surfaces one.
     */
    CompletableFuture<T> executeAsync(CancellationSignal cancellation);
    
    /**
     * Execute and block until the operation terminates.
     *
     * @throws Exception the original fault, or one of the engine's own exceptions
     */
    default T execute() throws Exception {
        return execute(CancellationSignal.none());
    }
    
    T execute(CancellationSignal cancellation) throws Exception;
    
    /**
     * Lazily execute once per subscription. Cancelling the subscription cancels the execution.
     */
    Mono<T> executeMono();
    
    String getOperationKey();
    
    /**
     * The breaker shared by executions of this operation; empty when circuit breaking is disabled.
     */
    Optional<CircuitBreaker> getCircuitBreaker();
}

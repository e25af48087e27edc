package com.resilient.operation.impl;

import com.resilient.operation.ResilientOperationContext;
import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import com.resilient.operation.handler.HandlerRegistration;

import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state of one execution. Owned by a single execution loop; attempts are
 * sequential, so updates happen-before the next attempt through future completion
 * and need no locking.
 */
class DefaultResilientOperationContext<T> implements ResilientOperationContext<T> {
    
    private final String operationKey;
    private final int maxAttempts;
    private final CircuitBreaker circuitBreaker;
    private final CancellationSignal cancellation;
    private final long startNanos;
    private final Map<HandlerRegistration<T>, Integer> handlerInvocations = new IdentityHashMap<>();
    
    private int currentAttempt;
    private Throwable fault;
    private Throwable lastFault;
    private T result;
    private boolean hasResult;
    private HandlerRegistration<T> activeHandler;
    private CircuitBreaker.Permission permission;
    
    DefaultResilientOperationContext(String operationKey, int maxAttempts, CircuitBreaker circuitBreaker,
                                     CancellationSignal cancellation) {
        this.operationKey = operationKey;
        this.maxAttempts = maxAttempts;
        this.circuitBreaker = circuitBreaker;
        this.cancellation = cancellation;
        this.startNanos = System.nanoTime();
    }
    
    int beginAttempt() {
        activeHandler = null;
        return ++currentAttempt;
    }
    
    /**
     * Breaker permission held by the current attempt; {@code null} without a breaker.
     */
    void setPermission(CircuitBreaker.Permission attemptPermission) {
        permission = attemptPermission;
    }
    
    CircuitBreaker.Permission getPermission() {
        return permission;
    }
    
    void recordSuccess(T value) {
        fault = null;
        result = value;
        hasResult = true;
    }
    
    void recordFault(Throwable attemptFault) {
        fault = attemptFault;
        lastFault = attemptFault;
    }
    
    void enterHandler(HandlerRegistration<T> registration) {
        activeHandler = registration;
        handlerInvocations.merge(registration, 1, Integer::sum);
    }
    
    /**
     * The most recent fault of any attempt in this execution.
     */
    Throwable getLastFault() {
        return lastFault;
    }
    
    @Override
    public int getCurrentAttempt() {
        return currentAttempt;
    }
    
    @Override
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    @Override
    public String getOperationKey() {
        return operationKey;
    }
    
    @Override
    public Optional<CircuitBreaker> getCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }
    
    @Override
    public CancellationSignal getCancellation() {
        return cancellation;
    }
    
    @Override
    public Optional<Throwable> getFault() {
        return Optional.ofNullable(fault);
    }
    
    @Override
    public T getResult() {
        return result;
    }
    
    @Override
    public boolean hasResult() {
        return hasResult;
    }
    
    @Override
    public int getHandlerInvocations() {
        return activeHandler == null ? 0 : handlerInvocations.getOrDefault(activeHandler, 0);
    }
    
    @Override
    public Duration getElapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
    
    @Override
    public String toString() {
        return String.format("ResilientOperationContext{key='%s', attempt=%d/%d, fault=%s}",
            operationKey, currentAttempt, maxAttempts, fault);
    }
}

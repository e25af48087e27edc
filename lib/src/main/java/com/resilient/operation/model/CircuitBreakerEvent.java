package com.resilient.operation.model;

import java.time.Instant;

/**
 * State transition of a circuit breaker.
 *
 * @param operationKey the operation identity the breaker guards
 * @param fromState state before the transition
 * @param toState state after the transition
 * @param timestamp when the transition happened, according to the breaker's clock
 */
public record CircuitBreakerEvent(
    String operationKey,
    CircuitBreakerState fromState,
    CircuitBreakerState toState,
    Instant timestamp
) {
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerEvent{key='%s', %s -> %s, at=%s}",
            operationKey, fromState, toState, timestamp);
    }
}

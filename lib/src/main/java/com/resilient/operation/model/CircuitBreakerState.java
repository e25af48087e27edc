package com.resilient.operation.model;

/**
 * Circuit breaker state for a logical operation.
 */
public enum CircuitBreakerState {
    
    /**
     * Circuit breaker is closed - attempts are allowed through.
     */
    CLOSED,
    
    /**
     * Circuit breaker is open - attempts are rejected until the open duration elapses.
     */
    OPEN,
    
    /**
     * Circuit breaker is half-open - a single probe attempt is allowed to test recovery.
     */
    HALF_OPEN
}

package com.resilient.operation.exception;

import com.resilient.operation.model.CircuitBreakerState;

/**
 * Base exception for failures raised by the resilient execution engine itself.
 * Faults produced by the wrapped work are never wrapped in this type; they are
 * surfaced unchanged.
 */
public class ResilientOperationException extends RuntimeException {
    
    public ResilientOperationException(String message) {
        super(message);
    }
    
    public ResilientOperationException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Thrown when an attempt is rejected because the operation's circuit breaker is open,
     * or half-open with a probe already in flight. No attempt was made.
     */
    public static class CircuitOpenException extends ResilientOperationException {
        
        private final String operationKey;
        private final CircuitBreakerState state;
        
        public CircuitOpenException(String operationKey, CircuitBreakerState state) {
            super(String.format("Circuit breaker for operation '%s' is %s; attempt rejected",
                               operationKey, state));
            this.operationKey = operationKey;
            this.state = state;
        }
        
        public String getOperationKey() {
            return operationKey;
        }
        
        public CircuitBreakerState getState() {
            return state;
        }
    }
    
    /**
     * Thrown when a retry was requested after the attempt limit had been reached.
     * The cause is the fault of the last attempt, if that attempt faulted.
     */
    public static class MaxAttemptsExceededException extends ResilientOperationException {
        
        private final int attempts;
        
        public MaxAttemptsExceededException(String operationKey, int attempts, Throwable lastFault) {
            super(String.format("Operation '%s' exhausted %d attempt(s)%s", operationKey, attempts,
                               lastFault == null ? " without a fault" : ": " + lastFault.getMessage()),
                  lastFault);
            this.attempts = attempts;
        }
        
        public int getAttempts() {
            return attempts;
        }
    }
    
    /**
     * Thrown when cancellation is observed while waiting between attempts or by the
     * wrapped work. No result is produced.
     */
    public static class OperationCanceledException extends ResilientOperationException {
        
        public OperationCanceledException(String message) {
            super(message);
        }
        
        public OperationCanceledException(String message, Throwable cause) {
            super(message, cause);
        }
    }
    
    /**
     * Thrown when a handler breaks an operation that never produced a value and
     * was not given one to return.
     */
    public static class MissingResultException extends ResilientOperationException {
        
        public MissingResultException(String operationKey, int attempts) {
            super(String.format("Operation '%s' was broken after %d attempt(s) with no result to return",
                               operationKey, attempts));
        }
    }
}

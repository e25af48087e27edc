package com.resilient.operation.handler;

import com.resilient.operation.ResilientOperationContext;

/**
 * Caller-supplied decision logic invoked after a completed attempt it applies to.
 * Returning {@code null} is the same as returning {@link Verdict#proceed()}.
 * An exception thrown by a handler terminates the operation with that exception.
 *
 * @param <T> result type of the operation
 */
@FunctionalInterface
public interface ResilientHandler<T> {
    
    Verdict<T> handle(ResilientOperationContext<T> context) throws Exception;
    
    /**
     * Handler that retries until the attempt limit is reached.
     */
    static <T> ResilientHandler<T> alwaysRetry() {
        return context -> context.retry();
    }
}

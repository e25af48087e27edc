package com.resilient.operation.wait;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Suspends an operation between attempts. A waiter is bound to one cancellation
 * signal and is created fresh for every delay.
 */
@FunctionalInterface
public interface Waiter {
    
    /**
     * Returns a future that completes normally once {@code delay} has elapsed, or
     * exceptionally with an
     * {@link com.resilient.operation.exception.ResilientOperationException.OperationCanceledException}
     * as soon as the bound signal is cancelled, whichever happens first.
     */
    CompletableFuture<Void> waitFor(Duration delay);
}

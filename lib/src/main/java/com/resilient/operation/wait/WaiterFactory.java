package com.resilient.operation.wait;

import com.resilient.operation.cancel.CancellationSignal;

/**
 * Produces a {@link Waiter} bound to a cancellation signal. Swapped out in tests
 * to replace real timers with deterministic doubles.
 */
@FunctionalInterface
public interface WaiterFactory {
    
    Waiter create(CancellationSignal cancellation);
    
    /**
     * The timer-backed factory used unless another one is configured.
     */
    static WaiterFactory scheduled() {
        return ScheduledWaiter::new;
    }
}

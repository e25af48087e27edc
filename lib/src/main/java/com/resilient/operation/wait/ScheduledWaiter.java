package com.resilient.operation.wait;

import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.exception.ResilientOperationException.OperationCanceledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Waiter backed by {@link CompletableFuture#delayedExecutor}; never blocks a thread
 * while waiting.
 */
public class ScheduledWaiter implements Waiter {
    
    private static final Logger logger = LoggerFactory.getLogger(ScheduledWaiter.class);
    
    private final CancellationSignal cancellation;
    
    public ScheduledWaiter(CancellationSignal cancellation) {
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation must not be null");
    }
    
    @Override
    public CompletableFuture<Void> waitFor(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        CompletableFuture<Void> elapsed = new CompletableFuture<>();
        
        if (cancellation.isCancelled()) {
            elapsed.completeExceptionally(new OperationCanceledException("Canceled before waiting"));
            return elapsed;
        }
        if (delay.isZero() || delay.isNegative()) {
            elapsed.complete(null);
            return elapsed;
        }
        
        Disposable registration = cancellation.onCancel(() -> {
            if (elapsed.completeExceptionally(new OperationCanceledException("Canceled while waiting " + delay))) {
                logger.debug("Wait of {} interrupted by cancellation", delay);
            }
        });
        // Released before completing so whoever resumes on the wait sees it gone
        Executor timer = CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS);
        CompletableFuture.runAsync(() -> {
            registration.dispose();
            elapsed.complete(null);
        }, timer);
        return elapsed;
    }
}

package com.resilient.operation.wait;

import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.exception.ResilientOperationException.OperationCanceledException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledWaiterTest {
    
    @Test
    void completesAfterDelay() throws Exception {
        Waiter waiter = WaiterFactory.scheduled().create(CancellationSignal.none());
        long start = System.nanoTime();
        
        waiter.waitFor(Duration.ofMillis(50)).get(5, TimeUnit.SECONDS);
        
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 45);
    }
    
    @Test
    void zeroDelayCompletesImmediately() {
        Waiter waiter = new ScheduledWaiter(CancellationSignal.create());
        
        assertTrue(waiter.waitFor(Duration.ZERO).isDone());
        assertTrue(waiter.waitFor(Duration.ofMillis(-5)).isDone());
    }
    
    @Test
    void cancellationEndsWaitEarly() {
        CancellationSignal signal = CancellationSignal.create();
        Waiter waiter = new ScheduledWaiter(signal);
        
        CompletableFuture<Void> elapsed = waiter.waitFor(Duration.ofHours(1));
        assertFalse(elapsed.isDone());
        signal.cancel();
        
        ExecutionException exception = assertThrows(ExecutionException.class, () -> elapsed.get(1, TimeUnit.SECONDS));
        assertInstanceOf(OperationCanceledException.class, exception.getCause());
    }
    
    @Test
    void alreadyCancelledSignalFailsWithoutWaiting() {
        CancellationSignal signal = CancellationSignal.create();
        signal.cancel();
        
        CompletableFuture<Void> elapsed = new ScheduledWaiter(signal).waitFor(Duration.ofHours(1));
        
        assertTrue(elapsed.isCompletedExceptionally());
    }
    
    @Test
    void cancellingAfterElapsedHasNoEffect() throws Exception {
        CancellationSignal signal = CancellationSignal.create();
        CompletableFuture<Void> elapsed = new ScheduledWaiter(signal).waitFor(Duration.ofMillis(10));
        elapsed.get(5, TimeUnit.SECONDS);
        assertEquals(0, signal.getPendingCallbackCount());
        
        signal.cancel();
        
        assertFalse(elapsed.isCompletedExceptionally());
    }
}

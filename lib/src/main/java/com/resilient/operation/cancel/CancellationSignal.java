package com.resilient.operation.cancel;

import com.resilient.operation.exception.ResilientOperationException.OperationCanceledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller, the execution loop,
 * the waiter and the wrapped work. Once cancelled it stays cancelled.
 * <p>
 * Callbacks are held only until they run or their registration is disposed, so a
 * long-lived signal shared by many executions does not accumulate them.
 */
public final class CancellationSignal {
    
    private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);
    
    private static final CancellationSignal NONE = new CancellationSignal();
    
    private final CompletableFuture<Void> cancelled = new CompletableFuture<>();
    private final Set<Registration> registrations = ConcurrentHashMap.newKeySet();
    
    private CancellationSignal() {
    }
    
    /**
     * Creates a new signal that can be cancelled.
     */
    public static CancellationSignal create() {
        return new CancellationSignal();
    }
    
    /**
     * Returns a signal that is never cancelled. Calling {@link #cancel()} on it has no effect.
     */
    public static CancellationSignal none() {
        return NONE;
    }
    
    /**
     * Signals cancellation and runs every registered callback. Idempotent.
     *
     * @return true if this call moved the signal to the cancelled state
     */
    public boolean cancel() {
        if (this == NONE || !cancelled.complete(null)) {
            return false;
        }
        for (Registration registration : registrations) {
            registration.fire();
        }
        return true;
    }
    
    public boolean isCancelled() {
        return cancelled.isDone();
    }
    
    /**
     * Registers a callback to run when the signal is cancelled. Runs immediately,
     * on the calling thread, if the signal is already cancelled.
     *
     * @return Disposable that removes the callback if it has not run yet
     */
    public Disposable onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        if (this == NONE) {
            return Disposables.disposed();
        }
        Registration registration = new Registration(callback);
        registrations.add(registration);
        // cancel() may have finished iterating before the add
        if (isCancelled()) {
            registration.fire();
        }
        return registration;
    }
    
    /**
     * Number of callbacks still waiting for cancellation.
     */
    public int getPendingCallbackCount() {
        return registrations.size();
    }
    
    /**
     * @throws OperationCanceledException if the signal has been cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCanceledException("Operation was canceled");
        }
    }
    
    /**
     * Stage that completes when the signal is cancelled.
     */
    public CompletionStage<Void> asStage() {
        return cancelled.minimalCompletionStage();
    }
    
    @Override
    public String toString() {
        return this == NONE ? "CancellationSignal[none]" : "CancellationSignal[cancelled=" + isCancelled() + "]";
    }
    
    private final class Registration implements Disposable {
        
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean();
        
        Registration(Runnable callback) {
            this.callback = callback;
        }
        
        void fire() {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            registrations.remove(this);
            try {
                callback.run();
            } catch (RuntimeException e) {
                logger.warn("Cancellation callback failed", e);
            }
        }
        
        @Override
        public void dispose() {
            if (done.compareAndSet(false, true)) {
                registrations.remove(this);
            }
        }
        
        @Override
        public boolean isDisposed() {
            return done.get();
        }
    }
}

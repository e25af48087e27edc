package com.resilient.operation.function;

import com.resilient.operation.cancel.CancellationSignal;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Normalized unit of work invoked once per attempt. Every supported callable shape
 * is adapted into this single cancellation-aware, value-producing form.
 * <p>
 * Invocations never throw: a fault raised by the wrapped work, synchronously or
 * asynchronously, completes the returned future exceptionally with that fault.
 *
 * @param <T> result type; {@code Void} for work that produces no value
 */
@FunctionalInterface
public interface CanonicalAction<T> {
    
    CompletableFuture<T> invoke(CancellationSignal cancellation);
    
    /**
     * The canonicalization routine every other factory funnels into.
     */
    static <T> CanonicalAction<T> canonicalize(CancellableAsyncSupplier<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        return cancellation -> {
            try {
                CompletionStage<T> stage = work.get(cancellation);
                if (stage == null) {
                    return CompletableFuture.failedFuture(
                        new NullPointerException("Asynchronous work returned a null stage"));
                }
                // Copy so callers completing the returned future cannot touch the work's own future
                return stage.toCompletableFuture().thenApply(value -> value);
            } catch (Throwable t) {
                return CompletableFuture.failedFuture(t);
            }
        };
    }
    
    static CanonicalAction<Void> fromCancellableRunnable(CancellableAsyncRunnable work) {
        Objects.requireNonNull(work, "work must not be null");
        return CanonicalAction.<Void>canonicalize(cancellation -> discardValue(work.run(cancellation)));
    }
    
    static <T> CanonicalAction<T> fromAsync(AsyncSupplier<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        return canonicalize(cancellation -> work.get());
    }
    
    static CanonicalAction<Void> fromAsyncRunnable(AsyncRunnable work) {
        Objects.requireNonNull(work, "work must not be null");
        return CanonicalAction.<Void>canonicalize(cancellation -> discardValue(work.run()));
    }
    
    static <T> CanonicalAction<T> fromSupplier(CheckedSupplier<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        return canonicalize(cancellation -> completed(work));
    }
    
    static CanonicalAction<Void> fromRunnable(CheckedRunnable work) {
        Objects.requireNonNull(work, "work must not be null");
        return canonicalize(cancellation -> completed(() -> {
            work.run();
            return null;
        }));
    }
    
    /**
     * Adapts a Reactor {@link Mono} factory. A fresh Mono is requested for every attempt;
     * cancellation cancels the subscription of the attempt in flight.
     */
    static <T> CanonicalAction<T> fromMono(Supplier<Mono<T>> work) {
        Objects.requireNonNull(work, "work must not be null");
        return canonicalize(cancellation -> {
            CompletableFuture<T> future = work.get().toFuture();
            Disposable registration = cancellation.onCancel(() -> future.cancel(true));
            future.whenComplete((value, error) -> registration.dispose());
            return future;
        });
    }
    
    private static CompletionStage<Void> discardValue(CompletionStage<?> stage) {
        return stage == null ? null : stage.thenApply(ignored -> null);
    }
    
    private static <T> CompletionStage<T> completed(CheckedSupplier<T> work) {
        try {
            return CompletableFuture.completedFuture(work.get());
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}

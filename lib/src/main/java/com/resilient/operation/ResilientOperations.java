package com.resilient.operation;

import com.resilient.operation.function.AsyncRunnable;
import com.resilient.operation.function.AsyncSupplier;
import com.resilient.operation.function.CancellableAsyncRunnable;
import com.resilient.operation.function.CancellableAsyncSupplier;
import com.resilient.operation.function.CanonicalAction;
import com.resilient.operation.function.CheckedRunnable;
import com.resilient.operation.function.CheckedSupplier;
import com.resilient.operation.wait.WaiterFactory;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Entry points for making existing work resilient. Each method accepts one callable
 * shape, normalizes it and returns a builder for configuring retries and circuit
 * breaking. Unless a key is given explicitly, the operation key is taken from the
 * line the entry point is called from.
 *
 * <pre>
 * String body = ResilientOperations.of(() -&gt; client.fetch(url))
 *     .whenExceptionIs(IOException.class, context -&gt; context.retry())
 *     .maxAttempts(4)
 *     .execute();
 * </pre>
 */
public final class ResilientOperations {
    
    private static volatile WaiterFactory defaultWaiterFactory = WaiterFactory.scheduled();
    
    private ResilientOperations() {
    }
    
    /**
     * Synchronous work returning a value.
     */
    public static <T> ResilientOperationBuilder<T> of(CheckedSupplier<T> work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromSupplier(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Synchronous work returning nothing.
     */
    public static ResilientOperationBuilder<Void> ofRunnable(CheckedRunnable work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromRunnable(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Asynchronous work returning a value.
     */
    public static <T> ResilientOperationBuilder<T> ofAsync(AsyncSupplier<T> work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromAsync(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Asynchronous work whose completion value is ignored.
     */
    public static ResilientOperationBuilder<Void> ofAsyncRunnable(AsyncRunnable work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromAsyncRunnable(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Asynchronous, cancellation-aware work returning a value.
     */
    public static <T> ResilientOperationBuilder<T> ofCancellable(CancellableAsyncSupplier<T> work) {
        return new ResilientOperationBuilder<>(CanonicalAction.canonicalize(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Asynchronous, cancellation-aware work whose completion value is ignored.
     */
    public static ResilientOperationBuilder<Void> ofCancellableRunnable(CancellableAsyncRunnable work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromCancellableRunnable(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Reactive work; a fresh {@link Mono} is requested for every attempt.
     */
    public static <T> ResilientOperationBuilder<T> ofMono(Supplier<Mono<T>> work) {
        return new ResilientOperationBuilder<>(CanonicalAction.fromMono(work), OperationKeys.fromCallSite());
    }
    
    /**
     * Process-wide waiter factory used by operations that were not given one.
     */
    public static WaiterFactory getDefaultWaiterFactory() {
        return defaultWaiterFactory;
    }
    
    /**
     * Replace the process-wide waiter factory, typically with a deterministic test double.
     * Prefer {@link ResilientOperationBuilder#waiterFactory(WaiterFactory)} for a single operation.
     */
    public static void setDefaultWaiterFactory(WaiterFactory waiterFactory) {
        defaultWaiterFactory = Objects.requireNonNull(waiterFactory, "waiterFactory must not be null");
    }
    
    public static void resetDefaultWaiterFactory() {
        defaultWaiterFactory = WaiterFactory.scheduled();
    }
}

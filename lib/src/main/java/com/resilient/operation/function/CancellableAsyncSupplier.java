package com.resilient.operation.function;

import com.resilient.operation.cancel.CancellationSignal;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous work that produces a value and observes a cancellation signal.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CancellableAsyncSupplier<T> {
    CompletionStage<T> get(CancellationSignal cancellation);
}

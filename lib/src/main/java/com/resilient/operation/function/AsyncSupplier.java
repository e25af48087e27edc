package com.resilient.operation.function;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous work that produces a value.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface AsyncSupplier<T> {
    CompletionStage<T> get();
}

package com.resilient.operation.function;

/**
 * Synchronous work that produces a value and may throw a checked exception.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface CheckedSupplier<T> {
    T get() throws Exception;
}

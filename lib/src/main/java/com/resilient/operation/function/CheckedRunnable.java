package com.resilient.operation.function;

/**
 * Synchronous work that produces no value and may throw a checked exception.
 */
@FunctionalInterface
public interface CheckedRunnable {
    void run() throws Exception;
}

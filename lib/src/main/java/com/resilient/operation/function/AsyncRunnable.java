package com.resilient.operation.function;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous work whose completion value, if any, is ignored.
 */
@FunctionalInterface
public interface AsyncRunnable {
    CompletionStage<?> run();
}

package com.resilient.operation.function;

import com.resilient.operation.cancel.CancellationSignal;

import java.util.concurrent.CompletionStage;

/**
 * Asynchronous work that observes a cancellation signal and whose completion value is ignored.
 */
@FunctionalInterface
public interface CancellableAsyncRunnable {
    CompletionStage<?> run(CancellationSignal cancellation);
}

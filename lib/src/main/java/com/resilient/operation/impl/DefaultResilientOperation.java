package com.resilient.operation.impl;

import com.resilient.operation.ResilientOperation;
import com.resilient.operation.ResilientOperations;
import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import com.resilient.operation.exception.ResilientOperationException.CircuitOpenException;
import com.resilient.operation.exception.ResilientOperationException.MaxAttemptsExceededException;
import com.resilient.operation.exception.ResilientOperationException.MissingResultException;
import com.resilient.operation.exception.ResilientOperationException.OperationCanceledException;
import com.resilient.operation.function.CanonicalAction;
import com.resilient.operation.handler.HandlerRegistration;
import com.resilient.operation.handler.Verdict;
import com.resilient.operation.model.ExecutionOutcome;
import com.resilient.operation.observability.OperationMetrics;
import com.resilient.operation.wait.Waiter;
import com.resilient.operation.wait.WaiterFactory;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Default execution loop. Each execution runs Gate, Invoke, Evaluate and Branch for
 * every attempt, waiting between attempts when the handler asks for a retry.
 * <p>
 * Attempts of one execution never overlap. No thread is blocked while an attempt or a
 * wait is pending, and attempts that complete synchronously run in a loop rather than
 * nesting, so any number of immediate retries keeps the stack flat.
 *
 * @param <T> result type
 */
public class DefaultResilientOperation<T> implements ResilientOperation<T> {
    
    private static final Logger logger = LoggerFactory.getLogger(DefaultResilientOperation.class);
    
    private final String operationKey;
    private final CanonicalAction<T> action;
    private final List<HandlerRegistration<T>> handlers;
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final CircuitBreaker circuitBreaker;
    private final WaiterFactory waiterFactory;
    private final OperationMetrics metrics;
    
    /**
     * @param handlers registrations in priority order; the first one applying to an attempt handles it
     * @param circuitBreaker the breaker gating attempts, or {@code null} to disable circuit breaking
     * @param waiterFactory waiter factory, or {@code null} for the process-wide default at execution time
     * @param metrics metrics sink, or {@code null}
     */
    public DefaultResilientOperation(String operationKey,
                                     CanonicalAction<T> action,
                                     List<HandlerRegistration<T>> handlers,
                                     int maxAttempts,
                                     IntervalFunction backoff,
                                     CircuitBreaker circuitBreaker,
                                     WaiterFactory waiterFactory,
                                     OperationMetrics metrics) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.operationKey = Objects.requireNonNull(operationKey, "operationKey must not be null");
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.handlers = List.copyOf(handlers);
        this.maxAttempts = maxAttempts;
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.circuitBreaker = circuitBreaker;
        this.waiterFactory = waiterFactory;
        this.metrics = metrics;
    }
    
    @Override
    public CompletableFuture<T> executeAsync(CancellationSignal cancellation) {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
        
        // Own signal so cancelling the returned future also reaches the work and the waiter
        CancellationSignal signal = CancellationSignal.create();
        Disposable link = cancellation.onCancel(signal::cancel);
        
        DefaultResilientOperationContext<T> context =
            new DefaultResilientOperationContext<>(operationKey, maxAttempts, circuitBreaker, signal);
        CompletableFuture<T> result = new CompletableFuture<>();
        result.whenComplete((value, failure) -> {
            link.dispose();
            if (result.isCancelled()) {
                signal.cancel();
            }
            recordExecution(context, failure);
        });
        
        run(context, result);
        return result;
    }
    
    @Override
    public T execute(CancellationSignal cancellation) throws Exception {
        CompletableFuture<T> future = executeAsync(cancellation);
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        } catch (CancellationException e) {
            throw new OperationCanceledException("Operation '" + operationKey + "' was canceled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OperationCanceledException("Interrupted while executing operation '" + operationKey + "'", e);
        }
    }
    
    @Override
    public Mono<T> executeMono() {
        return Mono.defer(() -> {
            CancellationSignal signal = CancellationSignal.create();
            return Mono.fromFuture(executeAsync(signal)).doOnCancel(signal::cancel);
        });
    }
    
    @Override
    public String getOperationKey() {
        return operationKey;
    }
    
    @Override
    public Optional<CircuitBreaker> getCircuitBreaker() {
        return Optional.ofNullable(circuitBreaker);
    }
    
    /**
     * Runs attempts until the execution terminates. Attempts and waits that are already
     * complete are continued in this loop; only pending ones resume it from their
     * completion callback, so the stack depth stays constant however many attempts run.
     */
    private void run(DefaultResilientOperationContext<T> context, CompletableFuture<T> result) {
        while (true) {
            CompletableFuture<T> invocation = startAttempt(context, result);
            if (invocation == null) {
                return;
            }
            if (!invocation.isDone()) {
                invocation.whenComplete((value, error) -> {
                    if (afterAttempt(context, result, value, error)) {
                        run(context, result);
                    }
                });
                return;
            }
            
            T value = null;
            Throwable error = null;
            try {
                value = invocation.join();
            } catch (CompletionException | CancellationException e) {
                error = e;
            }
            if (!afterAttempt(context, result, value, error)) {
                return;
            }
        }
    }
    
    /**
     * Gate and Invoke.
     *
     * @return the attempt in flight, or {@code null} if the execution terminated instead
     */
    private CompletableFuture<T> startAttempt(DefaultResilientOperationContext<T> context, CompletableFuture<T> result) {
        CancellationSignal signal = context.getCancellation();
        if (result.isDone()) {
            return null;
        }
        if (signal.isCancelled()) {
            result.completeExceptionally(canceled(null));
            return null;
        }
        
        // Gate
        CircuitBreaker.Permission permission = null;
        if (circuitBreaker != null) {
            permission = circuitBreaker.acquirePermission().orElse(null);
            if (permission == null) {
                logger.warn("Operation {} rejected by open circuit breaker after {} attempt(s)",
                    operationKey, context.getCurrentAttempt());
                result.completeExceptionally(new CircuitOpenException(operationKey, circuitBreaker.getState()));
                return null;
            }
        }
        context.setPermission(permission);
        
        // Invoke
        int attemptNumber = context.beginAttempt();
        logger.debug("Operation {} starting attempt {}/{}", operationKey, attemptNumber, maxAttempts);
        try {
            return action.invoke(signal);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }
    
    /**
     * Evaluate and Branch for a finished attempt, including the wait before a retry.
     *
     * @return true if the next attempt should start on the calling thread
     */
    private boolean afterAttempt(DefaultResilientOperationContext<T> context, CompletableFuture<T> result,
                                 T value, Throwable error) {
        CompletableFuture<Void> wait;
        try {
            wait = evaluate(context, result, value, unwrap(error));
        } catch (Throwable t) {
            result.completeExceptionally(t);
            return false;
        }
        if (wait == null) {
            return false;
        }
        if (!wait.isDone()) {
            wait.whenComplete((ignored, waitError) -> {
                if (afterWait(context, result, waitError)) {
                    run(context, result);
                }
            });
            return false;
        }
        
        Throwable waitError = null;
        try {
            wait.join();
        } catch (CompletionException | CancellationException e) {
            waitError = e;
        }
        return afterWait(context, result, waitError);
    }
    
    private boolean afterWait(DefaultResilientOperationContext<T> context, CompletableFuture<T> result,
                              Throwable error) {
        Throwable failure = unwrap(error);
        if (failure != null) {
            result.completeExceptionally(isCancellation(failure, context.getCancellation())
                ? canceled(failure) : failure);
            return false;
        }
        return true;
    }
    
    /**
     * @return the wait before the next attempt, or {@code null} if the execution terminated
     */
    private CompletableFuture<Void> evaluate(DefaultResilientOperationContext<T> context, CompletableFuture<T> result,
                                             T value, Throwable fault) {
        if (fault != null && isCancellation(fault, context.getCancellation())) {
            // The attempt never completed; give the permission back without an outcome
            if (circuitBreaker != null && context.getPermission() != null) {
                circuitBreaker.releasePermission(context.getPermission());
            }
            result.completeExceptionally(canceled(fault));
            return null;
        }
        
        // Breaker accounting reflects the attempt itself, whatever the handler decides
        if (circuitBreaker != null) {
            if (fault == null) {
                circuitBreaker.onSuccess();
            } else {
                circuitBreaker.onFailure(fault);
            }
        }
        if (metrics != null) {
            metrics.recordAttempt(operationKey, fault == null);
        }
        
        if (result.isDone()) {
            // Cancelled by the caller while the attempt was running
            return null;
        }

        if (fault == null) {
            context.recordSuccess(value);
        } else {
            context.recordFault(fault);
            logger.debug("Operation {} attempt {} failed: {}", operationKey, context.getCurrentAttempt(), fault.toString());
        }
        
        Verdict<T> verdict;
        try {
            verdict = decide(context, value, fault);
        } catch (Throwable handlerFailure) {
            logger.debug("Handler for operation {} threw {}", operationKey, handlerFailure.toString());
            result.completeExceptionally(handlerFailure);
            return null;
        }
        
        return branch(context, result, verdict, value, fault);
    }
    
    private Verdict<T> decide(DefaultResilientOperationContext<T> context, T value, Throwable fault) throws Exception {
        for (HandlerRegistration<T> registration : handlers) {
            if (registration.appliesTo(fault, value)) {
                context.enterHandler(registration);
                Verdict<T> verdict = registration.getHandler().handle(context);
                return verdict == null ? Verdict.proceed() : verdict;
            }
        }
        return Verdict.proceed();
    }
    
    private CompletableFuture<Void> branch(DefaultResilientOperationContext<T> context, CompletableFuture<T> result,
                                           Verdict<T> verdict, T value, Throwable fault) {
        switch (verdict.getKind()) {
            case RETURN -> result.complete(verdict.getValue());
            case BREAK -> {
                if (fault != null) {
                    result.completeExceptionally(fault);
                } else if (context.hasResult()) {
                    result.complete(context.getResult());
                } else {
                    result.completeExceptionally(new MissingResultException(operationKey, context.getCurrentAttempt()));
                }
            }
            case RETRY -> {
                if (context.getCurrentAttempt() < maxAttempts) {
                    return waitBeforeRetry(context, verdict);
                }
                Throwable lastFault = fault != null ? fault : context.getLastFault();
                logger.warn("Operation {} exhausted {} attempt(s)", operationKey, context.getCurrentAttempt());
                result.completeExceptionally(
                    new MaxAttemptsExceededException(operationKey, context.getCurrentAttempt(), lastFault));
            }
            case CONTINUE -> {
                if (fault == null) {
                    result.complete(value);
                } else {
                    result.completeExceptionally(fault);
                }
            }
        }
        return null;
    }
    
    private CompletableFuture<Void> waitBeforeRetry(DefaultResilientOperationContext<T> context, Verdict<T> verdict) {
        Duration delay = verdict.getRetryDelay()
            .orElseGet(() -> Duration.ofMillis(backoff.apply(context.getCurrentAttempt())));
        logger.debug("Operation {} retrying in {} after attempt {}", operationKey, delay, context.getCurrentAttempt());
        
        try {
            Waiter waiter = resolveWaiterFactory().create(context.getCancellation());
            CompletableFuture<Void> elapsed = waiter.waitFor(delay);
            return elapsed != null ? elapsed
                : CompletableFuture.failedFuture(new NullPointerException("Waiter returned a null future"));
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }
    
    private WaiterFactory resolveWaiterFactory() {
        return waiterFactory != null ? waiterFactory : ResilientOperations.getDefaultWaiterFactory();
    }
    
    private void recordExecution(DefaultResilientOperationContext<T> context, Throwable failure) {
        ExecutionOutcome outcome = result(failure);
        logger.debug("Operation {} finished with {} after {} attempt(s)", operationKey, outcome, context.getCurrentAttempt());
        if (metrics != null) {
            metrics.recordExecution(operationKey, outcome, context.getElapsed());
        }
    }
    
    private static ExecutionOutcome result(Throwable failure) {
        if (failure instanceof CancellationException) {
            return ExecutionOutcome.CANCELED;
        }
        return ExecutionOutcome.of(unwrap(failure));
    }
    
    private OperationCanceledException canceled(Throwable cause) {
        if (cause instanceof OperationCanceledException canceled) {
            return canceled;
        }
        String message = "Operation '" + operationKey + "' was canceled";
        return cause == null ? new OperationCanceledException(message) : new OperationCanceledException(message, cause);
    }
    
    private static boolean isCancellation(Throwable failure, CancellationSignal signal) {
        return signal.isCancelled()
            && (failure instanceof OperationCanceledException || failure instanceof CancellationException);
    }
    
    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
               && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}

package com.resilient.operation;

import com.resilient.operation.cancel.CancellationSignal;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import com.resilient.operation.circuitbreaker.CircuitBreakerRegistry;
import com.resilient.operation.config.CircuitBreakerConfig;
import com.resilient.operation.config.ResilienceConfig;
import com.resilient.operation.function.CanonicalAction;
import com.resilient.operation.handler.HandlerRegistration;
import com.resilient.operation.handler.ResilientHandler;
import com.resilient.operation.impl.DefaultResilientOperation;
import com.resilient.operation.observability.OperationMetrics;
import com.resilient.operation.wait.WaiterFactory;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Fluent configuration of a resilient operation. Obtained from one of the
 * {@link ResilientOperations} entry points, which fix the work and the default
 * operation key.
 * <p>
 * Handlers registered with {@link #whenExceptionIs} and {@link #whenResult} are
 * consulted in registration order; the first that applies to an attempt handles it.
 * The catch-all {@link #handler} is consulted last, and only for faulted attempts.
 * A successful attempt no handler applies to produces its value.
 *
 * @param <T> result type
 */
public class ResilientOperationBuilder<T> {
    
    private static final Logger logger = LoggerFactory.getLogger(ResilientOperationBuilder.class);
    
    private final CanonicalAction<T> action;
    private final String callSiteKey;
    private final List<HandlerRegistration<T>> typedHandlers = new ArrayList<>();
    private HandlerRegistration<T> catchAllHandler;
    private ResilienceConfig.Builder config = ResilienceConfig.defaultConfig().toBuilder();
    private String explicitKey;
    private CircuitBreaker circuitBreaker;
    private OperationMetrics metrics;
    
    ResilientOperationBuilder(CanonicalAction<T> action, String callSiteKey) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.callSiteKey = Objects.requireNonNull(callSiteKey, "callSiteKey must not be null");
    }
    
    /**
     * Use an explicit operation key instead of the one derived from the call site.
     * Operations given the same key share one circuit breaker.
     */
    public ResilientOperationBuilder<T> key(String operationKey) {
        Objects.requireNonNull(operationKey, "operationKey must not be null");
        if (operationKey.isBlank()) {
            throw new IllegalArgumentException("operationKey must not be blank");
        }
        this.explicitKey = operationKey;
        return this;
    }
    
    /**
     * Handler consulted after every faulted attempt that no more specific handler applies to.
     */
    public ResilientOperationBuilder<T> handler(ResilientHandler<T> handler) {
        this.catchAllHandler = HandlerRegistration.forAnyFault(handler);
        return this;
    }
    
    /**
     * Handler consulted for attempts that fault with an instance of {@code faultType}.
     */
    public ResilientOperationBuilder<T> whenExceptionIs(Class<? extends Throwable> faultType, ResilientHandler<T> handler) {
        typedHandlers.add(HandlerRegistration.forFault(faultType, handler));
        return this;
    }
    
    /**
     * Handler consulted for successful attempts whose value matches {@code predicate}.
     */
    public ResilientOperationBuilder<T> whenResult(Predicate<? super T> predicate, ResilientHandler<T> handler) {
        typedHandlers.add(HandlerRegistration.forResult(predicate, handler));
        return this;
    }
    
    /**
     * Replace the execution policy. Options set afterwards override the policy's values;
     * options set before this call are discarded.
     */
    public ResilientOperationBuilder<T> config(ResilienceConfig resilienceConfig) {
        this.config = Objects.requireNonNull(resilienceConfig, "resilienceConfig must not be null").toBuilder();
        return this;
    }
    
    public ResilientOperationBuilder<T> maxAttempts(int maxAttempts) {
        config.maxAttempts(maxAttempts);
        return this;
    }
    
    public ResilientOperationBuilder<T> backoff(IntervalFunction backoff) {
        config.backoff(backoff);
        return this;
    }
    
    public ResilientOperationBuilder<T> backoff(Duration fixedDelay) {
        config.fixedBackoff(fixedDelay);
        return this;
    }
    
    /**
     * Use this breaker instead of looking one up by operation key.
     */
    public ResilientOperationBuilder<T> circuitBreaker(CircuitBreaker breaker) {
        this.circuitBreaker = Objects.requireNonNull(breaker, "breaker must not be null");
        config.enableCircuitBreaker(true);
        return this;
    }
    
    /**
     * Config for the breaker if this operation is the first to use its key.
     */
    public ResilientOperationBuilder<T> circuitBreakerConfig(CircuitBreakerConfig breakerConfig) {
        config.circuitBreaker(breakerConfig);
        return this;
    }
    
    public ResilientOperationBuilder<T> circuitBreakerRegistry(CircuitBreakerRegistry registry) {
        config.circuitBreakerRegistry(registry);
        return this;
    }
    
    public ResilientOperationBuilder<T> disableCircuitBreaker() {
        this.circuitBreaker = null;
        config.enableCircuitBreaker(false);
        return this;
    }
    
    public ResilientOperationBuilder<T> waiterFactory(WaiterFactory waiterFactory) {
        config.waiterFactory(Objects.requireNonNull(waiterFactory, "waiterFactory must not be null"));
        return this;
    }
    
    public ResilientOperationBuilder<T> metrics(OperationMetrics operationMetrics) {
        this.metrics = Objects.requireNonNull(operationMetrics, "operationMetrics must not be null");
        return this;
    }
    
    /**
     * The key the built operation will use.
     */
    public String getOperationKey() {
        return explicitKey != null ? explicitKey : callSiteKey;
    }
    
    public ResilientOperation<T> build() {
        ResilienceConfig resolved = config.build();
        String operationKey = getOperationKey();
        
        List<HandlerRegistration<T>> handlers = new ArrayList<>(typedHandlers);
        if (catchAllHandler != null) {
            handlers.add(catchAllHandler);
        }
        
        logger.debug("Building resilient operation {} (maxAttempts={}, handlers={})",
            operationKey, resolved.getMaxAttempts(), handlers.size());
        return new DefaultResilientOperation<>(
            operationKey,
            action,
            handlers,
            resolved.getMaxAttempts(),
            resolved.getBackoff(),
            resolveCircuitBreaker(operationKey, resolved),
            resolved.getWaiterFactory(),
            metrics
        );
    }
    
    public CompletableFuture<T> executeAsync() {
        return build().executeAsync();
    }
    
    public CompletableFuture<T> executeAsync(CancellationSignal cancellation) {
        return build().executeAsync(cancellation);
    }
    
    public T execute() throws Exception {
        return build().execute();
    }
    
    public T execute(CancellationSignal cancellation) throws Exception {
        return build().execute(cancellation);
    }
    
    private CircuitBreaker resolveCircuitBreaker(String operationKey, ResilienceConfig resolved) {
        if (!resolved.isCircuitBreakerEnabled()) {
            return null;
        }
        if (circuitBreaker != null) {
            return circuitBreaker;
        }
        CircuitBreakerRegistry registry = resolved.getCircuitBreakerRegistry();
        CircuitBreakerConfig breakerConfig = resolved.getCircuitBreakerConfig();
        return breakerConfig != null
            ? registry.circuitBreaker(operationKey, breakerConfig)
            : registry.circuitBreaker(operationKey);
    }
}

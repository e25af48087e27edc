package com.resilient.operation.observability;

import com.resilient.operation.circuitbreaker.CircuitBreakerEventPublisher;
import com.resilient.operation.model.CircuitBreakerEvent;
import com.resilient.operation.model.ExecutionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.time.Duration;
import java.util.Objects;

/**
 * Collects metrics for resilient operations: attempts, execution outcomes and
 * latency per operation key, and circuit breaker transitions.
 */
public class OperationMetrics {
    
    private static final Logger logger = LoggerFactory.getLogger(OperationMetrics.class);
    
    public static final String ATTEMPTS = "resilient.operation.attempts";
    public static final String EXECUTIONS = "resilient.operation.executions";
    public static final String LATENCY = "resilient.operation.latency";
    public static final String TRANSITIONS = "resilient.circuit_breaker.transitions";
    
    private final MeterRegistry meterRegistry;
    
    public OperationMetrics() {
        this(new SimpleMeterRegistry());
    }
    
    public OperationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        logger.debug("Operation metrics initialized with {}", meterRegistry.getClass().getSimpleName());
    }
    
    public void recordAttempt(String operationKey, boolean success) {
        Counter.builder(ATTEMPTS)
            .tag("key", operationKey)
            .tag("outcome", success ? "success" : "failure")
            .description("Attempts made by resilient operations")
            .register(meterRegistry)
            .increment();
    }
    
    public void recordExecution(String operationKey, ExecutionOutcome outcome, Duration latency) {
        Counter.builder(EXECUTIONS)
            .tag("key", operationKey)
            .tag("result", outcome.getTag())
            .description("Terminated executions of resilient operations")
            .register(meterRegistry)
            .increment();
        
        Timer.builder(LATENCY)
            .tag("key", operationKey)
            .description("Execution latency including retries and waits")
            .register(meterRegistry)
            .record(latency);
    }
    
    public void recordTransition(CircuitBreakerEvent event) {
        Counter.builder(TRANSITIONS)
            .tag("key", event.operationKey())
            .tag("from", event.fromState().name())
            .tag("to", event.toState().name())
            .description("Circuit breaker state transitions")
            .register(meterRegistry)
            .increment();
    }
    
    /**
     * Records every transition published from now on.
     *
     * @return Disposable to stop recording
     */
    public Disposable bindTo(CircuitBreakerEventPublisher publisher) {
        return publisher.subscribe(this::recordTransition);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}

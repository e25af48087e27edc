package com.resilient.operation.example;

import com.resilient.operation.ResilientOperation;
import com.resilient.operation.ResilientOperations;
import com.resilient.operation.circuitbreaker.CircuitBreakerRegistry;
import com.resilient.operation.config.CircuitBreakerConfig;
import com.resilient.operation.exception.ResilientOperationException.CircuitOpenException;
import com.resilient.operation.exception.ResilientOperationException.MaxAttemptsExceededException;
import com.resilient.operation.observability.OperationMetrics;
import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Simple working example demonstrating retries, fallbacks and circuit breaking
 * around a flaky downstream call.
 */
public class SimpleUsageExample {
    
    private static final Logger logger = LoggerFactory.getLogger(SimpleUsageExample.class);
    
    public static void main(String[] args) throws Exception {
        
        logger.info("Starting resilient operation example");
        
        OperationMetrics metrics = new OperationMetrics();
        Disposable transitions = metrics.bindTo(CircuitBreakerRegistry.getDefault().getEventPublisher());
        
        try {
            demonstrateRetry(metrics);
            demonstrateFallback(metrics);
            demonstrateCircuitBreaking(metrics);
        } finally {
            transitions.dispose();
        }
        
        logger.info("Example completed successfully");
    }
    
    /**
     * A call that fails twice before succeeding is retried with exponential backoff.
     */
    private static void demonstrateRetry(OperationMetrics metrics) throws Exception {
        FlakyService service = new FlakyService(2);
        
        String response = ResilientOperations.of(service::fetch)
            .key("example.fetch")
            .whenExceptionIs(IOException.class, context -> context.retry())
            .maxAttempts(5)
            .backoff(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(50), 2.0))
            .metrics(metrics)
            .execute();
        
        logger.info("Fetched '{}' after {} call(s)", response, service.getCalls());
    }
    
    /**
     * Once retries are used up, the handler substitutes a cached value.
     */
    private static void demonstrateFallback(OperationMetrics metrics) {
        FlakyService service = new FlakyService(Integer.MAX_VALUE);
        
        CompletableFuture<String> response = ResilientOperations.of(service::fetch)
            .key("example.fallback")
            .handler(context -> context.isLastAttempt() ? context.returnValue("cached") : context.retry())
            .maxAttempts(3)
            .backoff(Duration.ofMillis(20))
            .metrics(metrics)
            .executeAsync();
        
        logger.info("Fallback produced '{}'", response.join());
    }
    
    /**
     * Repeated failures open the breaker; later executions are rejected without calling the service.
     */
    private static void demonstrateCircuitBreaking(OperationMetrics metrics) {
        FlakyService service = new FlakyService(Integer.MAX_VALUE);
        
        ResilientOperation<String> operation = ResilientOperations.of(service::fetch)
            .key("example.breaker")
            .circuitBreakerConfig(CircuitBreakerConfig.builder()
                .failureThreshold(3)
                .openDuration(Duration.ofSeconds(10))
                .build())
            .handler(context -> context.retry())
            .maxAttempts(2)
            .backoff(Duration.ofMillis(10))
            .metrics(metrics)
            .build();
        
        for (int i = 0; i < 3; i++) {
            try {
                operation.execute();
            } catch (CircuitOpenException e) {
                logger.info("Execution {} rejected: {}", i + 1, e.getMessage());
            } catch (MaxAttemptsExceededException e) {
                logger.info("Execution {} exhausted retries: {}", i + 1, e.getMessage());
            } catch (Exception e) {
                logger.error("Execution {} failed unexpectedly", i + 1, e);
            }
        }
        
        logger.info("Service was called {} time(s); breaker is {}", service.getCalls(),
            operation.getCircuitBreaker().map(breaker -> breaker.getState().name()).orElse("disabled"));
    }
    
    private static class FlakyService {
        private final int failuresBeforeSuccess;
        private final AtomicInteger calls = new AtomicInteger();
        
        FlakyService(int failuresBeforeSuccess) {
            this.failuresBeforeSuccess = failuresBeforeSuccess;
        }
        
        String fetch() throws IOException {
            int call = calls.incrementAndGet();
            if (call <= failuresBeforeSuccess) {
                throw new IOException("Connection reset (call " + call + ")");
            }
            return "payload-" + call;
        }
        
        int getCalls() {
            return calls.get();
        }
    }
}

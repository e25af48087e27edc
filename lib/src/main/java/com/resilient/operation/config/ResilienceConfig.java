package com.resilient.operation.config;

import com.resilient.operation.circuitbreaker.CircuitBreakerRegistry;
import com.resilient.operation.wait.WaiterFactory;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.Objects;

/**
 * Execution policy for a resilient operation: attempt limit, backoff between attempts,
 * circuit breaking and the waiter used for delays. The backoff curve is opaque to the
 * execution loop; it only asks it for the delay after a given attempt.
 */
public class ResilienceConfig {
    
    private final int maxAttempts;
    private final IntervalFunction backoff;
    private final boolean enableCircuitBreaker;
    private final CircuitBreakerConfig circuitBreakerConfig;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final WaiterFactory waiterFactory;
    
    private ResilienceConfig(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoff = builder.backoff;
        this.enableCircuitBreaker = builder.enableCircuitBreaker;
        this.circuitBreakerConfig = builder.circuitBreakerConfig;
        this.circuitBreakerRegistry = builder.circuitBreakerRegistry;
        this.waiterFactory = builder.waiterFactory;
    }
    
    public int getMaxAttempts() {
        return maxAttempts;
    }
    
    public IntervalFunction getBackoff() {
        return backoff;
    }
    
    public boolean isCircuitBreakerEnabled() {
        return enableCircuitBreaker;
    }
    
    /**
     * Config for breakers created on behalf of this policy; {@code null} means the
     * registry's default config.
     */
    public CircuitBreakerConfig getCircuitBreakerConfig() {
        return circuitBreakerConfig;
    }
    
    public CircuitBreakerRegistry getCircuitBreakerRegistry() {
        return circuitBreakerRegistry;
    }
    
    /**
     * Waiter factory for this policy; {@code null} means the process-wide default.
     */
    public WaiterFactory getWaiterFactory() {
        return waiterFactory;
    }
    
    /**
     * Three attempts, 500ms fixed backoff, circuit breaking through the default registry.
     */
    public static ResilienceConfig defaultConfig() {
        return builder().build();
    }
    
    /**
     * More attempts with exponential backoff and a breaker that tolerates more failures.
     */
    public static ResilienceConfig relaxedConfig() {
        return builder()
                .maxAttempts(5)
                .backoff(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(100), 2.0))
                .circuitBreaker(CircuitBreakerConfig.builder()
                        .failureThreshold(10)
                        .openDuration(Duration.ofSeconds(30))
                        .build())
                .build();
    }
    
    /**
     * Retries only; no circuit breaker gates or records attempts.
     */
    public static ResilienceConfig noCircuitBreakerConfig() {
        return builder()
                .enableCircuitBreaker(false)
                .build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Builder toBuilder() {
        Builder builder = new Builder()
                .maxAttempts(maxAttempts)
                .backoff(backoff)
                .enableCircuitBreaker(enableCircuitBreaker)
                .circuitBreakerRegistry(circuitBreakerRegistry)
                .waiterFactory(waiterFactory);
        builder.circuitBreakerConfig = circuitBreakerConfig;
        return builder;
    }
    
    public static class Builder {
        private int maxAttempts = 3;
        private IntervalFunction backoff = IntervalFunction.ofDefaults();
        private boolean enableCircuitBreaker = true;
        private CircuitBreakerConfig circuitBreakerConfig;
        private CircuitBreakerRegistry circuitBreakerRegistry = CircuitBreakerRegistry.getDefault();
        private WaiterFactory waiterFactory;
        
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }
        
        public Builder backoff(IntervalFunction backoff) {
            this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
            return this;
        }
        
        /**
         * Convenience method for a fixed delay between attempts. A zero delay retries immediately.
         */
        public Builder fixedBackoff(Duration delay) {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
            long millis = delay.toMillis();
            this.backoff = attempt -> millis;
            return this;
        }
        
        public Builder enableCircuitBreaker(boolean enable) {
            this.enableCircuitBreaker = enable;
            return this;
        }
        
        public Builder circuitBreaker(CircuitBreakerConfig config) {
            this.circuitBreakerConfig = Objects.requireNonNull(config, "config must not be null");
            return this;
        }
        
        public Builder circuitBreakerRegistry(CircuitBreakerRegistry registry) {
            this.circuitBreakerRegistry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }
        
        /**
         * Waiter factory for operations using this policy; {@code null} restores the process-wide default.
         */
        public Builder waiterFactory(WaiterFactory waiterFactory) {
            this.waiterFactory = waiterFactory;
            return this;
        }
        
        public ResilienceConfig build() {
            return new ResilienceConfig(this);
        }
    }
}

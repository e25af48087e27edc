package com.resilient.operation.circuitbreaker;

import com.resilient.operation.config.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Concurrency-safe store mapping an operation key to its shared circuit breaker.
 * Breakers are created lazily on first use and kept for the registry's lifetime;
 * concurrent first uses of one key always observe the same instance.
 */
public class CircuitBreakerRegistry {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerRegistry.class);
    
    private static final CircuitBreakerRegistry DEFAULT = new CircuitBreakerRegistry(CircuitBreakerConfig.defaultConfig());
    
    private final CircuitBreakerConfig defaultConfig;
    private final ConcurrentMap<String, CircuitBreaker> circuitBreakers;
    private final CircuitBreakerEventPublisher eventPublisher;
    
    public CircuitBreakerRegistry(CircuitBreakerConfig defaultConfig) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.circuitBreakers = new ConcurrentHashMap<>();
        this.eventPublisher = new CircuitBreakerEventPublisher();
    }
    
    /**
     * The process-wide registry used by operations that are not given one.
     */
    public static CircuitBreakerRegistry getDefault() {
        return DEFAULT;
    }
    
    /**
     * Get or create the circuit breaker for an operation key using the registry's default config.
     */
    public CircuitBreaker circuitBreaker(String operationKey) {
        return circuitBreaker(operationKey, defaultConfig);
    }
    
    /**
     * Get or create the circuit breaker for an operation key. The config is only used
     * if this call creates the breaker; an existing breaker keeps its original config.
     */
    public CircuitBreaker circuitBreaker(String operationKey, CircuitBreakerConfig config) {
        Objects.requireNonNull(operationKey, "operationKey must not be null");
        Objects.requireNonNull(config, "config must not be null");
        
        return circuitBreakers.computeIfAbsent(operationKey, key -> {
            logger.debug("Creating circuit breaker for operation {} with {}", key, config);
            return new CircuitBreaker(key, config, eventPublisher::publish);
        });
    }
    
    public Optional<CircuitBreaker> find(String operationKey) {
        return Optional.ofNullable(circuitBreakers.get(operationKey));
    }
    
    public Collection<CircuitBreaker> getAllCircuitBreakers() {
        return Collections.unmodifiableCollection(circuitBreakers.values());
    }
    
    public CircuitBreakerConfig getDefaultConfig() {
        return defaultConfig;
    }
    
    public CircuitBreakerEventPublisher getEventPublisher() {
        return eventPublisher;
    }
}

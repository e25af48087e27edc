package com.resilient.operation.circuitbreaker;

import com.resilient.operation.model.CircuitBreakerEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Publishes circuit breaker state transitions as a hot stream. Events emitted
 * while nobody is subscribed are dropped.
 */
public class CircuitBreakerEventPublisher {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreakerEventPublisher.class);
    
    private final Sinks.Many<CircuitBreakerEvent> sink;
    private final AtomicInteger subscriberCount;
    
    public CircuitBreakerEventPublisher() {
        this.sink = Sinks.many().multicast().directBestEffort();
        this.subscriberCount = new AtomicInteger();
    }
    
    /**
     * Publishes a transition. Serialized so concurrent breakers never trip the sink's
     * non-serialized emission check.
     */
    public synchronized void publish(CircuitBreakerEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result == Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.trace("No subscribers for {}", event);
        } else if (result.isFailure()) {
            logger.warn("Failed to publish circuit breaker event for {}: {}", event.operationKey(), result);
        }
    }
    
    /**
     * Hot stream of transitions published from now on.
     */
    public Flux<CircuitBreakerEvent> events() {
        return sink.asFlux();
    }
    
    /**
     * Subscribes a listener to transitions.
     *
     * @return Disposable to unsubscribe
     */
    public Disposable subscribe(Consumer<CircuitBreakerEvent> listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        
        return sink.asFlux()
            .doOnSubscribe(subscription -> logger.debug("Circuit breaker event subscriber added (total: {})",
                subscriberCount.incrementAndGet()))
            .doOnCancel(() -> logger.debug("Circuit breaker event subscriber removed (remaining: {})",
                subscriberCount.decrementAndGet()))
            .subscribe(
                listener::accept,
                error -> logger.error("Circuit breaker event subscriber error", error)
            );
    }
    
    public int getSubscriberCount() {
        return subscriberCount.get();
    }
}

package com.resilient.operation.circuitbreaker;

import com.resilient.operation.config.CircuitBreakerConfig;
import com.resilient.operation.model.CircuitBreakerEvent;
import com.resilient.operation.model.CircuitBreakerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CircuitBreakerRegistry.
 */
public class CircuitBreakerRegistryTest {
    
    private CircuitBreakerRegistry registry;
    
    @BeforeEach
    public void setUp() {
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
            .failureThreshold(2)
            .build());
    }
    
    @Test
    public void testGetOrCreateIsIdempotent() {
        CircuitBreaker first = registry.circuitBreaker("payments");
        CircuitBreaker second = registry.circuitBreaker("payments");
        
        assertSame(first, second);
        assertEquals("payments", first.getName());
        assertEquals(2, first.getConfig().getFailureThreshold());
        assertTrue(registry.find("payments").isPresent());
        assertTrue(registry.find("unknown").isEmpty());
    }
    
    @Test
    public void testFirstCreationWinsConfig() {
        CircuitBreakerConfig custom = CircuitBreakerConfig.builder().failureThreshold(7).build();
        
        CircuitBreaker created = registry.circuitBreaker("inventory", custom);
        CircuitBreaker existing = registry.circuitBreaker("inventory");
        
        assertSame(created, existing);
        assertEquals(7, existing.getConfig().getFailureThreshold());
    }
    
    @Test
    public void testDistinctKeysAreIndependent() {
        CircuitBreaker a = registry.circuitBreaker("a");
        CircuitBreaker b = registry.circuitBreaker("b");
        
        assertNotSame(a, b);
        a.transitionToOpenState();
        assertEquals(CircuitBreakerState.OPEN, a.getState());
        assertEquals(CircuitBreakerState.CLOSED, b.getState());
        assertEquals(2, registry.getAllCircuitBreakers().size());
    }
    
    @Test
    public void testConcurrentFirstUseYieldsOneInstance() throws Exception {
        int threadCount = 32;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        
        try {
            Callable<CircuitBreaker> lookup = () -> {
                start.await();
                return registry.circuitBreaker("shared");
            };
            List<Future<CircuitBreaker>> futures = IntStream.range(0, threadCount)
                .mapToObj(i -> executor.submit(lookup))
                .collect(Collectors.toList());
            start.countDown();
            
            Set<CircuitBreaker> instances = ConcurrentHashMap.newKeySet();
            for (Future<CircuitBreaker> future : futures) {
                instances.add(future.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, instances.size());
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    public void testTransitionsArePublished() {
        List<CircuitBreakerEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = registry.getEventPublisher().subscribe(received::add);
        
        try {
            assertEquals(1, registry.getEventPublisher().getSubscriberCount());
            CircuitBreaker breaker = registry.circuitBreaker("published");
            breaker.onFailure(new IOException("one"));
            breaker.onFailure(new IOException("two"));
            
            assertEquals(1, received.size());
            assertEquals("published", received.get(0).operationKey());
            assertEquals(CircuitBreakerState.OPEN, received.get(0).toState());
        } finally {
            subscription.dispose();
        }
        assertEquals(0, registry.getEventPublisher().getSubscriberCount());
    }
    
    @Test
    public void testEventStream() {
        CircuitBreaker breaker = registry.circuitBreaker("streamed");
        
        StepVerifier.create(registry.getEventPublisher().events().take(2))
            .then(breaker::transitionToOpenState)
            .then(breaker::transitionToClosedState)
            .expectNextMatches(event -> event.toState() == CircuitBreakerState.OPEN)
            .expectNextMatches(event -> event.toState() == CircuitBreakerState.CLOSED)
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }
    
    @Test
    public void testDefaultRegistryIsShared() {
        assertSame(CircuitBreakerRegistry.getDefault(), CircuitBreakerRegistry.getDefault());
    }
}

package com.resilient.operation.impl;

import com.resilient.operation.ResilientOperation;
import com.resilient.operation.ResilientOperations;
import com.resilient.operation.circuitbreaker.CircuitBreaker;
import com.resilient.operation.circuitbreaker.CircuitBreakerRegistry;
import com.resilient.operation.config.CircuitBreakerConfig;
import com.resilient.operation.exception.ResilientOperationException.CircuitOpenException;
import com.resilient.operation.exception.ResilientOperationException.MaxAttemptsExceededException;
import com.resilient.operation.handler.ResilientHandler;
import com.resilient.operation.handler.Verdict;
import com.resilient.operation.model.CircuitBreakerState;
import com.resilient.operation.support.InstantWaiterFactory;
import com.resilient.operation.support.MutableClock;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour of the execution loop: attempts, verdicts, breaker gating and failure classification.
 */
class DefaultResilientOperationTest {
    
    private MutableClock clock;
    private CircuitBreakerRegistry registry;
    private InstantWaiterFactory waiters;
    
    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        registry = new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
            .failureThreshold(100)
            .clock(clock)
            .build());
        waiters = new InstantWaiterFactory();
    }
    
    @Test
    @DisplayName("Faulting twice then succeeding with retries allowed yields the value on the third attempt")
    void succeedsOnThirdAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger lastAttemptSeen = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() <= 2) {
                    throw new IOException("transient " + calls.get());
                }
                return "success";
            })
            .key("scenario-a")
            .handler(context -> {
                lastAttemptSeen.set(context.getCurrentAttempt());
                return context.retry();
            })
            .whenResult(value -> true, context -> {
                lastAttemptSeen.set(context.getCurrentAttempt());
                return context.proceed();
            })
            .maxAttempts(5)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("success", operation.execute());
        assertEquals(3, calls.get());
        assertEquals(3, lastAttemptSeen.get());
        assertEquals(2, waiters.getDelays().size());
        assertEquals(CircuitBreakerState.CLOSED, registry.circuitBreaker("scenario-a").getState());
    }
    
    @Test
    @DisplayName("Retrying a work that always faults stops at the attempt limit with the last fault")
    void exhaustsAttemptLimit() {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                throw new IOException("failure " + calls.incrementAndGet());
            })
            .key("scenario-b")
            .handler(ResilientHandler.alwaysRetry())
            .maxAttempts(2)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        MaxAttemptsExceededException exception = assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertEquals(2, calls.get());
        assertEquals(2, exception.getAttempts());
        assertInstanceOf(IOException.class, exception.getCause());
        assertEquals("failure 2", exception.getCause().getMessage());
        assertEquals(1, waiters.getDelays().size());
    }
    
    @ParameterizedTest
    @ValueSource(ints = {1, 3, 7})
    void alwaysFaultingOperationMakesExactlyMaxAttempts(int maxAttempts) {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<Integer> operation = ResilientOperations.<Integer>of(() -> {
                throw new IllegalStateException("attempt " + calls.incrementAndGet());
            })
            .key("limit-" + maxAttempts)
            .handler(context -> context.retry())
            .maxAttempts(maxAttempts)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        MaxAttemptsExceededException exception = assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertEquals(maxAttempts, calls.get());
        assertEquals("attempt " + maxAttempts, exception.getCause().getMessage());
    }
    
    @Test
    void thousandsOfImmediateRetriesRunWithoutGrowingTheStack() {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                calls.incrementAndGet();
                throw new IOException("still down");
            })
            .key("immediate-retries")
            .handler(ResilientHandler.alwaysRetry())
            .maxAttempts(20_000)
            .backoff(Duration.ZERO)
            .disableCircuitBreaker()
            .build();
        
        MaxAttemptsExceededException exception = assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertEquals(20_000, calls.get());
        assertEquals(20_000, exception.getAttempts());
    }
    
    @Test
    void thousandsOfRetriesWithInstantWaiterAndBreaker() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<Integer> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() < 5_000) {
                    throw new IOException("not yet");
                }
                return calls.get();
            })
            .key("instant-retries")
            .handler(context -> context.retry())
            .maxAttempts(5_000)
            .circuitBreakerRegistry(new CircuitBreakerRegistry(CircuitBreakerConfig.builder()
                .failureThreshold(10_000)
                .clock(clock)
                .build()))
            .waiterFactory(waiters)
            .build();
        
        assertEquals(5_000, operation.execute());
        assertEquals(4_999, waiters.getDelays().size());
    }
    
    @Test
    @DisplayName("Returning a fallback value on the first fault still counts the fault on the breaker")
    void returnValueMasksFaultButBreakerStillCountsIt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<Integer> operation = ResilientOperations.<Integer>of(() -> {
                calls.incrementAndGet();
                throw new IOException("down");
            })
            .key("scenario-c")
            .handler(context -> context.returnValue(42))
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals(42, operation.execute());
        assertEquals(1, calls.get());
        assertEquals(1, registry.circuitBreaker("scenario-c").getFailureCount());
    }
    
    @Test
    void retryingSeveralTimesInOneHandlerCountsOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("first");
                }
                return "second";
            })
            .key("idempotent-retry")
            .handler(context -> {
                context.retry();
                context.retry();
                return context.retry();
            })
            .maxAttempts(3)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("second", operation.execute());
        assertEquals(2, calls.get());
        assertEquals(1, waiters.getDelays().size());
    }
    
    @Test
    void continueOnFaultSurfacesOriginalFault() {
        IOException original = new IOException("original");
        
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                throw original;
            })
            .key("continue-fault")
            .handler(context -> context.proceed())
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        IOException thrown = assertThrows(IOException.class, operation::execute);
        assertSame(original, thrown);
    }
    
    @Test
    void nullVerdictIsContinue() {
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                throw new IllegalArgumentException("bad input");
            })
            .key("null-verdict")
            .handler(context -> null)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertThrows(IllegalArgumentException.class, operation::execute);
    }
    
    @Test
    void noHandlerSurfacesFaultAfterOneAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        IllegalStateException original = new IllegalStateException("unhandled");
        
        CompletableFuture<String> future = ResilientOperations.<String>of(() -> {
                calls.incrementAndGet();
                throw original;
            })
            .key("no-handler")
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .executeAsync();
        
        ExecutionException exception = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertSame(original, exception.getCause());
        assertEquals(1, calls.get());
    }
    
    @Test
    void breakAfterFaultSurfacesFault() {
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                throw new IOException("fatal");
            })
            .key("break-fault")
            .handler(context -> context.breakOperation())
            .maxAttempts(5)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        IOException thrown = assertThrows(IOException.class, operation::execute);
        assertEquals("fatal", thrown.getMessage());
        assertTrue(waiters.getDelays().isEmpty());
    }
    
    @Test
    void breakAfterSuccessReturnsLastSuccessfulValue() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<Integer> operation = ResilientOperations.of(calls::incrementAndGet)
            .key("break-success")
            .whenResult(value -> value < 3, context -> context.retry())
            .whenResult(value -> value == 3, context -> context.breakOperation())
            .maxAttempts(10)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals(3, operation.execute());
        assertEquals(3, calls.get());
    }
    
    @Test
    void breakOnFirstSuccessReturnsThatValue() throws Exception {
        ResilientOperation<String> operation = ResilientOperations.of(() -> "only")
            .key("break-first-success")
            .whenResult(value -> true, context -> context.breakOperation())
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("only", operation.execute());
    }
    
    @Test
    void retryOnResultUntilExhaustedWithoutFault() {
        ResilientOperation<String> operation = ResilientOperations.of(() -> "pending")
            .key("result-exhausted")
            .whenResult("pending"::equals, context -> context.retry())
            .maxAttempts(3)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        MaxAttemptsExceededException exception = assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertNull(exception.getCause());
        assertEquals(3, exception.getAttempts());
    }
    
    @Test
    void exhaustionAfterSuccessfulLastAttemptCarriesEarlierFault() {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("earlier");
                }
                return "pending";
            })
            .key("result-exhausted-after-fault")
            .handler(context -> context.retry())
            .whenResult("pending"::equals, context -> context.retry())
            .maxAttempts(2)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        MaxAttemptsExceededException exception = assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertEquals("earlier", exception.getCause().getMessage());
    }
    
    @Test
    void nullValueCanBeReplacedByResultHandler() throws Exception {
        ResilientOperation<String> operation = ResilientOperations.of(() -> (String) null)
            .key("null-value")
            .whenResult(value -> value == null, context -> {
                assertTrue(context.hasResult());
                return context.returnValue("substituted");
            })
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("substituted", operation.execute());
    }
    
    @Test
    void typedHandlersAreConsultedInRegistrationOrder() {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                int call = calls.incrementAndGet();
                if (call == 1) {
                    throw new IOException("io");
                }
                throw new IllegalStateException("state");
            })
            .key("typed-handlers")
            .whenExceptionIs(IOException.class, context -> context.retry())
            .whenExceptionIs(RuntimeException.class, context -> context.returnValue("fallback"))
            .handler(context -> {
                throw new AssertionError("catch-all must not be reached");
            })
            .maxAttempts(5)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("fallback", operation.executeAsync().join());
        assertEquals(2, calls.get());
    }
    
    @Test
    void handlerInvocationsAreTrackedPerRegistration() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger ioInvocations = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                int call = calls.incrementAndGet();
                if (call <= 3) {
                    throw new IOException("io " + call);
                }
                return "ok";
            })
            .key("handler-invocations")
            .whenExceptionIs(IOException.class, context -> {
                ioInvocations.set(context.getHandlerInvocations());
                return context.retry();
            })
            .maxAttempts(5)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("ok", operation.execute());
        assertEquals(3, ioInvocations.get());
    }
    
    @Test
    void handlerExceptionTerminatesOperation() {
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                throw new IOException("attempt");
            })
            .key("throwing-handler")
            .handler(context -> {
                throw new UnsupportedOperationException("handler");
            })
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        UnsupportedOperationException thrown = assertThrows(UnsupportedOperationException.class, operation::execute);
        assertEquals("handler", thrown.getMessage());
        assertEquals(1, registry.circuitBreaker("throwing-handler").getFailureCount());
    }
    
    @Test
    void backoffIsAskedForDelayAfterEachAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() < 4) {
                    throw new IOException("retry me");
                }
                return "done";
            })
            .key("backoff")
            .handler(context -> context.retry())
            .maxAttempts(4)
            .backoff(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(100), 2.0))
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("done", operation.execute());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400)),
            waiters.getDelays());
    }
    
    @Test
    void retryAfterOverridesBackoff() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() == 1) {
                    throw new IOException("throttled");
                }
                return "done";
            })
            .key("retry-after")
            .handler(context -> context.retryAfter(Duration.ofSeconds(7)))
            .backoff(Duration.ofMillis(1))
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("done", operation.execute());
        assertEquals(List.of(Duration.ofSeconds(7)), waiters.getDelays());
    }
    
    @Test
    void asyncFaultIsSurfacedUnwrapped() {
        IOException original = new IOException("async failure");
        
        ResilientOperation<String> operation = ResilientOperations.ofAsync(
                () -> CompletableFuture.<String>supplyAsync(() -> "ignored")
                    .thenCompose(ignored -> CompletableFuture.<String>failedFuture(original)))
            .key("async-fault")
            .whenExceptionIs(IOException.class, context -> {
                assertSame(original, context.getFault().orElseThrow());
                return context.proceed();
            })
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        IOException thrown = assertThrows(IOException.class, operation::execute);
        assertSame(original, thrown);
    }
    
    @Test
    @DisplayName("Breaker opened by three faults rejects attempts until a single trial attempt is admitted after the open duration")
    void circuitBreakerGatesAttemptsAcrossExecutions() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("gated", CircuitBreakerConfig.builder()
            .failureThreshold(3)
            .openDuration(Duration.ofMinutes(1))
            .clock(clock)
            .build());
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger failUntil = new AtomicInteger(Integer.MAX_VALUE);
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() <= failUntil.get()) {
                    throw new IOException("down");
                }
                return "up";
            })
            .circuitBreaker(breaker)
            .handler(context -> context.retry())
            .maxAttempts(10)
            .waiterFactory(waiters)
            .build();
        
        CircuitOpenException rejected = assertThrows(CircuitOpenException.class, operation::execute);
        assertEquals(3, calls.get());
        assertEquals(CircuitBreakerState.OPEN, rejected.getState());
        
        // Still open: rejected without invoking the work
        assertThrows(CircuitOpenException.class, operation::execute);
        assertEquals(3, calls.get());
        
        // Faulting probe re-opens and restarts the open duration
        clock.advance(Duration.ofMinutes(1));
        assertThrows(CircuitOpenException.class, operation::execute);
        assertEquals(4, calls.get());
        assertEquals(CircuitBreakerState.OPEN, breaker.getState());
        clock.advance(Duration.ofSeconds(59));
        assertThrows(CircuitOpenException.class, operation::execute);
        assertEquals(4, calls.get());
        
        // Successful probe closes
        failUntil.set(0);
        clock.advance(Duration.ofSeconds(1));
        assertEquals("up", operation.execute());
        assertEquals(5, calls.get());
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
    }
    
    @Test
    void successBelowThresholdNeverOpensBreaker() throws Exception {
        CircuitBreaker breaker = new CircuitBreaker("below-threshold", CircuitBreakerConfig.builder()
            .failureThreshold(3)
            .clock(clock)
            .build());
        AtomicInteger calls = new AtomicInteger();
        List<CircuitBreakerState> states = new java.util.concurrent.CopyOnWriteArrayList<>();
        
        ResilientOperation<String> operation = ResilientOperations.of(() -> {
                states.add(breaker.getState());
                if (calls.incrementAndGet() < 3) {
                    throw new IOException("transient");
                }
                return "ok";
            })
            .circuitBreaker(breaker)
            .handler(context -> context.retry())
            .maxAttempts(5)
            .waiterFactory(waiters)
            .build();
        
        assertEquals("ok", operation.execute());
        assertTrue(states.stream().allMatch(state -> state == CircuitBreakerState.CLOSED));
        assertEquals(CircuitBreakerState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getFailureCount());
    }
    
    @Test
    void disabledCircuitBreakerNeverRejects() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<String> operation = ResilientOperations.<String>of(() -> {
                calls.incrementAndGet();
                throw new IOException("down");
            })
            .key("no-breaker")
            .disableCircuitBreaker()
            .handler(context -> {
                assertTrue(context.getCircuitBreaker().isEmpty());
                return context.retry();
            })
            .maxAttempts(50)
            .waiterFactory(waiters)
            .build();
        
        assertTrue(operation.getCircuitBreaker().isEmpty());
        assertThrows(MaxAttemptsExceededException.class, operation::execute);
        assertEquals(50, calls.get());
    }
    
    @Test
    void executionsOfOneOperationHaveIndependentAttemptCounters() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        
        ResilientOperation<Integer> operation = ResilientOperations.of(() -> {
                if (calls.incrementAndGet() % 2 == 1) {
                    throw new IOException("odd call");
                }
                return calls.get();
            })
            .key("independent")
            .handler(context -> {
                assertEquals(1, context.getCurrentAttempt());
                return context.retry();
            })
            .maxAttempts(2)
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .build();
        
        assertEquals(2, operation.execute());
        assertEquals(4, operation.execute());
    }
    
    @Test
    void futureCompletesWithinTimeoutForImmediateWork() throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Verdict.Kind> future = ResilientOperations.of(() -> Verdict.Kind.RETURN)
            .key("immediate")
            .circuitBreakerRegistry(registry)
            .waiterFactory(waiters)
            .executeAsync();
        
        assertEquals(Verdict.Kind.RETURN, future.get(1, TimeUnit.SECONDS));
    }
}

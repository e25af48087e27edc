package com.resilient.operation.circuitbreaker;

import com.resilient.operation.config.CircuitBreakerConfig;
import com.resilient.operation.model.CircuitBreakerEvent;
import com.resilient.operation.model.CircuitBreakerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Per-operation circuit breaker gating attempts.
 *
 * <pre>
 *     CLOSED ──(failures in window >= threshold)──> OPEN
 *        ^                                            │
 *    (probe succeeds)                     (open duration elapsed, next gate check)
 *        │                                            v
 *        └────────────────── HALF_OPEN ───(probe fails)──> OPEN
 * </pre>
 *
 * All state lives behind one lock scoped to this instance. The lock is only held
 * while reading or updating counters and state, never while an attempt runs.
 * Transition events are published after the lock is released.
 */
public class CircuitBreaker {
    
    private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);
    
    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final Consumer<CircuitBreakerEvent> eventConsumer;
    private final Object lock = new Object();
    
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private Instant windowStart;
    private Instant lastTransition;
    private boolean probeInFlight;
    private long probeGeneration;
    
    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, event -> { });
    }
    
    public CircuitBreaker(String name, CircuitBreakerConfig config, Consumer<CircuitBreakerEvent> eventConsumer) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.eventConsumer = Objects.requireNonNull(eventConsumer, "eventConsumer must not be null");
        this.clock = config.getClock();
        this.lastTransition = clock.instant();
    }
    
    /**
     * Gate check performed before every attempt.
     * <ul>
     *   <li>CLOSED: permitted.</li>
     *   <li>OPEN: permitted only once the open duration has elapsed, in which case the
     *       breaker moves to HALF_OPEN and the caller becomes the single probe.</li>
     *   <li>HALF_OPEN: permitted only if no probe is in flight.</li>
     * </ul>
     *
     * @return the granted permission, to hand back to {@link #releasePermission(Permission)}
     *         if the attempt never completes; empty if the attempt must not run
     */
    public Optional<Permission> acquirePermission() {
        CircuitBreakerEvent event = null;
        Permission permission;
        
        synchronized (lock) {
            permission = switch (state) {
                case CLOSED -> Permission.REGULAR;
                case OPEN -> {
                    Instant now = clock.instant();
                    if (now.isBefore(lastTransition.plus(config.getOpenDuration()))) {
                        yield null;
                    }
                    event = transitionTo(CircuitBreakerState.HALF_OPEN, now);
                    yield claimProbe();
                }
                case HALF_OPEN -> probeInFlight ? null : claimProbe();
            };
        }
        
        publish(event);
        if (permission == null) {
            logger.debug("Circuit breaker {} rejected attempt in state {}", name, getState());
        }
        return Optional.ofNullable(permission);
    }
    
    /**
     * Gate check for callers that never give a permission back.
     *
     * @return true if the attempt may run
     * @see #acquirePermission()
     */
    public boolean tryAcquirePermission() {
        return acquirePermission().isPresent();
    }
    
    /**
     * Records a successful attempt: clears the failure counter and closes a half-open breaker.
     */
    public void onSuccess() {
        CircuitBreakerEvent event = null;
        
        synchronized (lock) {
            failureCount = 0;
            windowStart = null;
            if (state == CircuitBreakerState.HALF_OPEN) {
                probeInFlight = false;
                event = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
            }
        }
        
        publish(event);
    }
    
    /**
     * Records a faulted attempt. Re-opens a half-open breaker, restarting the open
     * duration, and opens a closed breaker once the failures counted within the
     * current sampling window reach the threshold.
     */
    public void onFailure(Throwable fault) {
        CircuitBreakerEvent event = null;
        
        synchronized (lock) {
            Instant now = clock.instant();
            if (windowStart == null || !now.isBefore(windowStart.plus(config.getSamplingWindow()))) {
                windowStart = now;
                failureCount = 0;
            }
            failureCount++;
            
            if (state == CircuitBreakerState.HALF_OPEN) {
                probeInFlight = false;
                event = transitionTo(CircuitBreakerState.OPEN, now);
            } else if (state == CircuitBreakerState.CLOSED && failureCount >= config.getFailureThreshold()) {
                event = transitionTo(CircuitBreakerState.OPEN, now);
            }
        }
        
        if (logger.isDebugEnabled()) {
            logger.debug("Circuit breaker {} recorded failure: {}", name,
                fault == null ? "unknown" : fault.toString());
        }
        publish(event);
    }
    
    /**
     * Gives back a permission whose attempt never completed, such as one abandoned
     * by cancellation, without recording an outcome. Frees the probe slot only when
     * {@code permission} is the probe currently in flight.
     */
    public void releasePermission(Permission permission) {
        Objects.requireNonNull(permission, "permission must not be null");
        if (!permission.isProbe()) {
            return;
        }
        synchronized (lock) {
            if (state == CircuitBreakerState.HALF_OPEN && probeInFlight
                && permission.generation == probeGeneration) {
                probeInFlight = false;
            }
        }
    }
    
    /**
     * Force the breaker open, restarting the open duration.
     */
    public void transitionToOpenState() {
        CircuitBreakerEvent event;
        synchronized (lock) {
            probeInFlight = false;
            event = transitionTo(CircuitBreakerState.OPEN, clock.instant());
        }
        publish(event);
        logger.warn("Circuit breaker {} forced to OPEN state", name);
    }
    
    /**
     * Force the breaker closed and clear its failure counter.
     */
    public void transitionToClosedState() {
        CircuitBreakerEvent event;
        synchronized (lock) {
            probeInFlight = false;
            failureCount = 0;
            windowStart = null;
            event = transitionTo(CircuitBreakerState.CLOSED, clock.instant());
        }
        publish(event);
        logger.info("Circuit breaker {} forced to CLOSED state", name);
    }
    
    /**
     * Return to a fresh closed breaker without publishing a transition.
     */
    public void reset() {
        synchronized (lock) {
            state = CircuitBreakerState.CLOSED;
            probeInFlight = false;
            failureCount = 0;
            windowStart = null;
            lastTransition = clock.instant();
        }
        logger.info("Circuit breaker {} has been reset", name);
    }
    
    public String getName() {
        return name;
    }
    
    public CircuitBreakerConfig getConfig() {
        return config;
    }
    
    public CircuitBreakerState getState() {
        synchronized (lock) {
            return state;
        }
    }
    
    public int getFailureCount() {
        synchronized (lock) {
            return failureCount;
        }
    }
    
    public Instant getLastTransition() {
        synchronized (lock) {
            return lastTransition;
        }
    }
    
    public boolean isProbeInFlight() {
        synchronized (lock) {
            return probeInFlight;
        }
    }
    
    @Override
    public String toString() {
        synchronized (lock) {
            return String.format("CircuitBreaker{name='%s', state=%s, failures=%d}", name, state, failureCount);
        }
    }
    
    // Must be called while holding the lock
    private Permission claimProbe() {
        probeInFlight = true;
        return new Permission(++probeGeneration);
    }
    
    // Must be called while holding the lock
    private CircuitBreakerEvent transitionTo(CircuitBreakerState target, Instant now) {
        CircuitBreakerState from = state;
        state = target;
        lastTransition = now;
        if (from == target) {
            return null;
        }
        return new CircuitBreakerEvent(name, from, target, now);
    }
    
    private void publish(CircuitBreakerEvent event) {
        if (event == null) {
            return;
        }
        logger.info("Circuit breaker {} state transition: {} -> {}", name, event.fromState(), event.toState());
        try {
            eventConsumer.accept(event);
        } catch (RuntimeException e) {
            logger.warn("Circuit breaker {} event consumer failed", name, e);
        }
    }
    
    /**
     * Token for one admitted attempt. A probe permission carries the generation of
     * the half-open probe it was granted as.
     */
    public static final class Permission {
        
        private static final Permission REGULAR = new Permission(0);
        
        private final long generation;
        
        private Permission(long generation) {
            this.generation = generation;
        }
        
        public boolean isProbe() {
            return generation > 0;
        }
        
        @Override
        public String toString() {
            return isProbe() ? "Permission{probe #" + generation + "}" : "Permission{regular}";
        }
    }
}

package com.resilient.operation.config;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Circuit breaker configuration for operation fault tolerance.
 */
public class CircuitBreakerConfig {
    
    private final int failureThreshold;
    private final Duration openDuration;
    private final Duration samplingWindow;
    private final Clock clock;
    
    private CircuitBreakerConfig(Builder builder) {
        this.failureThreshold = builder.failureThreshold;
        this.openDuration = builder.openDuration;
        this.samplingWindow = builder.samplingWindow;
        this.clock = builder.clock;
    }
    
    /**
     * Failures within one sampling window that open a closed breaker.
     */
    public int getFailureThreshold() {
        return failureThreshold;
    }
    
    /**
     * How long an open breaker rejects attempts before allowing a probe.
     */
    public Duration getOpenDuration() {
        return openDuration;
    }
    
    /**
     * Rolling window the failure counter is scoped to.
     */
    public Duration getSamplingWindow() {
        return samplingWindow;
    }
    
    public Clock getClock() {
        return clock;
    }
    
    public static CircuitBreakerConfig defaultConfig() {
        return builder().build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public Builder toBuilder() {
        return new Builder()
            .failureThreshold(failureThreshold)
            .openDuration(openDuration)
            .samplingWindow(samplingWindow)
            .clock(clock);
    }
    
    @Override
    public String toString() {
        return String.format("CircuitBreakerConfig{failureThreshold=%d, openDuration=%s, samplingWindow=%s}",
            failureThreshold, openDuration, samplingWindow);
    }
    
    public static class Builder {
        private int failureThreshold = 5;
        private Duration openDuration = Duration.ofSeconds(60);
        private Duration samplingWindow = Duration.ofMinutes(1);
        private Clock clock = Clock.systemUTC();
        
        public Builder failureThreshold(int threshold) {
            if (threshold < 1) {
                throw new IllegalArgumentException("failureThreshold must be at least 1, was " + threshold);
            }
            this.failureThreshold = threshold;
            return this;
        }
        
        public Builder openDuration(Duration duration) {
            Objects.requireNonNull(duration, "openDuration must not be null");
            if (duration.isNegative()) {
                throw new IllegalArgumentException("openDuration must not be negative");
            }
            this.openDuration = duration;
            return this;
        }
        
        public Builder samplingWindow(Duration window) {
            Objects.requireNonNull(window, "samplingWindow must not be null");
            if (window.isNegative() || window.isZero()) {
                throw new IllegalArgumentException("samplingWindow must be positive");
            }
            this.samplingWindow = window;
            return this;
        }
        
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }
        
        public CircuitBreakerConfig build() {
            return new CircuitBreakerConfig(this);
        }
    }
}

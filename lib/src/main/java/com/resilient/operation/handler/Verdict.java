package com.resilient.operation.handler;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * A handler's decision after an attempt.
 * <ul>
 *   <li>{@link Kind#CONTINUE}: not handled; a value is produced, a fault is surfaced unchanged.</li>
 *   <li>{@link Kind#RETRY}: try again after a delay, unless the attempt limit has been reached.</li>
 *   <li>{@link Kind#BREAK}: stop; surface the fault, or the last successful value.</li>
 *   <li>{@link Kind#RETURN}: stop and produce the given value, discarding any fault.</li>
 * </ul>
 *
 * @param <T> result type of the operation
 */
public final class Verdict<T> {
    
    public enum Kind {
        CONTINUE,
        RETRY,
        BREAK,
        RETURN
    }
    
    private final Kind kind;
    private final T value;
    private final Duration retryDelay;
    
    private Verdict(Kind kind, T value, Duration retryDelay) {
        this.kind = kind;
        this.value = value;
        this.retryDelay = retryDelay;
    }
    
    public static <T> Verdict<T> proceed() {
        return new Verdict<>(Kind.CONTINUE, null, null);
    }
    
    public static <T> Verdict<T> retry() {
        return new Verdict<>(Kind.RETRY, null, null);
    }
    
    /**
     * Retry after the given delay instead of the configured backoff.
     */
    public static <T> Verdict<T> retryAfter(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return new Verdict<>(Kind.RETRY, null, delay);
    }
    
    public static <T> Verdict<T> breakOperation() {
        return new Verdict<>(Kind.BREAK, null, null);
    }
    
    public static <T> Verdict<T> returnValue(T value) {
        return new Verdict<>(Kind.RETURN, value, null);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * The value to produce; only meaningful for {@link Kind#RETURN}.
     */
    public T getValue() {
        return value;
    }
    
    public Optional<Duration> getRetryDelay() {
        return Optional.ofNullable(retryDelay);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Verdict<?> verdict = (Verdict<?>) o;
        return kind == verdict.kind
            && Objects.equals(value, verdict.value)
            && Objects.equals(retryDelay, verdict.retryDelay);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, value, retryDelay);
    }
    
    @Override
    public String toString() {
        return switch (kind) {
            case RETURN -> "Verdict{RETURN, value=" + value + "}";
            case RETRY -> retryDelay == null ? "Verdict{RETRY}" : "Verdict{RETRY, after=" + retryDelay + "}";
            default -> "Verdict{" + kind + "}";
        };
    }
}

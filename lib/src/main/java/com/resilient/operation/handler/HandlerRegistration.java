package com.resilient.operation.handler;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A handler together with the attempt outcomes it applies to.
 *
 * @param <T> result type of the operation
 */
public final class HandlerRegistration<T> {
    
    private final String description;
    private final Class<? extends Throwable> faultType;
    private final Predicate<? super T> resultPredicate;
    private final ResilientHandler<T> handler;
    
    private HandlerRegistration(String description, Class<? extends Throwable> faultType,
                                Predicate<? super T> resultPredicate, ResilientHandler<T> handler) {
        this.description = description;
        this.faultType = faultType;
        this.resultPredicate = resultPredicate;
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }
    
    /**
     * Applies to every faulted attempt.
     */
    public static <T> HandlerRegistration<T> forAnyFault(ResilientHandler<T> handler) {
        return new HandlerRegistration<>("fault:any", Throwable.class, null, handler);
    }
    
    /**
     * Applies to faults that are instances of {@code faultType}.
     */
    public static <T> HandlerRegistration<T> forFault(Class<? extends Throwable> faultType, ResilientHandler<T> handler) {
        Objects.requireNonNull(faultType, "faultType must not be null");
        return new HandlerRegistration<>("fault:" + faultType.getSimpleName(), faultType, null, handler);
    }
    
    /**
     * Applies to successful values matching {@code predicate}.
     */
    public static <T> HandlerRegistration<T> forResult(Predicate<? super T> predicate, ResilientHandler<T> handler) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return new HandlerRegistration<>("result", null, predicate, handler);
    }
    
    public boolean appliesTo(Throwable fault, T value) {
        if (faultType != null) {
            return fault != null && faultType.isInstance(fault);
        }
        return fault == null && resultPredicate.test(value);
    }
    
    public ResilientHandler<T> getHandler() {
        return handler;
    }
    
    @Override
    public String toString() {
        return "HandlerRegistration{" + description + "}";
    }
}

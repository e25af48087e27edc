package com.resilient.operation;

import java.util.Set;

/**
 * Derives the default operation key from the place a builder is created.
 */
final class OperationKeys {
    
    private static final Set<String> ENTRY_CLASSES = Set.of(
        OperationKeys.class.getName(),
        ResilientOperations.class.getName(),
        ResilientOperationBuilder.class.getName()
    );
    
    private static final StackWalker WALKER = StackWalker.getInstance();
    
    private OperationKeys() {
    }
    
    /**
     * Label of the first stack frame outside the builder entry points, formatted as
     * {@code declaringClass.method:line}. Stable for every builder created at that
     * source line, distinct for builders created anywhere else.
     */
    static String fromCallSite() {
        return WALKER.walk(frames -> frames
                .filter(frame -> !ENTRY_CLASSES.contains(frame.getClassName()))
                .findFirst()
                .map(frame -> frame.getClassName() + "." + frame.getMethodName() + ":" + frame.getLineNumber())
                .orElse("unknown-call-site"));
    }
}

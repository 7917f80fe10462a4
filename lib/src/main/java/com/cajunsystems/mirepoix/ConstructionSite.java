package com.cajunsystems.mirepoix;

import java.util.Set;

/**
 * Where an effect was built: the constructor used and the first caller frame outside it.
 * Attached to every {@link com.cajunsystems.mirepoix.exception.DefectException}.
 */
public record ConstructionSite(String operation, StackTraceElement caller) {
    private static final StackWalker WALKER =
            StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private static final Set<Class<?>> CONSTRUCTORS = Set.of(Effect.class, ConstructionSite.class);

    static ConstructionSite capture(String operation) {
        StackTraceElement caller = WALKER.walk(frames -> frames
                .filter(frame -> !CONSTRUCTORS.contains(frame.getDeclaringClass()))
                .findFirst()
                .map(StackWalker.StackFrame::toStackTraceElement)
                .orElse(null));
        return new ConstructionSite(operation, caller);
    }

    public static ConstructionSite internal(String operation) {
        return new ConstructionSite(operation, null);
    }

    @Override
    public String toString() {
        return caller == null ? operation : operation + " at " + caller;
    }
}

package com.cajunsystems.mirepoix.exception;

import java.util.UUID;

public class CancelledException extends RuntimeException {
    public CancelledException(UUID fiberId) {
        super("Fiber " + fiberId + " was interrupted");
    }

    public CancelledException(InterruptedException cause) {
        super("Effect was cancelled due to interruption", cause);
    }
}

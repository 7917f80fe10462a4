package com.cajunsystems.mirepoix;

public enum FiberState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    INTERRUPTED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == INTERRUPTED;
    }
}

package com.cajunsystems.mirepoix;

/**
 * Starts an asynchronous operation and arranges for {@code callback} to be called once it
 * completes. A checked exception thrown here is the run's typed failure; an unchecked one
 * is a defect.
 */
@FunctionalInterface
public interface AsyncRegister<E extends Throwable, A> {
    void register(AsyncCallback<E, A> callback) throws E;
}

package com.cajunsystems.mirepoix.data;

@FunctionalInterface
public interface ThrowingSupplier<A> {
    A get() throws Exception;
}

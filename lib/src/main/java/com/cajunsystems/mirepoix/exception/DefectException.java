package com.cajunsystems.mirepoix.exception;

import com.cajunsystems.mirepoix.ConstructionSite;

/**
 * An unrecoverable fault that bypasses the typed error channel: a total thunk that raised,
 * an error rejected by {@code refineToOrDie}, or a fatal VM error.
 */
public class DefectException extends RuntimeException {
    private final ConstructionSite site;

    public DefectException(ConstructionSite site, Throwable cause) {
        super("Defect in " + site + ": " + cause, cause);
        this.site = site;
    }

    public ConstructionSite site() {
        return site;
    }
}

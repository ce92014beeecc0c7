package com.querywatch.service.core.error;

import java.util.Locale;

/**
 * Connectivity, timeout or execution failure of the log store. Carries the operation only; query
 * text and bound values stay out of the message.
 */
public class LogStoreException extends RuntimeException {

    private final StoreOperation operation;

    public LogStoreException(StoreOperation operation, Throwable cause) {
        super("Log store call failed during " + operation.name().toLowerCase(Locale.ROOT), cause);
        this.operation = operation;
    }

    public StoreOperation operation() {
        return operation;
    }
}

package com.vlrnotify.domain.ports;

/**
 * Raised when the event or guild storage cannot complete an operation.
 */
public class EventStoreException extends RuntimeException {

    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.hybridorm.core;

/**
 * The remote resource could not be reached or answered with an unreadable body.
 * HTTP error statuses are reported through {@link RemoteResponse} instead.
 */
public class RemoteUnavailableException extends StoreException {
    public RemoteUnavailableException(String message) {
        super(message);
    }

    public RemoteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

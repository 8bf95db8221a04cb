package io.sweepmesh.storage;

/**
 * Infrastructure failure of the persistent store. Callers treat it as fatal for the current run.
 */
public final class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.operaton.trainload.exception;

/**
 * Exception thrown when stored state cannot be serialized or read back.
 */
public class StoredStateException extends RuntimeException {

    public StoredStateException(String message) {
        super(message);
    }

    public StoredStateException(String message, Throwable cause) {
        super(message, cause);
    }
}

package org.operaton.trainload.exception;

/**
 * Exception thrown when a computation receives a parameter that would make its result meaningless,
 * such as a non-positive time constant.
 */
public class InvalidLoadParameterException extends RuntimeException {

    public InvalidLoadParameterException(String message) {
        super(message);
    }

    public InvalidLoadParameterException(String message, Throwable cause) {
        super(message, cause);
    }
}

package net.javahippie.liftlog.exception;

/**
 * Exception thrown when a request is malformed or violates an input constraint.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}

package net.javahippie.liftlog.exception;

/**
 * Exception thrown when a referenced workout, set, badge or notification does not exist.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

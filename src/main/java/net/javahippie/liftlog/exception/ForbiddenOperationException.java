package net.javahippie.liftlog.exception;

/**
 * Exception thrown when the caller may not act on the targeted user or resource.
 */
public class ForbiddenOperationException extends RuntimeException {

    public ForbiddenOperationException(String message) {
        super(message);
    }

    public ForbiddenOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}

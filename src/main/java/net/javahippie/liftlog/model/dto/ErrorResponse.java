package net.javahippie.liftlog.model.dto;

/**
 * Error body returned by every failing API call.
 */
public record ErrorResponse(String error, String message) {
}

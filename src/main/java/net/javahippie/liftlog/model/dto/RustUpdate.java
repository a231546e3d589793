package net.javahippie.liftlog.model.dto;

/**
 * A badge whose rust state flipped during a rust check.
 */
public record RustUpdate(String badgeCode, boolean wasRusty, boolean isNowRusty, long daysSinceActivity) {
}

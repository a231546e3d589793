package net.javahippie.liftlog.model.dto;

import java.time.Instant;

/**
 * A badge granted by the current unlock run.
 */
public record UnlockedBadgeDTO(String code, String title, String description, Instant earnedAt) {
}

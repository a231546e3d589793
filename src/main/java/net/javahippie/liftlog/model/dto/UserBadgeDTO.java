package net.javahippie.liftlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.UserBadge;

import java.time.Instant;

/**
 * DTO for an earned badge, joined with its achievement definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserBadgeDTO {

    private String code;
    private String title;
    private String description;
    private String iconUrl;
    private Instant earnedAt;
    private boolean rusty;
    private Instant lastMaintainedAt;

    /**
     * Creates a DTO from a badge and its achievement, which may be missing from the catalog.
     */
    public static UserBadgeDTO fromEntity(UserBadge badge, Achievement achievement) {
        UserBadgeDTOBuilder builder = UserBadgeDTO.builder()
            .code(badge.getAchievementCode())
            .earnedAt(badge.getEarnedAt())
            .rusty(badge.isRusty())
            .lastMaintainedAt(badge.getLastMaintainedAt());
        if (achievement != null) {
            builder.title(achievement.getTitle())
                .description(achievement.getDescription())
                .iconUrl(achievement.getIconUrl());
        }
        return builder.build();
    }
}

package net.javahippie.liftlog.model.dto;

import java.util.List;

public record BadgeUnlockResult(List<UnlockedBadgeDTO> newBadges, int badgeCount) {

    public static BadgeUnlockResult of(List<UnlockedBadgeDTO> newBadges) {
        return new BadgeUnlockResult(newBadges, newBadges.size());
    }
}

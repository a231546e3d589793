package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.UserLevel;
import net.javahippie.liftlog.repository.UserLevelRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * LEVEL_*: the cached level. A user without a cache row counts as level 0.
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class LevelRule implements BadgeRule {

    static final String PREFIX = "LEVEL_";

    private final UserLevelRepository userLevelRepository;

    @Override
    public boolean supports(Achievement achievement) {
        return achievement.getCode().startsWith(PREFIX);
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        int level = userLevelRepository.findById(userId)
            .map(UserLevel::getLevel)
            .orElse(0);
        return level >= achievement.thresholdOr(1);
    }
}

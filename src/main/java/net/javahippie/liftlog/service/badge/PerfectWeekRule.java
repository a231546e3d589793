package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.UserActivityWeekRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * PERFECT_WEEK_*: some week in which the user completed at least the threshold of workouts.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class PerfectWeekRule implements BadgeRule {

    static final String PREFIX = "PERFECT_WEEK_";

    private final UserActivityWeekRepository activityWeekRepository;
    private final GamificationProperties properties;

    @Override
    public boolean supports(Achievement achievement) {
        return achievement.getCode().startsWith(PREFIX);
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        int fallback = properties.perfectWeekThresholds().getOrDefault(achievement.getCode(), Integer.MAX_VALUE);
        int threshold = achievement.thresholdOr(fallback);
        return activityWeekRepository.findMaxWorkoutsCompletedByUserId(userId) >= threshold;
    }
}

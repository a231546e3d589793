package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.UserStreakLogRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Streak badges.
 * {@code WEEKLY_<n>_x<k>} needs a run of k weeks of streak type {@code WEEKLY_<n>};
 * {@code CONSISTENCY_<k>} needs k weeks of {@code WEEKLY_ANY}. Broken runs count too.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class WeeklyStreakRule implements BadgeRule {

    private static final Pattern WEEKLY = Pattern.compile("^(WEEKLY_[A-Z0-9]+)_x(\\d+)$");
    private static final Pattern CONSISTENCY = Pattern.compile("^CONSISTENCY_(\\d+)$");

    private final UserStreakLogRepository streakLogRepository;

    @Override
    public boolean supports(Achievement achievement) {
        return WEEKLY.matcher(achievement.getCode()).matches()
            || CONSISTENCY.matcher(achievement.getCode()).matches();
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        String streakType;
        int weeksInCode;

        Matcher weekly = WEEKLY.matcher(achievement.getCode());
        if (weekly.matches()) {
            streakType = weekly.group(1);
            weeksInCode = Integer.parseInt(weekly.group(2));
        } else {
            Matcher consistency = CONSISTENCY.matcher(achievement.getCode());
            if (!consistency.matches()) {
                return false;
            }
            streakType = GamificationProperties.WEEKLY_ANY;
            weeksInCode = Integer.parseInt(consistency.group(1));
        }

        return streakLogRepository.findLongestStreak(userId, streakType) >= achievement.thresholdOr(weeksInCode);
    }
}

package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.BadgeRustResult;
import net.javahippie.liftlog.model.dto.RustUpdate;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.UserBadge;
import net.javahippie.liftlog.repository.AchievementRepository;
import net.javahippie.liftlog.repository.UserBadgeRepository;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Badge decay and restoration.
 *
 * <p>A badge rusts once the days since its maintaining activity exceed the threshold of its
 * code, and becomes shiny again when activity resumes. Badges with a threshold of
 * {@link GamificationProperties#NEVER_RUSTS} are exempt.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BadgeRustService {

    private static final List<String> WORKOUT_MAINTAINED = List.of(
        "FIRST_WORKOUT", "WORKOUT_", "WEEKLY_", "CONSISTENCY_", "LEVEL_");
    private static final List<String> PR_MAINTAINED = List.of("FIRST_PR", "PR_COUNT_");

    private final UserBadgeRepository userBadgeRepository;
    private final AchievementRepository achievementRepository;
    private final WorkoutRepository workoutRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final NotificationService notificationService;
    private final UserLockService userLockService;
    private final GamificationProperties properties;
    private final Clock clock;

    /**
     * Re-evaluate the rust state of all of a user's badges.
     * At most one aggregate notification is created for newly rusted badges and one for polished ones.
     *
     * @param userId the user ID
     * @return the flipped badges
     */
    @Transactional
    public BadgeRustResult checkBadgeRust(UUID userId) {
        userLockService.lockUser(userId);

        List<UserBadge> badges = userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId);
        if (badges.isEmpty()) {
            return new BadgeRustResult(0, List.of(), List.of(), List.of());
        }

        Optional<Instant> lastWorkoutEnd = workoutRepository.findLatestFinishedAt(userId);
        Instant now = clock.instant();

        List<RustUpdate> updates = new ArrayList<>();
        List<String> newlyRusted = new ArrayList<>();
        List<String> polished = new ArrayList<>();

        for (UserBadge badge : badges) {
            int threshold = properties.rustThresholdDays(badge.getAchievementCode());
            if (threshold == GamificationProperties.NEVER_RUSTS) {
                continue;
            }

            Instant lastActivity = badge.getLastMaintainedAt() != null
                ? badge.getLastMaintainedAt()
                : lastWorkoutEnd.orElse(null);
            if (lastActivity == null) {
                log.debug("No activity reference for badge {} of user {}, skipping", badge.getAchievementCode(), userId);
                continue;
            }

            long daysSinceActivity = Math.floorDiv(Duration.between(lastActivity, now).toMillis(), Duration.ofDays(1).toMillis());
            boolean shouldBeRusty = daysSinceActivity > threshold;
            if (shouldBeRusty == badge.isRusty()) {
                continue;
            }

            updates.add(new RustUpdate(badge.getAchievementCode(), badge.isRusty(), shouldBeRusty, daysSinceActivity));
            badge.setRusty(shouldBeRusty);
            userBadgeRepository.save(badge);

            if (shouldBeRusty) {
                newlyRusted.add(badge.getAchievementCode());
            } else {
                polished.add(badge.getAchievementCode());
            }
        }

        if (!newlyRusted.isEmpty()) {
            notificationService.createBadgeRustNotification(userId, newlyRusted);
            log.info("Badges of user {} became rusty: {}", userId, newlyRusted);
        }
        if (!polished.isEmpty()) {
            notificationService.createBadgesPolishedNotification(userId, polished);
            log.info("Badges of user {} are shiny again: {}", userId, polished);
        }

        return new BadgeRustResult(badges.size(), updates, newlyRusted, polished);
    }

    /**
     * Clear rust from one badge and restart its maintenance clock.
     *
     * @param userId the badge owner
     * @param achievementCode the badge's achievement code
     * @throws ResourceNotFoundException if the user does not hold the badge
     */
    @Transactional
    public void polishBadge(UUID userId, String achievementCode) {
        userLockService.lockUser(userId);

        UserBadge badge = userBadgeRepository.findByUserIdAndAchievementCode(userId, achievementCode)
            .filter(b -> b.getDeletedAt() == null)
            .orElseThrow(() -> new ResourceNotFoundException(
                "Badge " + achievementCode + " not found for user " + userId));

        badge.polish(clock.instant());
        userBadgeRepository.save(badge);
        log.debug("Polished badge {} of user {}", achievementCode, userId);
    }

    /**
     * Polish the badges a finished workout maintains: workout-count and streak badges,
     * personal record badges when the workout set new records, and the badges of every
     * muscle group it trained.
     *
     * @param userId the workout owner
     * @param workoutId the finished workout
     * @param newPersonalRecords number of records the workout set
     * @return codes of badges that were rusty and are shiny again
     */
    @Transactional
    public List<String> polishMaintainedBadges(UUID userId, UUID workoutId, int newPersonalRecords) {
        userLockService.lockUser(userId);

        List<UserBadge> badges = userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId);
        if (badges.isEmpty()) {
            return List.of();
        }

        Set<String> trainedGroups = workoutSetRepository.findMuscleGroupsByWorkoutId(workoutId).stream()
            .map(group -> group.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        Map<String, Achievement> achievements = achievementRepository
            .findAllById(badges.stream().map(UserBadge::getAchievementCode).toList())
            .stream()
            .collect(Collectors.toMap(Achievement::getCode, Function.identity()));

        Instant now = clock.instant();
        List<String> restored = new ArrayList<>();
        int maintained = 0;
        for (UserBadge badge : badges) {
            String code = badge.getAchievementCode();
            boolean maintainedByWorkout = matchesAny(code, WORKOUT_MAINTAINED);
            boolean maintainedByRecords = newPersonalRecords > 0 && matchesAny(code, PR_MAINTAINED);
            Achievement achievement = achievements.get(code);
            boolean maintainedByMuscleGroup = achievement != null
                && achievement.getRelevantMuscleGroup() != null
                && trainedGroups.contains(achievement.getRelevantMuscleGroup().toLowerCase(Locale.ROOT));

            if (!maintainedByWorkout && !maintainedByRecords && !maintainedByMuscleGroup) {
                continue;
            }
            if (badge.isRusty()) {
                restored.add(code);
            }
            badge.polish(now);
            userBadgeRepository.save(badge);
            maintained++;
        }

        log.debug("Workout {} maintained {} badges of user {}", workoutId, maintained, userId);
        return restored;
    }

    private static boolean matchesAny(String code, List<String> prefixes) {
        return prefixes.stream().anyMatch(code::startsWith);
    }
}

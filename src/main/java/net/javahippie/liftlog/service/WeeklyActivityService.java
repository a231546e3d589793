package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.exception.InvalidRequestException;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.ActivityWeekDTO;
import net.javahippie.liftlog.model.dto.WeeklyActivityResult;
import net.javahippie.liftlog.model.entity.ActivityWeekEntry;
import net.javahippie.liftlog.model.entity.UserActivityWeek;
import net.javahippie.liftlog.model.entity.UserStreakLog;
import net.javahippie.liftlog.model.entity.Workout;
import net.javahippie.liftlog.model.entity.WorkoutSet;
import net.javahippie.liftlog.repository.ActivityWeekEntryRepository;
import net.javahippie.liftlog.repository.UserActivityWeekRepository;
import net.javahippie.liftlog.repository.UserStreakLogRepository;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for weekly training aggregates and weekly streaks.
 *
 * <p>Weeks start on Monday in the workout's own time zone. A streak counts consecutive weeks
 * that reach a workout threshold; it only breaks when a later qualifying week reveals a gap,
 * never proactively.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WeeklyActivityService {

    private static final int DAYS_PER_WEEK = 7;

    private final WorkoutRepository workoutRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final UserActivityWeekRepository activityWeekRepository;
    private final ActivityWeekEntryRepository activityWeekEntryRepository;
    private final UserStreakLogRepository streakLogRepository;
    private final UserLockService userLockService;
    private final GamificationProperties properties;

    /**
     * Count a workout into its training week and update the user's streaks.
     * Tracking the same workout again refreshes the week without counting it twice.
     *
     * @param userId the workout owner
     * @param workoutId the workout to count
     * @param timezoneHint IANA zone used when the workout carries none, may be null
     * @return the updated week, touched streak lengths and qualifying perfect-week codes
     * @throws ResourceNotFoundException if the workout does not exist
     * @throws ForbiddenOperationException if the workout belongs to another user
     * @throws InvalidRequestException if the workout is not finished or the time zone is unknown
     */
    @Transactional
    public WeeklyActivityResult trackWeeklyActivity(UUID userId, UUID workoutId, String timezoneHint) {
        Workout workout = workoutRepository.findByIdAndDeletedAtIsNull(workoutId)
            .orElseThrow(() -> new ResourceNotFoundException("Workout not found: " + workoutId));
        if (!workout.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Workout " + workoutId + " does not belong to user " + userId);
        }
        if (!workout.isFinished()) {
            throw new InvalidRequestException("Workout " + workoutId + " is not finished");
        }
        ZoneId zone = resolveZone(workout.getLocalTimezone(), timezoneHint);

        userLockService.lockUser(userId);

        LocalDate weekStart = weekStartOf(workout.getStartedAt(), zone);
        UserActivityWeek week = activityWeekRepository.findByUserIdAndWeekStart(userId, weekStart)
            .orElseGet(() -> UserActivityWeek.builder()
                .userId(userId)
                .weekStart(weekStart)
                .build());

        if (activityWeekEntryRepository.existsByUserIdAndWorkoutId(userId, workoutId)) {
            log.debug("Workout {} already counted into week {} of user {}", workoutId, weekStart, userId);
        } else {
            List<WorkoutSet> sets = workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workoutId);
            BigDecimal volume = sets.stream()
                .map(WorkoutSet::getVolumeKg)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

            week.setWorkoutsCompleted(week.getWorkoutsCompleted() + 1);
            week.setTotalSets(week.getTotalSets() + sets.size());
            week.setTotalVolumeKg(week.getTotalVolumeKg().add(volume));

            activityWeekEntryRepository.save(ActivityWeekEntry.builder()
                .userId(userId)
                .workoutId(workoutId)
                .weekStart(weekStart)
                .build());
        }
        week.setActiveDays(countActiveDays(userId, weekStart, zone));
        UserActivityWeek saved = activityWeekRepository.save(week);
        int workoutsCompleted = saved.getWorkoutsCompleted();

        Map<String, Integer> streaks = updateStreaks(userId, weekStart, workoutsCompleted);
        List<String> perfectWeekBadges = properties.perfectWeekThresholds().entrySet().stream()
            .filter(entry -> workoutsCompleted >= entry.getValue())
            .map(Map.Entry::getKey)
            .toList();

        log.info("Tracked workout {} into week {} of user {}: {} workouts on {} days",
            workoutId, weekStart, userId, workoutsCompleted, saved.getActiveDays());

        return new WeeklyActivityResult(ActivityWeekDTO.fromEntity(saved), streaks, perfectWeekBadges);
    }

    /**
     * Monday of the local calendar week the instant falls into.
     *
     * @param instant the workout start
     * @param zone the workout's zone
     * @return the week start date
     */
    public static LocalDate weekStartOf(Instant instant, ZoneId zone) {
        return LocalDate.ofInstant(instant, zone).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    private Map<String, Integer> updateStreaks(UUID userId, LocalDate weekStart, int workoutsThisWeek) {
        Map<String, Integer> touched = new LinkedHashMap<>();

        for (Map.Entry<String, Integer> threshold : properties.streakThresholds().entrySet()) {
            if (workoutsThisWeek < threshold.getValue()) {
                continue;
            }
            String streakType = threshold.getKey();
            Optional<UserStreakLog> active = streakLogRepository.findByUserIdAndStreakTypeAndActiveTrue(userId, streakType);

            if (active.isEmpty()) {
                touched.put(streakType, startStreak(userId, streakType, weekStart).getStreakLength());
                continue;
            }

            UserStreakLog streak = active.get();
            long daysSinceLastWeek = ChronoUnit.DAYS.between(streak.getWeekEnded(), weekStart);
            if (daysSinceLastWeek == DAYS_PER_WEEK) {
                streak.setStreakLength(streak.getStreakLength() + 1);
                streak.setWeekEnded(weekStart);
                streakLogRepository.save(streak);
                log.info("Streak {} of user {} extended to {} weeks", streakType, userId, streak.getStreakLength());
                touched.put(streakType, streak.getStreakLength());
            } else if (daysSinceLastWeek == 0) {
                touched.put(streakType, streak.getStreakLength());
            } else {
                streak.setActive(false);
                streakLogRepository.save(streak);
                log.info("Streak {} of user {} broke after {} weeks", streakType, userId, streak.getStreakLength());
                touched.put(streakType, startStreak(userId, streakType, weekStart).getStreakLength());
            }
        }
        return touched;
    }

    private UserStreakLog startStreak(UUID userId, String streakType, LocalDate weekStart) {
        UserStreakLog streak = UserStreakLog.builder()
            .userId(userId)
            .streakType(streakType)
            .streakLength(1)
            .weekEnded(weekStart)
            .active(true)
            .build();
        streakLogRepository.save(streak);
        log.debug("Started streak {} for user {} in week {}", streakType, userId, weekStart);
        return streak;
    }

    private int countActiveDays(UUID userId, LocalDate weekStart, ZoneId zone) {
        Instant from = weekStart.atStartOfDay(zone).toInstant();
        Instant to = weekStart.plusDays(DAYS_PER_WEEK).atStartOfDay(zone).toInstant();
        return (int) workoutRepository.findActiveByUserIdStartedBetween(userId, from, to).stream()
            .map(w -> LocalDate.ofInstant(w.getStartedAt(), zone))
            .distinct()
            .count();
    }

    private ZoneId resolveZone(String workoutZone, String timezoneHint) {
        String zoneId = workoutZone != null && !workoutZone.isBlank() ? workoutZone : timezoneHint;
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            throw new InvalidRequestException("Unknown time zone: " + zoneId, e);
        }
    }
}

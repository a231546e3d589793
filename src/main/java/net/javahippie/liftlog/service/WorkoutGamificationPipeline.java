package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.BadgeUnlockResult;
import net.javahippie.liftlog.model.dto.GamificationSummary;
import net.javahippie.liftlog.model.dto.LevelProgress;
import net.javahippie.liftlog.model.dto.PersonalRecordResult;
import net.javahippie.liftlog.model.dto.UnlockedBadgeDTO;
import net.javahippie.liftlog.model.dto.WeeklyActivityResult;
import net.javahippie.liftlog.model.dto.XpAwardResult;
import net.javahippie.liftlog.model.entity.Workout;
import net.javahippie.liftlog.model.entity.WorkoutSet;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Runs every gamification step for a saved workout, in order:
 * XP, level, personal records, weekly activity, badge unlocks and badge maintenance.
 *
 * Each step is an idempotent service call with its own transaction, so the whole
 * sequence can be repeated safely. A failing step is logged and listed in
 * {@link GamificationSummary#getFailedStages()}; the following steps still run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkoutGamificationPipeline {

    static final String STAGE_XP = "AWARD_XP";
    static final String STAGE_LEVEL = "CALCULATE_LEVEL";
    static final String STAGE_PRS = "DETECT_PRS";
    static final String STAGE_WEEKLY = "TRACK_WEEKLY_ACTIVITY";
    static final String STAGE_BADGES = "UNLOCK_BADGES";
    static final String STAGE_POLISH = "POLISH_BADGES";

    private final WorkoutRepository workoutRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final XpLedgerService xpLedgerService;
    private final LevelService levelService;
    private final PersonalRecordService personalRecordService;
    private final WeeklyActivityService weeklyActivityService;
    private final BadgeService badgeService;
    private final BadgeRustService badgeRustService;

    /**
     * Process a workout for the given user.
     *
     * @param userId the authenticated user
     * @param workoutId the workout to process
     * @return what the workout earned
     * @throws ResourceNotFoundException if the workout does not exist
     * @throws ForbiddenOperationException if the workout belongs to another user
     */
    public GamificationSummary process(UUID userId, UUID workoutId) {
        Workout workout = workoutRepository.findByIdAndDeletedAtIsNull(workoutId)
            .orElseThrow(() -> new ResourceNotFoundException("Workout not found: " + workoutId));
        if (!workout.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Workout " + workoutId + " does not belong to user " + userId);
        }

        log.info("Processing workout {} of user {}", workoutId, userId);
        GamificationSummary summary = GamificationSummary.builder()
            .workoutId(workoutId)
            .build();

        LevelProgress levelBefore = null;
        try {
            levelBefore = levelService.getLevel(userId);
        } catch (Exception e) {
            log.warn("Could not read level of user {} before processing: {}", userId, e.getMessage());
        }

        awardXp(userId, workoutId, summary);
        calculateLevel(userId, levelBefore, summary);
        detectPersonalRecords(userId, workoutId, summary);
        trackWeeklyActivity(userId, workout, summary);
        unlockBadges(userId, summary);
        polishBadges(userId, workout, summary);

        if (summary.getFailedStages().isEmpty()) {
            log.info("Completed processing of workout {}: {} XP, {} PRs, {} new badges",
                workoutId, summary.getXpAwarded(), summary.getPrCount(), summary.getBadgesUnlocked().size());
        } else {
            log.warn("Processed workout {} with failed stages {}", workoutId, summary.getFailedStages());
        }
        return summary;
    }

    private void awardXp(UUID userId, UUID workoutId, GamificationSummary summary) {
        try {
            List<UUID> setIds = workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workoutId)
                .stream()
                .map(WorkoutSet::getId)
                .toList();
            if (setIds.isEmpty()) {
                log.debug("Workout {} has no sets, skipping XP", workoutId);
                return;
            }
            XpAwardResult result = xpLedgerService.awardXp(userId, setIds);
            summary.setXpAwarded(result.xpAwarded());
        } catch (Exception e) {
            failed(STAGE_XP, workoutId, e, summary);
        }
    }

    private void calculateLevel(UUID userId, LevelProgress levelBefore, GamificationSummary summary) {
        try {
            LevelProgress level = levelService.recalculateLevel(userId);
            summary.setLevel(level);
            summary.setLevelUp(levelBefore != null && level.level() > levelBefore.level());
        } catch (Exception e) {
            failed(STAGE_LEVEL, summary.getWorkoutId(), e, summary);
        }
    }

    private void detectPersonalRecords(UUID userId, UUID workoutId, GamificationSummary summary) {
        try {
            List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);
            summary.setPrCount(records.size());
        } catch (Exception e) {
            failed(STAGE_PRS, workoutId, e, summary);
        }
    }

    private void trackWeeklyActivity(UUID userId, Workout workout, GamificationSummary summary) {
        if (!workout.isFinished()) {
            return;
        }
        try {
            WeeklyActivityResult result = weeklyActivityService.trackWeeklyActivity(userId, workout.getId(), null);
            summary.getStreaks().putAll(result.streaks());
            summary.getPerfectWeekBadges().addAll(result.perfectWeekBadges());
        } catch (Exception e) {
            failed(STAGE_WEEKLY, workout.getId(), e, summary);
        }
    }

    private void unlockBadges(UUID userId, GamificationSummary summary) {
        try {
            BadgeUnlockResult result = badgeService.unlockBadges(userId);
            result.newBadges().stream()
                .map(UnlockedBadgeDTO::code)
                .forEach(summary.getBadgesUnlocked()::add);
        } catch (Exception e) {
            failed(STAGE_BADGES, summary.getWorkoutId(), e, summary);
        }
    }

    private void polishBadges(UUID userId, Workout workout, GamificationSummary summary) {
        if (!workout.isFinished()) {
            return;
        }
        try {
            List<String> polished = badgeRustService.polishMaintainedBadges(userId, workout.getId(), summary.getPrCount());
            summary.getBadgesPolished().addAll(polished);
        } catch (Exception e) {
            failed(STAGE_POLISH, workout.getId(), e, summary);
        }
    }

    private void failed(String stage, UUID workoutId, Exception e, GamificationSummary summary) {
        log.error("Stage {} failed for workout {}: {}", stage, workoutId, e.getMessage(), e);
        summary.getFailedStages().add(stage);
    }
}

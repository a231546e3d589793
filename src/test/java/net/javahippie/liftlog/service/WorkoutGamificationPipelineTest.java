package net.javahippie.liftlog.service;

import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.model.dto.ActivityWeekDTO;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WorkoutGamificationPipeline.
 * Tests stage ordering, the summary and failure isolation between stages.
 */
@ExtendWith(MockitoExtension.class)
class WorkoutGamificationPipelineTest {

    @Mock
    private WorkoutRepository workoutRepository;

    @Mock
    private WorkoutSetRepository workoutSetRepository;

    @Mock
    private XpLedgerService xpLedgerService;

    @Mock
    private LevelService levelService;

    @Mock
    private PersonalRecordService personalRecordService;

    @Mock
    private WeeklyActivityService weeklyActivityService;

    @Mock
    private BadgeService badgeService;

    @Mock
    private BadgeRustService badgeRustService;

    @InjectMocks
    private WorkoutGamificationPipeline pipeline;

    private UUID userId;
    private Workout workout;
    private WorkoutSet set;

    @BeforeEach
    void setUp() {
        userId = UUID.randomUUID();
        workout = Workout.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .startedAt(Instant.parse("2025-06-04T09:00:00Z"))
            .endedAt(Instant.parse("2025-06-04T10:00:00Z"))
            .build();
        set = WorkoutSet.builder().id(UUID.randomUUID()).workoutId(workout.getId()).exerciseId(UUID.randomUUID()).build();
    }

    @Test
    @DisplayName("Should run every stage and summarize the first workout")
    void testProcess_AllStages() {
        // Given
        givenWorkoutWithSet();
        when(levelService.getLevel(userId)).thenReturn(new LevelProgress(0, 1, 100));
        when(xpLedgerService.awardXp(userId, List.of(set.getId()))).thenReturn(new XpAwardResult(60, 60));
        when(levelService.recalculateLevel(userId)).thenReturn(new LevelProgress(60, 1, 40));
        when(personalRecordService.detectPersonalRecords(userId, workout.getId())).thenReturn(List.of(
            new PersonalRecordResult(set.getExerciseId(), set.getId(), 100.0, 0.0, 100.0)));
        when(weeklyActivityService.trackWeeklyActivity(userId, workout.getId(), null)).thenReturn(
            new WeeklyActivityResult(new ActivityWeekDTO(), Map.of("WEEKLY_ANY", 1), List.of()));
        when(badgeService.unlockBadges(userId)).thenReturn(BadgeUnlockResult.of(List.of(
            new UnlockedBadgeDTO("FIRST_PR", "New Personal Best", null, Instant.now()),
            new UnlockedBadgeDTO("FIRST_WORKOUT", "First Rep", null, Instant.now()))));
        when(badgeRustService.polishMaintainedBadges(userId, workout.getId(), 1)).thenReturn(List.of());

        // When
        GamificationSummary summary = pipeline.process(userId, workout.getId());

        // Then
        assertEquals(60, summary.getXpAwarded());
        assertEquals(1, summary.getLevel().level());
        assertFalse(summary.isLevelUp());
        assertEquals(1, summary.getPrCount());
        assertEquals(1, summary.getStreaks().get("WEEKLY_ANY"));
        assertEquals(List.of("FIRST_PR", "FIRST_WORKOUT"), summary.getBadgesUnlocked());
        assertTrue(summary.getFailedStages().isEmpty());
    }

    @Test
    @DisplayName("Should record a failed stage and still run the later ones")
    void testProcess_StageFailure() {
        // Given
        givenWorkoutWithSet();
        when(levelService.getLevel(userId)).thenReturn(new LevelProgress(90, 1, 10));
        when(xpLedgerService.awardXp(any(), any())).thenReturn(new XpAwardResult(20, 110));
        when(levelService.recalculateLevel(userId)).thenReturn(new LevelProgress(110, 2, 290));
        when(personalRecordService.detectPersonalRecords(userId, workout.getId()))
            .thenThrow(new DataAccessResourceFailureException("database unavailable"));
        when(weeklyActivityService.trackWeeklyActivity(userId, workout.getId(), null)).thenReturn(
            new WeeklyActivityResult(new ActivityWeekDTO(), Map.of(), List.of()));
        when(badgeService.unlockBadges(userId)).thenReturn(BadgeUnlockResult.of(List.of()));
        when(badgeRustService.polishMaintainedBadges(userId, workout.getId(), 0)).thenReturn(List.of("WORKOUT_10"));

        // When
        GamificationSummary summary = pipeline.process(userId, workout.getId());

        // Then
        assertEquals(List.of(WorkoutGamificationPipeline.STAGE_PRS), summary.getFailedStages());
        assertTrue(summary.isLevelUp());
        assertEquals(0, summary.getPrCount());
        assertEquals(List.of("WORKOUT_10"), summary.getBadgesPolished());
        verify(badgeService).unlockBadges(userId);
    }

    @Test
    @DisplayName("Should neither count the week nor polish badges for unfinished workouts")
    void testProcess_UnfinishedWorkout() {
        // Given
        workout.setEndedAt(null);
        when(workoutRepository.findByIdAndDeletedAtIsNull(workout.getId())).thenReturn(Optional.of(workout));
        when(workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workout.getId()))
            .thenReturn(List.of());
        when(levelService.getLevel(userId)).thenReturn(new LevelProgress(0, 1, 100));
        when(levelService.recalculateLevel(userId)).thenReturn(new LevelProgress(0, 1, 100));
        when(personalRecordService.detectPersonalRecords(userId, workout.getId())).thenReturn(List.of());
        when(badgeService.unlockBadges(userId)).thenReturn(BadgeUnlockResult.of(List.of()));

        // When
        GamificationSummary summary = pipeline.process(userId, workout.getId());

        // Then
        assertTrue(summary.getFailedStages().isEmpty());
        assertTrue(summary.getStreaks().isEmpty());
        verifyNoInteractions(xpLedgerService, weeklyActivityService, badgeRustService);
    }

    @Test
    @DisplayName("Should reject another user's workout before running any stage")
    void testProcess_ForeignWorkout() {
        // Given
        when(workoutRepository.findByIdAndDeletedAtIsNull(workout.getId())).thenReturn(Optional.of(workout));

        // When / Then
        assertThrows(ForbiddenOperationException.class, () -> pipeline.process(UUID.randomUUID(), workout.getId()));
        verifyNoInteractions(xpLedgerService, levelService, badgeService);
    }

    private void givenWorkoutWithSet() {
        when(workoutRepository.findByIdAndDeletedAtIsNull(workout.getId())).thenReturn(Optional.of(workout));
        when(workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workout.getId()))
            .thenReturn(List.of(set));
    }
}

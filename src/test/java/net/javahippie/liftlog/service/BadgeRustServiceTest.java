package net.javahippie.liftlog.service;

import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.BadgeRustResult;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.UserBadge;
import net.javahippie.liftlog.repository.AchievementRepository;
import net.javahippie.liftlog.repository.UserBadgeRepository;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BadgeRustService.
 * Tests the rust boundary, aggregate notifications and polishing.
 */
@ExtendWith(MockitoExtension.class)
class BadgeRustServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-30T12:00:00Z");

    @Mock
    private UserBadgeRepository userBadgeRepository;

    @Mock
    private AchievementRepository achievementRepository;

    @Mock
    private WorkoutRepository workoutRepository;

    @Mock
    private WorkoutSetRepository workoutSetRepository;

    @Mock
    private NotificationService notificationService;

    @Mock
    private UserLockService userLockService;

    private BadgeRustService badgeRustService;

    private UUID userId;

    @BeforeEach
    void setUp() {
        badgeRustService = new BadgeRustService(userBadgeRepository, achievementRepository, workoutRepository,
            workoutSetRepository, notificationService, userLockService, GamificationProperties.defaults(),
            Clock.fixed(NOW, ZoneOffset.UTC));
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Workout badge stays shiny at exactly 14 days and rusts at 15")
    void testCheckBadgeRust_Boundary() {
        // Given
        UserBadge fourteenDays = badge("WORKOUT_10", NOW.minus(Duration.ofDays(14)), false);
        UserBadge fifteenDays = badge("FIRST_WORKOUT", NOW.minus(Duration.ofDays(15)), false);
        givenBadges(fourteenDays, fifteenDays);

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(2, result.checkedBadges());
        assertEquals(List.of("FIRST_WORKOUT"), result.newlyRusted());
        assertTrue(result.polished().isEmpty());
        assertEquals(1, result.updates().size());
        assertEquals(15, result.updates().get(0).daysSinceActivity());
        assertFalse(fourteenDays.isRusty());
        assertTrue(fifteenDays.isRusty());
        verify(userBadgeRepository).save(fifteenDays);
        verify(userBadgeRepository, never()).save(fourteenDays);
    }

    @Test
    @DisplayName("Should send one notification for several rusted badges")
    void testCheckBadgeRust_AggregateNotification() {
        // Given
        givenBadges(
            badge("WORKOUT_10", NOW.minus(Duration.ofDays(20)), false),
            badge("WEEKLY_3_x4", NOW.minus(Duration.ofDays(20)), false),
            badge("CHEST_MASTER", NOW.minus(Duration.ofDays(25)), false));

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(3, result.newlyRusted().size());
        verify(notificationService, times(1)).createBadgeRustNotification(userId, result.newlyRusted());
        verify(notificationService, never()).createBadgesPolishedNotification(any(), anyList());
    }

    @Test
    @DisplayName("Should polish rusty badges whose activity resumed")
    void testCheckBadgeRust_Polished() {
        // Given
        UserBadge recovered = badge("FIRST_PR", NOW.minus(Duration.ofDays(2)), true);
        givenBadges(recovered);

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(List.of("FIRST_PR"), result.polished());
        assertFalse(recovered.isRusty());
        assertTrue(result.updates().get(0).wasRusty());
        assertFalse(result.updates().get(0).isNowRusty());
        verify(notificationService).createBadgesPolishedNotification(userId, List.of("FIRST_PR"));
        verify(notificationService, never()).createBadgeRustNotification(any(), anyList());
    }

    @Test
    @DisplayName("Perfect week badges never rust")
    void testCheckBadgeRust_NeverRusts() {
        // Given
        givenBadges(
            badge("PERFECT_WEEK_5", NOW.minus(Duration.ofDays(400)), false),
            badge("PERFECT_WEEK_6", NOW.minus(Duration.ofDays(400)), false));

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(2, result.checkedBadges());
        assertTrue(result.updates().isEmpty());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Falls back to the latest finished workout when a badge was never maintained")
    void testCheckBadgeRust_FallsBackToLatestWorkout() {
        // Given
        UserBadge badge = badge("WORKOUT_10", null, false);
        when(userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId)).thenReturn(List.of(badge));
        when(workoutRepository.findLatestFinishedAt(userId)).thenReturn(Optional.of(NOW.minus(Duration.ofDays(30))));

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(List.of("WORKOUT_10"), result.newlyRusted());
    }

    @Test
    @DisplayName("Skips badges without any activity reference")
    void testCheckBadgeRust_NoReference() {
        // Given
        when(userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId))
            .thenReturn(List.of(badge("WORKOUT_10", null, false)));
        when(workoutRepository.findLatestFinishedAt(userId)).thenReturn(Optional.empty());

        // When
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(1, result.checkedBadges());
        assertTrue(result.updates().isEmpty());
    }

    @Test
    @DisplayName("Polishing a badge clears rust and restarts the clock")
    void testPolishBadge() {
        // Given
        UserBadge rusty = badge("WORKOUT_10", NOW.minus(Duration.ofDays(40)), true);
        when(userBadgeRepository.findByUserIdAndAchievementCode(userId, "WORKOUT_10")).thenReturn(Optional.of(rusty));

        // When
        badgeRustService.polishBadge(userId, "WORKOUT_10");

        // Then
        assertFalse(rusty.isRusty());
        assertEquals(NOW, rusty.getLastMaintainedAt());
        verify(userBadgeRepository).save(rusty);
    }

    @Test
    @DisplayName("Polishing an unknown or deleted badge is 404")
    void testPolishBadge_NotFound() {
        // Given
        UserBadge deleted = badge("FIRST_PR", NOW, false);
        deleted.setDeletedAt(NOW);
        when(userBadgeRepository.findByUserIdAndAchievementCode(userId, "WORKOUT_10")).thenReturn(Optional.empty());
        when(userBadgeRepository.findByUserIdAndAchievementCode(userId, "FIRST_PR")).thenReturn(Optional.of(deleted));

        // When / Then
        assertThrows(ResourceNotFoundException.class, () -> badgeRustService.polishBadge(userId, "WORKOUT_10"));
        assertThrows(ResourceNotFoundException.class, () -> badgeRustService.polishBadge(userId, "FIRST_PR"));
        verify(userBadgeRepository, never()).save(any());
    }

    @Test
    @DisplayName("A finished workout maintains workout, record and muscle group badges")
    void testPolishMaintainedBadges() {
        // Given
        UUID workoutId = UUID.randomUUID();
        UserBadge workoutBadge = badge("WORKOUT_10", NOW.minus(Duration.ofDays(20)), true);
        UserBadge prBadge = badge("FIRST_PR", NOW.minus(Duration.ofDays(5)), false);
        UserBadge chest = badge("CHEST_MASTER", NOW.minus(Duration.ofDays(30)), true);
        UserBadge legs = badge("LEG_MASTER", NOW.minus(Duration.ofDays(30)), true);
        UserBadge perfectWeek = badge("PERFECT_WEEK_5", NOW.minus(Duration.ofDays(30)), false);
        when(userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId))
            .thenReturn(List.of(workoutBadge, prBadge, chest, legs, perfectWeek));
        when(workoutSetRepository.findMuscleGroupsByWorkoutId(workoutId)).thenReturn(List.of("chest"));
        when(achievementRepository.findAllById(anyList())).thenReturn(List.of(
            Achievement.builder().code("CHEST_MASTER").title("Chest Master").relevantMuscleGroup("chest").build(),
            Achievement.builder().code("LEG_MASTER").title("Leg Master").relevantMuscleGroup("legs").build()));

        // When
        List<String> restored = badgeRustService.polishMaintainedBadges(userId, workoutId, 0);

        // Then
        assertEquals(List.of("WORKOUT_10", "CHEST_MASTER"), restored);
        assertEquals(NOW, workoutBadge.getLastMaintainedAt());
        assertEquals(NOW, chest.getLastMaintainedAt());
        assertNotEquals(NOW, prBadge.getLastMaintainedAt());
        assertTrue(legs.isRusty());
        assertNotEquals(NOW, perfectWeek.getLastMaintainedAt());
    }

    @Test
    @DisplayName("Finished workouts keep level badges shiny")
    void testPolishMaintainedBadges_LevelBadge() {
        // Given
        UUID workoutId = UUID.randomUUID();
        UserBadge level = badge("LEVEL_5", NOW.minus(Duration.ofDays(40)), true);
        when(userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId)).thenReturn(List.of(level));
        when(workoutSetRepository.findMuscleGroupsByWorkoutId(workoutId)).thenReturn(List.of());
        when(achievementRepository.findAllById(anyList())).thenReturn(List.of());
        when(workoutRepository.findLatestFinishedAt(userId)).thenReturn(Optional.empty());

        // When
        List<String> restored = badgeRustService.polishMaintainedBadges(userId, workoutId, 1);
        BadgeRustResult result = badgeRustService.checkBadgeRust(userId);

        // Then
        assertEquals(List.of("LEVEL_5"), restored);
        assertEquals(NOW, level.getLastMaintainedAt());
        assertFalse(level.isRusty());
        assertTrue(result.newlyRusted().isEmpty());
        verify(notificationService, never()).createBadgeRustNotification(any(), anyList());
    }

    private void givenBadges(UserBadge... badges) {
        when(userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId)).thenReturn(List.of(badges));
        when(workoutRepository.findLatestFinishedAt(userId)).thenReturn(Optional.empty());
    }

    private UserBadge badge(String code, Instant lastMaintainedAt, boolean rusty) {
        return UserBadge.builder()
            .id(UUID.randomUUID())
            .userId(userId)
            .achievementCode(code)
            .earnedAt(NOW.minus(Duration.ofDays(60)))
            .lastMaintainedAt(lastMaintainedAt)
            .rusty(rusty)
            .build();
    }
}

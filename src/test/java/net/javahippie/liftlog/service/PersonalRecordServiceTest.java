package net.javahippie.liftlog.service;

import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.PersonalRecordResult;
import net.javahippie.liftlog.model.entity.Workout;
import net.javahippie.liftlog.model.entity.WorkoutSet;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PersonalRecordService.
 * Tests 1RM comparison against history and per-exercise isolation.
 */
@ExtendWith(MockitoExtension.class)
class PersonalRecordServiceTest {

    @Mock
    private WorkoutRepository workoutRepository;

    @Mock
    private WorkoutSetRepository workoutSetRepository;

    @Mock
    private UserLockService userLockService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private PersonalRecordService personalRecordService;

    private UUID userId;
    private UUID workoutId;
    private UUID benchPress;
    private UUID squat;

    @BeforeEach
    void setUp() {
        personalRecordService = new PersonalRecordService(workoutRepository, workoutSetRepository,
            userLockService, GamificationProperties.defaults(), transactionManager);
        userId = UUID.randomUUID();
        workoutId = UUID.randomUUID();
        benchPress = UUID.randomUUID();
        squat = UUID.randomUUID();
    }

    @Test
    @DisplayName("Should record a PR when there is no history")
    void testDetectPersonalRecords_NoHistory() {
        // Given
        WorkoutSet light = createSet(benchPress, 80, 5);
        WorkoutSet heavy = createSet(benchPress, 100, 5);
        givenFinishedWorkout(List.of(light, heavy));
        when(workoutSetRepository.findHistoricalSets(userId, benchPress, workoutId, PageRequest.of(0, 100)))
            .thenReturn(List.of());

        // When
        List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);

        // Then
        assertEquals(1, records.size());
        PersonalRecordResult record = records.get(0);
        assertEquals(heavy.getId(), record.setId());
        assertEquals(116.667, record.newPr(), 0.001);
        assertEquals(0.0, record.previousPr());
        verify(workoutSetRepository).markAsPersonalRecord(heavy.getId());
        verify(userLockService).lockUser(userId);
    }

    @Test
    @DisplayName("Should not count a tie with the previous best")
    void testDetectPersonalRecords_TieIsNoRecord() {
        // Given
        givenFinishedWorkout(List.of(createSet(benchPress, 100, 5)));
        when(workoutSetRepository.findHistoricalSets(eq(userId), eq(benchPress), eq(workoutId), any()))
            .thenReturn(List.of(createSet(benchPress, 100, 5)));

        // When
        List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);

        // Then
        assertTrue(records.isEmpty());
        verify(workoutSetRepository, never()).markAsPersonalRecord(any());
    }

    @Test
    @DisplayName("Should compare estimated 1RM, not raw weight")
    void testDetectPersonalRecords_ComparesEstimatedMax() {
        // Given - 90 kg x 10 (1RM 120) beats history of 110 kg x 1
        WorkoutSet set = createSet(benchPress, 90, 10);
        givenFinishedWorkout(List.of(set));
        when(workoutSetRepository.findHistoricalSets(eq(userId), eq(benchPress), eq(workoutId), any()))
            .thenReturn(List.of(createSet(benchPress, 110, 1)));

        // When
        List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);

        // Then
        assertEquals(1, records.size());
        assertEquals(110.0, records.get(0).previousPr());
        assertEquals(10.0, records.get(0).improvement(), 0.001);
    }

    @Test
    @DisplayName("Should keep checking other exercises when one fails")
    void testDetectPersonalRecords_FailureIsolation() {
        // Given
        givenFinishedWorkout(List.of(createSet(benchPress, 100, 5), createSet(squat, 140, 5)));
        when(workoutSetRepository.findHistoricalSets(eq(userId), eq(benchPress), eq(workoutId), any()))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(workoutSetRepository.findHistoricalSets(eq(userId), eq(squat), eq(workoutId), any()))
            .thenReturn(List.of());

        // When
        List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);

        // Then
        assertEquals(1, records.size());
        assertEquals(squat, records.get(0).exerciseId());
    }

    @Test
    @DisplayName("Should skip unfinished workouts")
    void testDetectPersonalRecords_UnfinishedWorkout() {
        // Given
        Workout workout = createWorkout(userId);
        workout.setEndedAt(null);
        when(workoutRepository.findByIdAndDeletedAtIsNull(workoutId)).thenReturn(Optional.of(workout));

        // When
        List<PersonalRecordResult> records = personalRecordService.detectPersonalRecords(userId, workoutId);

        // Then
        assertTrue(records.isEmpty());
        verifyNoInteractions(workoutSetRepository);
    }

    @Test
    @DisplayName("Should return 404 for unknown workouts and 403 for foreign ones")
    void testDetectPersonalRecords_Lookup() {
        UUID foreignWorkoutId = UUID.randomUUID();
        when(workoutRepository.findByIdAndDeletedAtIsNull(workoutId)).thenReturn(Optional.empty());
        when(workoutRepository.findByIdAndDeletedAtIsNull(foreignWorkoutId))
            .thenReturn(Optional.of(createWorkout(UUID.randomUUID())));

        assertThrows(ResourceNotFoundException.class,
            () -> personalRecordService.detectPersonalRecords(userId, workoutId));
        assertThrows(ForbiddenOperationException.class,
            () -> personalRecordService.detectPersonalRecords(userId, foreignWorkoutId));
    }

    private void givenFinishedWorkout(List<WorkoutSet> sets) {
        when(workoutRepository.findByIdAndDeletedAtIsNull(workoutId)).thenReturn(Optional.of(createWorkout(userId)));
        when(workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workoutId)).thenReturn(sets);
    }

    private Workout createWorkout(UUID ownerId) {
        return Workout.builder()
            .id(workoutId)
            .userId(ownerId)
            .startedAt(Instant.parse("2025-06-04T09:00:00Z"))
            .endedAt(Instant.parse("2025-06-04T10:00:00Z"))
            .build();
    }

    private WorkoutSet createSet(UUID exerciseId, int weight, int reps) {
        return WorkoutSet.builder()
            .id(UUID.randomUUID())
            .workoutId(workoutId)
            .exerciseId(exerciseId)
            .weightKg(BigDecimal.valueOf(weight))
            .reps(reps)
            .build();
    }
}

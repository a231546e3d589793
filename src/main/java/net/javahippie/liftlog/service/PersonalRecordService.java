package net.javahippie.liftlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.exception.ForbiddenOperationException;
import net.javahippie.liftlog.exception.ResourceNotFoundException;
import net.javahippie.liftlog.model.dto.PersonalRecordResult;
import net.javahippie.liftlog.model.entity.Workout;
import net.javahippie.liftlog.model.entity.WorkoutSet;
import net.javahippie.liftlog.repository.WorkoutRepository;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import net.javahippie.liftlog.util.ScoreFormulas;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for detecting strength personal records.
 * A workout's best set of an exercise, by estimated 1RM, is a record when it strictly beats
 * every earlier set of that exercise outside the workout.
 */
@Service
@Slf4j
public class PersonalRecordService {

    private final WorkoutRepository workoutRepository;
    private final WorkoutSetRepository workoutSetRepository;
    private final UserLockService userLockService;
    private final GamificationProperties properties;
    private final TransactionTemplate exerciseTransaction;

    public PersonalRecordService(WorkoutRepository workoutRepository,
                                 WorkoutSetRepository workoutSetRepository,
                                 UserLockService userLockService,
                                 GamificationProperties properties,
                                 PlatformTransactionManager transactionManager) {
        this.workoutRepository = workoutRepository;
        this.workoutSetRepository = workoutSetRepository;
        this.userLockService = userLockService;
        this.properties = properties;
        this.exerciseTransaction = new TransactionTemplate(transactionManager);
        this.exerciseTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Detect and flag new personal records of a finished workout.
     * Each exercise is checked in its own transaction; a failing exercise is logged and skipped.
     *
     * @param userId the calling user, who must own the workout
     * @param workoutId the workout to check
     * @return the new records, empty if none or if the workout is not finished yet
     * @throws ResourceNotFoundException if the workout does not exist
     * @throws ForbiddenOperationException if the workout belongs to another user
     */
    public List<PersonalRecordResult> detectPersonalRecords(UUID userId, UUID workoutId) {
        Workout workout = workoutRepository.findByIdAndDeletedAtIsNull(workoutId)
            .orElseThrow(() -> new ResourceNotFoundException("Workout not found: " + workoutId));
        if (!workout.getUserId().equals(userId)) {
            throw new ForbiddenOperationException("Workout " + workoutId + " does not belong to user " + userId);
        }
        if (!workout.isFinished()) {
            log.debug("Workout {} is not finished, skipping personal record detection", workoutId);
            return List.of();
        }

        List<WorkoutSet> sets = workoutSetRepository.findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(workoutId);
        Map<UUID, List<WorkoutSet>> setsByExercise = sets.stream()
            .collect(Collectors.groupingBy(WorkoutSet::getExerciseId, LinkedHashMap::new, Collectors.toList()));

        List<PersonalRecordResult> records = new ArrayList<>();
        for (Map.Entry<UUID, List<WorkoutSet>> group : setsByExercise.entrySet()) {
            try {
                PersonalRecordResult record = exerciseTransaction.execute(status ->
                    checkExercise(workout, group.getKey(), group.getValue()));
                if (record != null) {
                    records.add(record);
                }
            } catch (RuntimeException e) {
                log.error("Failed to check personal record for exercise {} in workout {}: {}",
                    group.getKey(), workoutId, e.getMessage(), e);
            }
        }
        return records;
    }

    private PersonalRecordResult checkExercise(Workout workout, UUID exerciseId, List<WorkoutSet> sets) {
        userLockService.lockUser(workout.getUserId());

        // first set wins ties
        WorkoutSet bestSet = sets.get(0);
        double best = estimatedOneRepMax(bestSet);
        for (WorkoutSet set : sets) {
            double current = estimatedOneRepMax(set);
            if (current > best) {
                best = current;
                bestSet = set;
            }
        }

        List<WorkoutSet> history = workoutSetRepository.findHistoricalSets(
            workout.getUserId(), exerciseId, workout.getId(), PageRequest.of(0, properties.prHistoryWindow()));
        double previousBest = history.stream()
            .mapToDouble(this::estimatedOneRepMax)
            .max()
            .orElse(0.0);

        if (best <= previousBest) {
            log.debug("No personal record for exercise {}: {} does not beat {}", exerciseId, best, previousBest);
            return null;
        }

        workoutSetRepository.markAsPersonalRecord(bestSet.getId());
        log.info("Personal record set: user {} exercise {} estimated 1RM {} (previous {})",
            workout.getUserId(), exerciseId, best, previousBest);

        return new PersonalRecordResult(exerciseId, bestSet.getId(), best, previousBest, best - previousBest);
    }

    private double estimatedOneRepMax(WorkoutSet set) {
        return ScoreFormulas.estimatedOneRepMax(set.getWeightValue(), set.getRepsValue());
    }
}

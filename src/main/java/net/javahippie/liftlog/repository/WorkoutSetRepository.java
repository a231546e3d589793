package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.WorkoutSet;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for WorkoutSet entities.
 */
@Repository
public interface WorkoutSetRepository extends JpaRepository<WorkoutSet, UUID> {

    /**
     * Find the non-deleted sets of a workout in recording order.
     */
    List<WorkoutSet> findByWorkoutIdAndDeletedAtIsNullOrderBySetOrderIndexAsc(UUID workoutId);

    /**
     * Ids of every set of a workout, deleted ones included.
     */
    @Query("SELECT s.id FROM WorkoutSet s WHERE s.workoutId = :workoutId")
    List<UUID> findIdsByWorkoutId(@Param("workoutId") UUID workoutId);

    List<WorkoutSet> findByIdIn(Collection<UUID> ids);

    /**
     * A user's sets of one exercise outside the given workout, heaviest first.
     * Sets of deleted workouts are ignored.
     */
    @Query("SELECT s FROM WorkoutSet s " +
           "WHERE s.exerciseId = :exerciseId " +
           "AND s.workoutId <> :excludedWorkoutId " +
           "AND s.deletedAt IS NULL " +
           "AND s.weightKg IS NOT NULL " +
           "AND s.workoutId IN (SELECT w.id FROM Workout w WHERE w.userId = :userId AND w.deletedAt IS NULL) " +
           "ORDER BY s.weightKg DESC")
    List<WorkoutSet> findHistoricalSets(
            @Param("userId") UUID userId,
            @Param("exerciseId") UUID exerciseId,
            @Param("excludedWorkoutId") UUID excludedWorkoutId,
            Pageable pageable
    );

    /**
     * Flag a set as personal record.
     */
    @Modifying
    @Query("UPDATE WorkoutSet s SET s.pr = true WHERE s.id = :setId")
    int markAsPersonalRecord(@Param("setId") UUID setId);

    /**
     * Count a user's non-deleted sets flagged as personal record.
     */
    @Query("SELECT COUNT(s) FROM WorkoutSet s " +
           "WHERE s.pr = true " +
           "AND s.deletedAt IS NULL " +
           "AND s.workoutId IN (SELECT w.id FROM Workout w WHERE w.userId = :userId AND w.deletedAt IS NULL)")
    long countPersonalRecordsByUserId(@Param("userId") UUID userId);

    /**
     * Count a user's non-deleted sets of exercises in the given muscle group.
     */
    @Query("SELECT COUNT(s) FROM WorkoutSet s, Exercise e " +
           "WHERE s.exerciseId = e.id " +
           "AND e.muscleGroup = :muscleGroup " +
           "AND s.deletedAt IS NULL " +
           "AND s.workoutId IN (SELECT w.id FROM Workout w WHERE w.userId = :userId AND w.deletedAt IS NULL)")
    long countByUserIdAndMuscleGroup(@Param("userId") UUID userId, @Param("muscleGroup") String muscleGroup);

    /**
     * Distinct muscle groups trained in a workout.
     */
    @Query("SELECT DISTINCT e.muscleGroup FROM WorkoutSet s, Exercise e " +
           "WHERE s.exerciseId = e.id " +
           "AND s.workoutId = :workoutId " +
           "AND s.deletedAt IS NULL " +
           "AND e.muscleGroup IS NOT NULL")
    List<String> findMuscleGroupsByWorkoutId(@Param("workoutId") UUID workoutId);
}

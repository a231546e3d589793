package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.Workout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Workout entities.
 */
@Repository
public interface WorkoutRepository extends JpaRepository<Workout, UUID> {

    /**
     * Find a workout that has not been soft-deleted.
     */
    Optional<Workout> findByIdAndDeletedAtIsNull(UUID id);

    /**
     * Count finished, non-deleted workouts of a user.
     */
    @Query("SELECT COUNT(w) FROM Workout w " +
           "WHERE w.userId = :userId " +
           "AND w.endedAt IS NOT NULL " +
           "AND w.deletedAt IS NULL")
    long countFinishedByUserId(@Param("userId") UUID userId);

    /**
     * Find non-deleted workouts of a user started within [from, to).
     */
    @Query("SELECT w FROM Workout w " +
           "WHERE w.userId = :userId " +
           "AND w.deletedAt IS NULL " +
           "AND w.startedAt >= :from " +
           "AND w.startedAt < :to")
    List<Workout> findActiveByUserIdStartedBetween(
            @Param("userId") UUID userId,
            @Param("from") Instant from,
            @Param("to") Instant to
    );

    /**
     * Most recent end time of a finished, non-deleted workout.
     */
    @Query("SELECT MAX(w.endedAt) FROM Workout w " +
           "WHERE w.userId = :userId " +
           "AND w.endedAt IS NOT NULL " +
           "AND w.deletedAt IS NULL")
    Optional<Instant> findLatestFinishedAt(@Param("userId") UUID userId);
}

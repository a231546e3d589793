package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.UserActivityWeek;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserActivityWeekRepository extends JpaRepository<UserActivityWeek, UUID> {

    /**
     * Find the aggregate of one user week.
     */
    Optional<UserActivityWeek> findByUserIdAndWeekStart(UUID userId, LocalDate weekStart);

    /**
     * Highest number of workouts the user completed in any single week.
     */
    @Query("SELECT COALESCE(MAX(w.workoutsCompleted), 0) FROM UserActivityWeek w WHERE w.userId = :userId")
    int findMaxWorkoutsCompletedByUserId(@Param("userId") UUID userId);
}

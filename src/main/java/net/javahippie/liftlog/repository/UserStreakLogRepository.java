package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.UserStreakLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for weekly streak runs.
 */
@Repository
public interface UserStreakLogRepository extends JpaRepository<UserStreakLog, UUID> {

    /**
     * Find the active run of a streak type.
     */
    Optional<UserStreakLog> findByUserIdAndStreakTypeAndActiveTrue(UUID userId, String streakType);

    /**
     * Find all active runs of a user.
     */
    List<UserStreakLog> findByUserIdAndActiveTrue(UUID userId);

    /**
     * Longest run of a streak type the user ever had, active or broken.
     */
    @Query("SELECT COALESCE(MAX(s.streakLength), 0) FROM UserStreakLog s " +
           "WHERE s.userId = :userId " +
           "AND s.streakType = :streakType")
    int findLongestStreak(@Param("userId") UUID userId, @Param("streakType") String streakType);
}

package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for earned badges.
 */
@Repository
public interface UserBadgeRepository extends JpaRepository<UserBadge, UUID> {

    /**
     * Find a user's non-deleted badges, newest first.
     */
    List<UserBadge> findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(UUID userId);

    /**
     * Find a user's badge for one achievement, deleted or not.
     */
    Optional<UserBadge> findByUserIdAndAchievementCode(UUID userId, String achievementCode);

    /**
     * Codes of the achievements a user currently holds.
     */
    @Query("SELECT b.achievementCode FROM UserBadge b " +
           "WHERE b.userId = :userId " +
           "AND b.deletedAt IS NULL")
    List<String> findHeldCodesByUserId(@Param("userId") UUID userId);
}

package net.javahippie.liftlog.repository;

import net.javahippie.liftlog.model.entity.XpLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the append-only XP ledger.
 */
@Repository
public interface XpLogRepository extends JpaRepository<XpLogEntry, UUID> {

    /**
     * Sum of all XP a user has earned.
     */
    @Query("SELECT COALESCE(SUM(x.xpAmount), 0) FROM XpLogEntry x WHERE x.userId = :userId")
    long sumXpByUserId(@Param("userId") UUID userId);

    /**
     * Sum of XP a user has earned since the given instant.
     */
    @Query("SELECT COALESCE(SUM(x.xpAmount), 0) FROM XpLogEntry x " +
           "WHERE x.userId = :userId " +
           "AND x.createdAt >= :since")
    long sumXpByUserIdSince(@Param("userId") UUID userId, @Param("since") Instant since);

    /**
     * Sum of XP logged for the given sources of one type.
     */
    @Query("SELECT COALESCE(SUM(x.xpAmount), 0) FROM XpLogEntry x " +
           "WHERE x.userId = :userId " +
           "AND x.sourceType = :sourceType " +
           "AND x.sourceId IN :sourceIds")
    long sumXpBySources(
            @Param("userId") UUID userId,
            @Param("sourceType") XpLogEntry.SourceType sourceType,
            @Param("sourceIds") Collection<UUID> sourceIds
    );

    /**
     * Source ids among the given ones that already earned XP.
     */
    @Query("SELECT x.sourceId FROM XpLogEntry x " +
           "WHERE x.userId = :userId " +
           "AND x.sourceType = :sourceType " +
           "AND x.sourceId IN :sourceIds")
    List<UUID> findAwardedSourceIds(
            @Param("userId") UUID userId,
            @Param("sourceType") XpLogEntry.SourceType sourceType,
            @Param("sourceIds") Collection<UUID> sourceIds
    );

    boolean existsByUserIdAndSourceTypeAndSourceId(UUID userId, XpLogEntry.SourceType sourceType, UUID sourceId);
}

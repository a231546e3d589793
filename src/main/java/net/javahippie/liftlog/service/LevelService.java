package net.javahippie.liftlog.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.model.dto.LevelProgress;
import net.javahippie.liftlog.model.entity.UserLevel;
import net.javahippie.liftlog.repository.UserLevelRepository;
import net.javahippie.liftlog.repository.XpLogRepository;
import net.javahippie.liftlog.util.ScoreFormulas;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Maintains the per-user level cache.
 * The cache is always recomputed from the full XP ledger, so recalculation can be repeated safely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LevelService {

    private final XpLogRepository xpLogRepository;
    private final UserLevelRepository userLevelRepository;
    private final UserLockService userLockService;
    private final Clock clock;

    /**
     * Recompute a user's level from the ledger and upsert the cache row.
     *
     * @param userId the user ID
     * @return the recomputed level progress
     */
    @Transactional
    public LevelProgress recalculateLevel(UUID userId) {
        userLockService.lockUser(userId);

        long totalXp = xpLogRepository.sumXpByUserId(userId);
        LevelProgress progress = ScoreFormulas.levelFromTotalXp(totalXp);

        UserLevel cache = userLevelRepository.findById(userId)
            .orElseGet(() -> UserLevel.builder().userId(userId).build());
        int previousLevel = cache.getLevel();

        cache.setTotalXp(progress.totalXp());
        cache.setLevel(progress.level());
        cache.setXpToNextLevel(progress.xpToNextLevel());
        cache.setUpdatedAt(clock.instant());
        userLevelRepository.save(cache);

        if (progress.level() > previousLevel) {
            log.info("User {} reached level {} ({} XP)", userId, progress.level(), progress.totalXp());
        } else {
            log.debug("Level cache for user {} refreshed: level {}, {} XP", userId, progress.level(), progress.totalXp());
        }
        return progress;
    }

    /**
     * Read the cached level of a user.
     *
     * @param userId the user ID
     * @return the cached progress, or level 1 with 0 XP if the user has no cache row yet
     */
    @Transactional(readOnly = true)
    public LevelProgress getLevel(UUID userId) {
        return userLevelRepository.findById(userId)
            .map(level -> new LevelProgress(level.getTotalXp(), level.getLevel(), level.getXpToNextLevel()))
            .orElseGet(() -> ScoreFormulas.levelFromTotalXp(0));
    }
}

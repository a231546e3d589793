package net.javahippie.liftlog.service;

import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.model.dto.BadgeUnlockResult;
import net.javahippie.liftlog.model.dto.UnlockedBadgeDTO;
import net.javahippie.liftlog.model.dto.UserBadgeDTO;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.model.entity.UserBadge;
import net.javahippie.liftlog.repository.AchievementRepository;
import net.javahippie.liftlog.repository.UserBadgeRepository;
import net.javahippie.liftlog.service.badge.BadgeRule;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for awarding badges.
 * Every achievement the user does not hold yet is evaluated by the first {@link BadgeRule}
 * supporting it. Each achievement is decided in its own transaction, so one failing rule
 * neither blocks nor rolls back the others.
 */
@Service
@Slf4j
public class BadgeService {

    private final AchievementRepository achievementRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final List<BadgeRule> badgeRules;
    private final NotificationService notificationService;
    private final UserLockService userLockService;
    private final Clock clock;
    private final TransactionTemplate achievementTransaction;

    public BadgeService(AchievementRepository achievementRepository,
                        UserBadgeRepository userBadgeRepository,
                        List<BadgeRule> badgeRules,
                        NotificationService notificationService,
                        UserLockService userLockService,
                        Clock clock,
                        PlatformTransactionManager transactionManager) {
        this.achievementRepository = achievementRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.badgeRules = List.copyOf(badgeRules);
        this.notificationService = notificationService;
        this.userLockService = userLockService;
        this.clock = clock;
        this.achievementTransaction = new TransactionTemplate(transactionManager);
        this.achievementTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Grant every badge the user qualifies for and does not hold yet.
     * Calling this again without new activity grants nothing.
     *
     * @param userId the user ID
     * @return the badges granted by this call
     */
    public BadgeUnlockResult unlockBadges(UUID userId) {
        Set<String> heldCodes = new HashSet<>(userBadgeRepository.findHeldCodesByUserId(userId));
        List<UnlockedBadgeDTO> unlocked = new ArrayList<>();

        for (Achievement achievement : achievementRepository.findAllByOrderByCodeAsc()) {
            if (heldCodes.contains(achievement.getCode())) {
                continue;
            }
            Optional<BadgeRule> rule = ruleFor(achievement);
            if (rule.isEmpty()) {
                log.debug("No rule evaluates achievement {}, skipping", achievement.getCode());
                continue;
            }

            try {
                UnlockedBadgeDTO badge = achievementTransaction.execute(status ->
                    grantIfSatisfied(userId, achievement, rule.get()));
                if (badge != null) {
                    unlocked.add(badge);
                }
            } catch (RuntimeException e) {
                log.error("Failed to evaluate achievement {} for user {}: {}",
                    achievement.getCode(), userId, e.getMessage(), e);
            }
        }

        return BadgeUnlockResult.of(unlocked);
    }

    /**
     * List a user's non-deleted badges, newest first.
     *
     * @param userId the user ID
     * @return badges joined with their achievement definitions
     */
    @Transactional(readOnly = true)
    public List<UserBadgeDTO> getUserBadges(UUID userId) {
        List<UserBadge> badges = userBadgeRepository.findByUserIdAndDeletedAtIsNullOrderByEarnedAtDesc(userId);
        Map<String, Achievement> achievements = achievementRepository
            .findAllById(badges.stream().map(UserBadge::getAchievementCode).toList())
            .stream()
            .collect(Collectors.toMap(Achievement::getCode, Function.identity()));

        return badges.stream()
            .map(badge -> UserBadgeDTO.fromEntity(badge, achievements.get(badge.getAchievementCode())))
            .toList();
    }

    private Optional<BadgeRule> ruleFor(Achievement achievement) {
        return badgeRules.stream()
            .filter(rule -> rule.supports(achievement))
            .findFirst();
    }

    private UnlockedBadgeDTO grantIfSatisfied(UUID userId, Achievement achievement, BadgeRule rule) {
        userLockService.lockUser(userId);

        // a concurrent run may have granted it since the held codes were read
        Optional<UserBadge> existing = userBadgeRepository.findByUserIdAndAchievementCode(userId, achievement.getCode());
        if (existing.isPresent() && existing.get().getDeletedAt() == null) {
            return null;
        }
        if (!rule.isSatisfied(userId, achievement)) {
            return null;
        }

        Instant now = clock.instant();
        UserBadge badge = existing.orElseGet(() -> UserBadge.builder()
            .userId(userId)
            .achievementCode(achievement.getCode())
            .build());
        badge.setEarnedAt(now);
        badge.setDeletedAt(null);
        badge.polish(now);
        userBadgeRepository.save(badge);

        notificationService.createAchievementNotification(userId, achievement, now);
        log.info("Badge earned: user {} achievement {}", userId, achievement.getCode());

        return new UnlockedBadgeDTO(achievement.getCode(), achievement.getTitle(), achievement.getDescription(), now);
    }
}

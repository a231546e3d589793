package net.javahippie.liftlog.service.badge;

import net.javahippie.liftlog.model.entity.Achievement;

import java.util.UUID;

/**
 * Evaluates whether a user has earned one family of achievements.
 * Implementations are Spring components; the first rule, by {@code @Order}, that supports an
 * achievement decides it. New badge types are added by registering a new rule.
 */
public interface BadgeRule {

    /**
     * Whether this rule evaluates the given achievement.
     */
    boolean supports(Achievement achievement);

    /**
     * Whether the user currently meets the achievement's condition.
     * Implementations only read; they never grant anything themselves.
     *
     * @param userId the user to evaluate
     * @param achievement an achievement this rule supports
     * @return true if the badge should be granted
     */
    boolean isSatisfied(UUID userId, Achievement achievement);
}

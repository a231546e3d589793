package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Achievements with a muscle-group filter: number of non-deleted sets of exercises in that group.
 */
@Component
@Order(70)
@RequiredArgsConstructor
public class MuscleGroupRule implements BadgeRule {

    private final WorkoutSetRepository workoutSetRepository;
    private final GamificationProperties properties;

    @Override
    public boolean supports(Achievement achievement) {
        return achievement.getRelevantMuscleGroup() != null && !achievement.getRelevantMuscleGroup().isBlank();
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        long sets = workoutSetRepository.countByUserIdAndMuscleGroup(userId, achievement.getRelevantMuscleGroup());
        return sets >= achievement.thresholdOr(properties.defaultMuscleGroupThreshold());
    }
}

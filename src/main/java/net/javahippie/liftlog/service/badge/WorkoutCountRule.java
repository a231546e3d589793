package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.WorkoutRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * FIRST_WORKOUT and WORKOUT_*: number of finished, non-deleted workouts.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class WorkoutCountRule implements BadgeRule {

    static final String FIRST_WORKOUT = "FIRST_WORKOUT";
    static final String PREFIX = "WORKOUT_";

    private final WorkoutRepository workoutRepository;

    @Override
    public boolean supports(Achievement achievement) {
        return FIRST_WORKOUT.equals(achievement.getCode()) || achievement.getCode().startsWith(PREFIX);
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        int threshold = FIRST_WORKOUT.equals(achievement.getCode()) ? 1 : achievement.thresholdOr(1);
        return workoutRepository.countFinishedByUserId(userId) >= threshold;
    }
}

package net.javahippie.liftlog.service.badge;

import lombok.RequiredArgsConstructor;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * FIRST_PR and PR_COUNT_*: number of non-deleted sets flagged as personal record.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class PersonalRecordCountRule implements BadgeRule {

    static final String FIRST_PR = "FIRST_PR";
    static final String PREFIX = "PR_COUNT_";

    private final WorkoutSetRepository workoutSetRepository;

    @Override
    public boolean supports(Achievement achievement) {
        return FIRST_PR.equals(achievement.getCode()) || achievement.getCode().startsWith(PREFIX);
    }

    @Override
    public boolean isSatisfied(UUID userId, Achievement achievement) {
        int threshold = FIRST_PR.equals(achievement.getCode()) ? 1 : achievement.thresholdOr(1);
        return workoutSetRepository.countPersonalRecordsByUserId(userId) >= threshold;
    }
}

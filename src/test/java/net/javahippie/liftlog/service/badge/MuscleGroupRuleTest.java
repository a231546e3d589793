package net.javahippie.liftlog.service.badge;

import net.javahippie.liftlog.config.GamificationProperties;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.WorkoutSetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MuscleGroupRuleTest {

    @Mock
    private WorkoutSetRepository workoutSetRepository;

    private MuscleGroupRule rule;

    private final UUID userId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        rule = new MuscleGroupRule(workoutSetRepository, GamificationProperties.defaults());
    }

    @Test
    @DisplayName("Supports achievements with a muscle group")
    void testSupports() {
        assertTrue(rule.supports(masterBadge(100)));
        assertFalse(rule.supports(Achievement.builder().code("LEG_DAY").relevantMuscleGroup(" ").build()));
    }

    @Test
    @DisplayName("Counts sets of the muscle group")
    void testThreshold() {
        when(workoutSetRepository.countByUserIdAndMuscleGroup(userId, "chest")).thenReturn(100L);

        assertTrue(rule.isSatisfied(userId, masterBadge(100)));
        assertFalse(rule.isSatisfied(userId, masterBadge(101)));
    }

    @Test
    @DisplayName("Missing threshold uses the configured default")
    void testDefaultThreshold() {
        when(workoutSetRepository.countByUserIdAndMuscleGroup(userId, "chest")).thenReturn(10L);

        assertTrue(rule.isSatisfied(userId, masterBadge(null)));
    }

    private static Achievement masterBadge(Integer threshold) {
        return Achievement.builder()
            .code("CHEST_MASTER")
            .title("Chest Master")
            .thresholdValue(threshold)
            .relevantMuscleGroup("chest")
            .build();
    }
}

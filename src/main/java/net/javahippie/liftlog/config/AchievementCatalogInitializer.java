package net.javahippie.liftlog.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javahippie.liftlog.model.entity.Achievement;
import net.javahippie.liftlog.repository.AchievementRepository;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Seeds the achievement catalog on startup.
 * Only codes missing from the table are inserted, so edited definitions are left alone.
 * Disable with {@code liftlog.achievements.seed=false}.
 */
@Configuration
@ConditionalOnProperty(name = "liftlog.achievements.seed", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AchievementCatalogInitializer {

    static final List<Achievement> CATALOG = List.of(
        achievement("FIRST_WORKOUT", "First Rep", "Finish your first workout", 1, null),
        achievement("WORKOUT_10", "Getting Started", "Finish 10 workouts", 10, null),
        achievement("WORKOUT_50", "Regular", "Finish 50 workouts", 50, null),
        achievement("WORKOUT_100", "Centurion", "Finish 100 workouts", 100, null),
        achievement("WORKOUT_250", "Iron Veteran", "Finish 250 workouts", 250, null),
        achievement("WORKOUT_500", "Gym Legend", "Finish 500 workouts", 500, null),

        achievement("FIRST_PR", "New Personal Best", "Set your first personal record", 1, null),
        achievement("PR_COUNT_10", "Record Breaker", "Set 10 personal records", 10, null),
        achievement("PR_COUNT_50", "Limit Pusher", "Set 50 personal records", 50, null),
        achievement("PR_COUNT_100", "Unstoppable", "Set 100 personal records", 100, null),

        achievement("LEVEL_5", "Level 5", "Reach level 5", 5, null),
        achievement("LEVEL_10", "Level 10", "Reach level 10", 10, null),
        achievement("LEVEL_25", "Level 25", "Reach level 25", 25, null),

        achievement("WEEKLY_3_x4", "Consistent Starter", "Work out 3+ days per week for 4 consecutive weeks", 4, null),
        achievement("WEEKLY_3_x8", "Habit Builder", "Work out 3+ days per week for 8 consecutive weeks", 8, null),
        achievement("WEEKLY_3_x12", "Quarter Champion", "Work out 3+ days per week for 12 consecutive weeks", 12, null),
        achievement("WEEKLY_4_x4", "Dedicated Lifter", "Work out 4+ days per week for 4 consecutive weeks", 4, null),
        achievement("WEEKLY_4_x8", "Iron Regular", "Work out 4+ days per week for 8 consecutive weeks", 8, null),
        achievement("WEEKLY_4_x12", "Gym Warrior", "Work out 4+ days per week for 12 consecutive weeks", 12, null),
        achievement("CONSISTENCY_26", "Half Year Hero", "Work out at least once a week for 26 consecutive weeks", 26, null),
        achievement("CONSISTENCY_52", "Year-Round Athlete", "Work out at least once a week for 52 consecutive weeks", 52, null),
        achievement("PERFECT_WEEK_5", "Perfect Week", "Complete 5 workouts in a single week", 5, null),
        achievement("PERFECT_WEEK_6", "Beast Mode Week", "Complete 6 workouts in a single week", 6, null),

        achievement("CHEST_MASTER", "Chest Master", "Complete 100 chest sets", 100, "chest"),
        achievement("BACK_MASTER", "Back Master", "Complete 100 back sets", 100, "back"),
        achievement("LEG_MASTER", "Leg Master", "Complete 100 leg sets", 100, "legs"),
        achievement("SHOULDER_MASTER", "Shoulder Master", "Complete 100 shoulder sets", 100, "shoulders"),
        achievement("ARM_MASTER", "Arm Master", "Complete 100 arm sets", 100, "arms"),
        achievement("CORE_MASTER", "Core Master", "Complete 100 core sets", 100, "core")
    );

    private final AchievementRepository achievementRepository;

    @Bean
    public CommandLineRunner seedAchievements() {
        return args -> {
            Set<String> existing = achievementRepository.findAll().stream()
                .map(Achievement::getCode)
                .collect(Collectors.toSet());

            List<Achievement> missing = CATALOG.stream()
                .filter(a -> !existing.contains(a.getCode()))
                .map(AchievementCatalogInitializer::copyOf)
                .toList();
            if (missing.isEmpty()) {
                log.debug("Achievement catalog up to date ({} definitions)", existing.size());
                return;
            }

            achievementRepository.saveAll(missing);
            log.info("Seeded {} achievement definitions", missing.size());
        };
    }

    private static Achievement achievement(String code, String title, String description,
                                           int threshold, String muscleGroup) {
        return Achievement.builder()
            .code(code)
            .title(title)
            .description(description)
            .iconUrl("/badges/" + code.toLowerCase(Locale.ROOT) + ".png")
            .thresholdValue(threshold)
            .relevantMuscleGroup(muscleGroup)
            .build();
    }

    private static Achievement copyOf(Achievement template) {
        return achievement(template.getCode(), template.getTitle(), template.getDescription(),
            template.getThresholdValue(), template.getRelevantMuscleGroup());
    }
}

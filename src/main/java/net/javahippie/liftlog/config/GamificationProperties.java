package net.javahippie.liftlog.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gamification policy: XP caps, streak and perfect-week thresholds, badge rust thresholds.
 * Bound from {@code liftlog.gamification.*}; handlers receive it by injection so tests can
 * substitute alternate policies.
 *
 * <p>Rust threshold keys are exact achievement codes, prefix patterns ending in {@code *}
 * or suffix patterns starting with {@code *}. A value of {@link #NEVER_RUSTS} exempts
 * matching badges.</p>
 *
 * @param xpPerSet XP granted per completed set
 * @param workoutBonusXp XP granted once per finished workout
 * @param dailyXpCap maximum XP per user and day
 * @param workoutXpCap maximum set XP per workout
 * @param ledgerZone zone whose midnight starts the XP day
 * @param prHistoryWindow number of heaviest historical sets compared during PR detection
 * @param defaultMuscleGroupThreshold set count for muscle-group badges without a threshold
 * @param defaultRustThresholdDays rust threshold for codes without a matching entry
 * @param streakThresholds streak type to minimum workouts per week
 * @param perfectWeekThresholds perfect-week code to minimum workouts in the week
 * @param rustThresholds code or pattern to rust threshold in days
 */
@ConfigurationProperties(prefix = "liftlog.gamification")
public record GamificationProperties(
    @DefaultValue("10") int xpPerSet,
    @DefaultValue("50") int workoutBonusXp,
    @DefaultValue("500") int dailyXpCap,
    @DefaultValue("200") int workoutXpCap,
    @DefaultValue("UTC") String ledgerZone,
    @DefaultValue("100") int prHistoryWindow,
    @DefaultValue("10") int defaultMuscleGroupThreshold,
    @DefaultValue("30") int defaultRustThresholdDays,
    Map<String, Integer> streakThresholds,
    Map<String, Integer> perfectWeekThresholds,
    Map<String, Integer> rustThresholds
) {

    public static final int NEVER_RUSTS = -1;

    public static final String WEEKLY_ANY = "WEEKLY_ANY";

    public GamificationProperties {
        streakThresholds = orDefault(streakThresholds, defaultStreakThresholds());
        perfectWeekThresholds = orDefault(perfectWeekThresholds, defaultPerfectWeekThresholds());
        rustThresholds = orDefault(rustThresholds, defaultRustThresholds());
    }

    /**
     * Policy with every value at its default.
     */
    public static GamificationProperties defaults() {
        return new GamificationProperties(10, 50, 500, 200, "UTC", 100, 10, 30, null, null, null);
    }

    public ZoneId ledgerZoneId() {
        return ZoneId.of(ledgerZone);
    }

    /**
     * Resolves the rust threshold of an achievement code.
     * An exact entry wins, then the longest matching pattern, then the default.
     *
     * @param achievementCode the badge's achievement code
     * @return threshold in days, or {@link #NEVER_RUSTS}
     */
    public int rustThresholdDays(String achievementCode) {
        Integer exact = rustThresholds.get(achievementCode);
        if (exact != null) {
            return exact;
        }

        Integer best = null;
        int bestLength = -1;
        for (Map.Entry<String, Integer> entry : rustThresholds.entrySet()) {
            String key = entry.getKey();
            boolean matches;
            if (key.endsWith("*")) {
                matches = achievementCode.startsWith(key.substring(0, key.length() - 1));
            } else if (key.startsWith("*")) {
                matches = achievementCode.endsWith(key.substring(1));
            } else {
                continue;
            }
            int length = key.length() - 1;
            if (matches && length > bestLength) {
                best = entry.getValue();
                bestLength = length;
            }
        }
        return best != null ? best : defaultRustThresholdDays;
    }

    private static Map<String, Integer> orDefault(Map<String, Integer> configured, Map<String, Integer> fallback) {
        Map<String, Integer> source = configured == null || configured.isEmpty() ? fallback : configured;
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, Integer> defaultStreakThresholds() {
        Map<String, Integer> thresholds = new LinkedHashMap<>();
        thresholds.put(WEEKLY_ANY, 1);
        thresholds.put("WEEKLY_3", 3);
        thresholds.put("WEEKLY_4", 4);
        thresholds.put("WEEKLY_5", 5);
        return thresholds;
    }

    private static Map<String, Integer> defaultPerfectWeekThresholds() {
        Map<String, Integer> thresholds = new LinkedHashMap<>();
        thresholds.put("PERFECT_WEEK_5", 5);
        thresholds.put("PERFECT_WEEK_6", 6);
        return thresholds;
    }

    private static Map<String, Integer> defaultRustThresholds() {
        Map<String, Integer> thresholds = new LinkedHashMap<>();
        thresholds.put("FIRST_WORKOUT", 14);
        thresholds.put("WORKOUT_*", 14);
        thresholds.put("FIRST_PR", 30);
        thresholds.put("PR_COUNT_*", 30);
        thresholds.put("WEEKLY_*", 14);
        thresholds.put("CONSISTENCY_*", 14);
        thresholds.put("PERFECT_WEEK_*", NEVER_RUSTS);
        thresholds.put("*_MASTER", 21);
        return thresholds;
    }
}

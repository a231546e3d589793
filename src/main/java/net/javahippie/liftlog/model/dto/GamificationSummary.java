package net.javahippie.liftlog.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * User-facing summary of everything a finished workout earned.
 * Stages that failed are listed in {@code failedStages}; the other fields reflect what succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GamificationSummary {

    private UUID workoutId;

    private int xpAwarded;

    private LevelProgress level;

    private boolean levelUp;

    private int prCount;

    @Builder.Default
    private Map<String, Integer> streaks = new LinkedHashMap<>();

    @Builder.Default
    private List<String> perfectWeekBadges = new ArrayList<>();

    @Builder.Default
    private List<String> badgesUnlocked = new ArrayList<>();

    @Builder.Default
    private List<String> badgesPolished = new ArrayList<>();

    @Builder.Default
    private List<String> failedStages = new ArrayList<>();
}

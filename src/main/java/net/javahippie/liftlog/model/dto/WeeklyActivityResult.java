package net.javahippie.liftlog.model.dto;

import java.util.List;
import java.util.Map;

/**
 * Outcome of weekly activity tracking.
 *
 * @param activityWeek the updated week aggregate
 * @param streaks streak type to current length, for the streak types this week qualified for
 * @param perfectWeekBadges perfect-week codes the week qualifies for
 */
public record WeeklyActivityResult(
    ActivityWeekDTO activityWeek,
    Map<String, Integer> streaks,
    List<String> perfectWeekBadges
) {
}

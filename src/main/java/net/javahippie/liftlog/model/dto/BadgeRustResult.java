package net.javahippie.liftlog.model.dto;

import java.util.List;

/**
 * Outcome of a rust check over all of a user's badges.
 *
 * @param checkedBadges number of non-deleted badges inspected
 * @param updates badges whose rust state flipped
 * @param newlyRusted codes of badges that became rusty
 * @param polished codes of badges that are shiny again
 */
public record BadgeRustResult(
    int checkedBadges,
    List<RustUpdate> updates,
    List<String> newlyRusted,
    List<String> polished
) {
}

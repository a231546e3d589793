package net.javahippie.liftlog.model.dto;

/**
 * Level state derived from a user's total XP.
 *
 * @param totalXp the cumulative XP
 * @param level the level reached, starting at 1
 * @param xpToNextLevel XP still missing for the next level, never negative
 */
public record LevelProgress(long totalXp, int level, long xpToNextLevel) {
}

package net.javahippie.liftlog.util;

import net.javahippie.liftlog.model.dto.LevelProgress;

/**
 * Numeric contracts shared by the gamification handlers.
 * PR comparisons and level thresholds depend on the exact shape of these formulas.
 */
public final class ScoreFormulas {

    private static final double XP_PER_LEVEL_UNIT = 100.0;
    private static final double EPLEY_DIVISOR = 30.0;

    private ScoreFormulas() {
    }

    /**
     * Estimates the one-rep max of a set.
     * Simplified Epley: {@code weight * (1 + reps / 30)}, the weight itself for single reps
     * and zero when no rep was done.
     *
     * @param weight lifted weight in kg
     * @param reps completed repetitions
     * @return the estimated 1RM in kg
     */
    public static double estimatedOneRepMax(double weight, int reps) {
        if (reps == 1) {
            return weight;
        }
        if (reps == 0) {
            return 0.0;
        }
        return weight * (1 + reps / EPLEY_DIVISOR);
    }

    /**
     * Computes the level for a cumulative XP total.
     * {@code level = floor(sqrt(xp / 100)) + 1}; the next level is reached at {@code level^2 * 100} XP.
     *
     * @param totalXp cumulative XP, negative values count as zero
     * @return the level progress
     */
    public static LevelProgress levelFromTotalXp(long totalXp) {
        long xp = Math.max(0L, totalXp);
        int level = (int) Math.floor(Math.sqrt(xp / XP_PER_LEVEL_UNIT)) + 1;
        long xpForNextLevel = (long) level * level * (long) XP_PER_LEVEL_UNIT;
        return new LevelProgress(xp, level, Math.max(0L, xpForNextLevel - xp));
    }
}

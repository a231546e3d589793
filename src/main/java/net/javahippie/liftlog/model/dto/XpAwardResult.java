package net.javahippie.liftlog.model.dto;

/**
 * Outcome of an XP award.
 *
 * @param xpAwarded XP granted by this call, zero when nothing new qualified or a cap was reached
 * @param todayTotal the user's XP for the current day after this call
 */
public record XpAwardResult(int xpAwarded, long todayTotal) {
}

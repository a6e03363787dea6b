package com.scoreboard.scoreboard_api.stats;

/**
 * Win/loss record for one player.
 *
 * @param winRate fraction in [0, 1]; 0 when no games have been played
 * @param streak  signed length of the current run: positive for wins,
 *                negative for losses, 0 with no games
 */
public record WinLossStats(
        String playerId,
        int wins,
        int losses,
        int totalGames,
        double winRate,
        int streak
) {
    public static WinLossStats of(String playerId, int wins, int losses, int streak) {
        int total = wins + losses;
        double rate = total > 0 ? (double) wins / total : 0.0;
        return new WinLossStats(playerId, wins, losses, total, rate, streak);
    }

    public static WinLossStats empty(String playerId) {
        return of(playerId, 0, 0, 0);
    }

    public int winStreak() {
        return Math.max(streak, 0);
    }

    public int losingStreak() {
        return Math.max(-streak, 0);
    }
}

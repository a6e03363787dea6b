package com.scoreboard.scoreboard_api.stats;

/**
 * One row of the standings: a player's win/loss record plus display fields.
 */
public record LeaderboardEntry(
        int rank,
        String playerId,
        String playerName,
        String nickname,
        String avatarEmoji,
        int wins,
        int losses,
        int totalGames,
        double winRate,   // [0, 1] fraction
        int streak        // + winning, - losing
) {
    static LeaderboardEntry of(int rank, WinLossStats stats, PlayerDisplay display) {
        return new LeaderboardEntry(
                rank,
                stats.playerId(),
                display.name(),
                display.nickname(),
                display.avatarEmoji(),
                stats.wins(),
                stats.losses(),
                stats.totalGames(),
                stats.winRate(),
                stats.streak()
        );
    }
}

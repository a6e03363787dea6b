package com.scoreboard.scoreboard_api.stats;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Builds the hall-of-shame summary. Both cut-offs are caller parameters.
 *
 * Worst win rate: lowest rate first, then more games (a bad rate over more
 * games is worse), then lowest id.
 * Cold streaks:   longest losing run first, then lowest id.
 */
public final class HallOfShameBuilder {

    static final Comparator<WinLossStats> WORST_RATE_FIRST =
            Comparator.comparingDouble(WinLossStats::winRate)
                    .thenComparing(Comparator.comparingInt(WinLossStats::totalGames).reversed())
                    .thenComparing(WinLossStats::playerId);

    static final Comparator<WinLossStats> COLDEST_FIRST =
            Comparator.comparingInt(WinLossStats::losingStreak).reversed()
                    .thenComparing(WinLossStats::playerId);

    private HallOfShameBuilder() {}

    /**
     * Both cut-offs are floored at 1 so players without games never qualify.
     *
     * @param minGamesForWorstRate  players need at least this many games to be ranked by rate
     * @param losingStreakThreshold a losing run of at least this length lands a player in
     *                              {@code coldStreaks}
     */
    public static HallOfShame build(Collection<WinLossStats> stats,
                                    int minGamesForWorstRate,
                                    int losingStreakThreshold) {
        int minGames = Math.max(minGamesForWorstRate, 1);
        int streakCutoff = Math.max(losingStreakThreshold, 1);

        Optional<WinLossStats> worst = stats.stream()
                .filter(s -> s.totalGames() >= minGames)
                .min(WORST_RATE_FIRST);

        List<WinLossStats> cold = stats.stream()
                .filter(s -> s.losingStreak() >= streakCutoff)
                .sorted(COLDEST_FIRST)
                .toList();

        return new HallOfShame(worst, cold);
    }
}

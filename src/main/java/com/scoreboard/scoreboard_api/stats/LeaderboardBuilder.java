package com.scoreboard.scoreboard_api.stats;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Ranks win/loss records into standings.
 *
 * Order:
 *   1. win rate, descending
 *   2. total games, descending (more volume wins a rate tie)
 *   3. player id, ascending
 *
 * The last key is unique, so any input has exactly one valid ordering.
 */
public final class LeaderboardBuilder {

    public static final Comparator<WinLossStats> STANDINGS_ORDER =
            Comparator.comparingDouble(WinLossStats::winRate).reversed()
                    .thenComparing(Comparator.comparingInt(WinLossStats::totalGames).reversed())
                    .thenComparing(WinLossStats::playerId);

    private LeaderboardBuilder() {}

    /**
     * @param stats    one record per known player
     * @param display  display-field lookup (falls back to the raw id upstream)
     * @param minGames players with fewer games are left out; 0 keeps everyone
     */
    public static List<LeaderboardEntry> build(Collection<WinLossStats> stats,
                                               Function<String, PlayerDisplay> display,
                                               int minGames) {
        List<WinLossStats> eligible = new ArrayList<>();
        for (WinLossStats s : stats) {
            if (s.totalGames() >= minGames) {
                eligible.add(s);
            }
        }
        eligible.sort(STANDINGS_ORDER);

        List<LeaderboardEntry> entries = new ArrayList<>(eligible.size());
        for (int i = 0; i < eligible.size(); i++) {
            WinLossStats s = eligible.get(i);
            entries.add(LeaderboardEntry.of(i + 1, s, display.apply(s.playerId())));
        }
        return List.copyOf(entries);
    }

    public static List<LeaderboardEntry> build(MatchSnapshot snapshot, int minGames) {
        return build(StatsAggregator.aggregateAll(snapshot).values(), snapshot::display, minGames);
    }
}

package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-player win/loss aggregation. Stateless, no dependencies.
 *
 * Streak rule:
 *   Walk the player's matches newest first (playedAt DESC, id ASC) and count
 *   how many share the outcome of the most recent one. Winning runs are
 *   positive, losing runs negative. The run is bounded only by history.
 */
public final class StatsAggregator {

    private StatsAggregator() {}

    // =========================================================================
    // Single player
    // =========================================================================

    public static WinLossStats aggregate(MatchSnapshot snapshot, String playerId) {
        List<Match> history = snapshot.matchesFor(playerId);

        int wins = 0;
        int losses = 0;
        for (Match m : history) {
            if (m.isWinner(playerId)) {
                wins++;
            } else {
                losses++;
            }
        }
        return WinLossStats.of(playerId, wins, losses, streak(history, playerId));
    }

    /**
     * Signed run length of the most recent identical outcomes.
     *
     * @param newestFirst the player's matches, most recent first
     */
    static int streak(List<Match> newestFirst, String playerId) {
        if (newestFirst.isEmpty()) return 0;

        boolean latestWon = newestFirst.get(0).isWinner(playerId);
        int run = 0;
        for (Match m : newestFirst) {
            if (m.isWinner(playerId) != latestWon) break;
            run++;
        }
        return latestWon ? run : -run;
    }

    // =========================================================================
    // Everyone
    // =========================================================================

    /**
     * Stats for every known player (directory plus match participants),
     * keyed by player id in id order.
     */
    public static Map<String, WinLossStats> aggregateAll(MatchSnapshot snapshot) {
        Map<String, WinLossStats> result = new LinkedHashMap<>();
        for (String playerId : snapshot.knownPlayerIds()) {
            result.put(playerId, aggregate(snapshot, playerId));
        }
        return result;
    }

    // =========================================================================
    // History
    // =========================================================================

    /** The player's newest {@code limit} matches, in streak order. */
    public static List<Match> recentMatches(MatchSnapshot snapshot, String playerId, int limit) {
        List<Match> history = snapshot.matchesFor(playerId);
        return List.copyOf(history.subList(0, Math.min(Math.max(limit, 0), history.size())));
    }
}

package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.scoreboard.util.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class StatsAggregatorTest {

    private static MatchSnapshot snapshotOf(List<Match> matches) {
        return MatchSnapshot.of(matches, buildPlayers("alice", "bob", "carol", "dan"));
    }

    // =========================================================================
    // Win / loss counts
    // =========================================================================

    @Nested
    @DisplayName("Win / loss counts")
    class Counts {

        @Test
        @DisplayName("noGames_givesZeroRateAndStreak")
        void noGames_givesZeroRateAndStreak() {
            WinLossStats stats = StatsAggregator.aggregate(snapshotOf(List.of()), "alice");

            assertEquals(WinLossStats.empty("alice"), stats);
            assertEquals(0.0, stats.winRate());
            assertEquals(0, stats.streak());
        }

        @Test
        @DisplayName("countsWinsAndLosses_fromBothTeamSlots")
        void countsWinsAndLosses_fromBothTeamSlots() {
            List<Match> matches = List.of(
                    buildMatch("alice", "bob", "carol", "dan", 1),
                    buildMatch("bob", "alice", "carol", "dan", 2),
                    buildMatch("carol", "dan", "bob", "alice", 3));

            WinLossStats stats = StatsAggregator.aggregate(snapshotOf(matches), "alice");

            assertEquals(2, stats.wins());
            assertEquals(1, stats.losses());
            assertEquals(3, stats.totalGames());
            assertEquals(2.0 / 3.0, stats.winRate(), 1e-9);
        }

        @Test
        @DisplayName("totalWins_equalTwicePerMatch_acrossAllPlayers")
        void totalWins_equalTwicePerMatch_acrossAllPlayers() {
            List<Match> matches = new ArrayList<>();
            matches.addAll(buildSeries("alice", "bob", "carol", "dan", 1, true, false, true));
            matches.add(buildMatch("alice", "carol", "bob", "erin", 10));
            matches.add(buildMatch("erin", "dan", "alice", "bob", 11));

            Map<String, WinLossStats> all = StatsAggregator.aggregateAll(snapshotOf(matches));

            int wins = all.values().stream().mapToInt(WinLossStats::wins).sum();
            int losses = all.values().stream().mapToInt(WinLossStats::losses).sum();
            assertEquals(2 * matches.size(), wins);
            assertEquals(2 * matches.size(), losses);
        }

        @Test
        @DisplayName("aggregateAll_coversDirectoryPlayersWithoutGames_inIdOrder")
        void aggregateAll_coversDirectoryPlayersWithoutGames_inIdOrder() {
            MatchSnapshot snapshot = MatchSnapshot.of(
                    List.of(buildMatch("alice", "bob", "carol", "erin", 1)),
                    buildPlayers("dan", "alice"));

            Map<String, WinLossStats> all = StatsAggregator.aggregateAll(snapshot);

            assertEquals(List.of("alice", "bob", "carol", "dan", "erin"), List.copyOf(all.keySet()));
            assertEquals(0, all.get("dan").totalGames());
        }
    }

    // =========================================================================
    // Streaks
    // =========================================================================

    @Nested
    @DisplayName("Streaks")
    class Streaks {

        @Test
        @DisplayName("winAfterLoss_resetsToPlusOne")
        void winAfterLoss_resetsToPlusOne() {
            // oldest -> newest: W, W, L, W
            List<Match> matches = buildSeries("alice", "bob", "carol", "dan", 1, true, true, false, true);

            assertEquals(1, StatsAggregator.aggregate(snapshotOf(matches), "alice").streak());
        }

        @Test
        @DisplayName("threeLosses_giveMinusThree")
        void threeLosses_giveMinusThree() {
            List<Match> matches = buildSeries("alice", "bob", "carol", "dan", 1, false, false, false);

            WinLossStats stats = StatsAggregator.aggregate(snapshotOf(matches), "alice");
            assertEquals(-3, stats.streak());
            assertEquals(3, stats.losingStreak());
            assertEquals(0, stats.winStreak());
        }

        @Test
        @DisplayName("streak_followsPlayedAt_notInputOrder")
        void streak_followsPlayedAt_notInputOrder() {
            List<Match> matches = new ArrayList<>(
                    buildSeries("alice", "bob", "carol", "dan", 1, false, true, true));
            Collections.reverse(matches);

            assertEquals(2, StatsAggregator.aggregate(snapshotOf(matches), "alice").streak());
        }

        @Test
        @DisplayName("sameInstant_lowerIdCountsAsMoreRecent")
        void sameInstant_lowerIdCountsAsMoreRecent() {
            Match win = buildMatch("x1", "alice", "bob", "carol", "dan", null, minute(3));
            Match loss = buildMatch("x2", "carol", "dan", "alice", "bob", null, minute(3));

            assertEquals(1, StatsAggregator.aggregate(snapshotOf(List.of(loss, win)), "alice").streak());
            assertEquals(-1, StatsAggregator.aggregate(snapshotOf(List.of(loss, win)), "carol").streak());
        }

        @Test
        @DisplayName("streak_isNotCappedByAnyWindow")
        void streak_isNotCappedByAnyWindow() {
            boolean[] wins = new boolean[40];
            Arrays.fill(wins, true);
            List<Match> matches = buildSeries("alice", "bob", "carol", "dan", 1, wins);

            assertEquals(40, StatsAggregator.aggregate(snapshotOf(matches), "alice").streak());
        }
    }

    // =========================================================================
    // Recent matches
    // =========================================================================

    @Test
    @DisplayName("recentMatches_returnsNewestFirst_upToLimit")
    void recentMatches_returnsNewestFirst_upToLimit() {
        List<Match> matches = buildSeries("alice", "bob", "carol", "dan", 1, true, false, true, true);
        MatchSnapshot snapshot = snapshotOf(matches);

        List<Match> recent = StatsAggregator.recentMatches(snapshot, "alice", 2);

        assertEquals(List.of(matches.get(3), matches.get(2)), recent);
        assertEquals(4, StatsAggregator.recentMatches(snapshot, "alice", 10).size());
        assertTrue(StatsAggregator.recentMatches(snapshot, "alice", 0).isEmpty());
    }

    @Test
    @DisplayName("recomputingFromSameSnapshot_givesEqualResults")
    void recomputingFromSameSnapshot_givesEqualResults() {
        MatchSnapshot snapshot = snapshotOf(buildSeries("alice", "bob", "carol", "dan", 1, true, false, false));

        assertEquals(StatsAggregator.aggregateAll(snapshot), StatsAggregator.aggregateAll(snapshot));
    }
}

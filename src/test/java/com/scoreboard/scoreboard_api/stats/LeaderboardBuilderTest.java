package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;
import com.scoreboard.scoreboard_api.model.Player;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.scoreboard.util.TestFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LeaderboardBuilderTest {

    @Test
    @DisplayName("higherWinRate_ranksFirst")
    void higherWinRate_ranksFirst() {
        List<WinLossStats> stats = List.of(
                WinLossStats.of("alice", 1, 3, -1),
                WinLossStats.of("bob", 3, 1, 2));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(stats, PlayerDisplay::unknown, 0);

        assertEquals(List.of("bob", "alice"), board.stream().map(LeaderboardEntry::playerId).toList());
        assertEquals(1, board.get(0).rank());
        assertEquals(2, board.get(1).rank());
    }

    @Test
    @DisplayName("equalRate_moreGamesRanksFirst")
    void equalRate_moreGamesRanksFirst() {
        List<WinLossStats> stats = List.of(
                WinLossStats.of("alice", 1, 1, 1),
                WinLossStats.of("bob", 3, 3, -1));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(stats, PlayerDisplay::unknown, 0);

        assertEquals("bob", board.get(0).playerId());
    }

    @Test
    @DisplayName("equalRateAndGames_lowerIdRanksFirst")
    void equalRateAndGames_lowerIdRanksFirst() {
        List<WinLossStats> stats = List.of(
                WinLossStats.of("carol", 2, 2, 1),
                WinLossStats.of("alice", 2, 2, -1),
                WinLossStats.of("bob", 2, 2, 2));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(stats, PlayerDisplay::unknown, 0);

        assertEquals(List.of("alice", "bob", "carol"), board.stream().map(LeaderboardEntry::playerId).toList());
    }

    @Test
    @DisplayName("minGames_filtersBeforeRanking")
    void minGames_filtersBeforeRanking() {
        List<WinLossStats> stats = List.of(
                WinLossStats.of("alice", 1, 0, 1),
                WinLossStats.of("bob", 3, 2, 1),
                WinLossStats.empty("carol"));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(stats, PlayerDisplay::unknown, 2);

        assertEquals(1, board.size());
        assertEquals("bob", board.get(0).playerId());
        assertEquals(1, board.get(0).rank());
    }

    @Test
    @DisplayName("playersWithoutGames_areListedLastAtZeroRate")
    void playersWithoutGames_areListedLastAtZeroRate() {
        List<Player> directory = buildPlayers("alice", "bob", "carol", "dan", "zed");
        List<Match> matches = List.of(buildMatch("alice", "bob", "carol", "dan", 1));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(MatchSnapshot.of(matches, directory), 0);

        assertEquals(5, board.size());
        LeaderboardEntry last = board.get(4);
        assertEquals("zed", last.playerId());
        assertEquals(0, last.totalGames());
        assertEquals(0.0, last.winRate());
    }

    @Test
    @DisplayName("entries_carryDisplayFields_withRawIdFallback")
    void entries_carryDisplayFields_withRawIdFallback() {
        List<Player> directory = List.of(new Player("alice", "Alice", "Ace", "🎾"));
        List<Match> matches = List.of(buildMatch("alice", "bob", "carol", "dan", 1));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(MatchSnapshot.of(matches, directory), 0);

        LeaderboardEntry alice = board.get(0);
        assertEquals("Alice", alice.playerName());
        assertEquals("Ace", alice.nickname());
        assertEquals("🎾", alice.avatarEmoji());

        LeaderboardEntry carol = board.stream().filter(e -> e.playerId().equals("carol")).findFirst().orElseThrow();
        assertEquals("carol", carol.playerName());
        assertEquals(Player.DEFAULT_AVATAR, carol.avatarEmoji());
    }

    @Test
    @DisplayName("ordering_isStrictAndRanksAreConsecutive")
    void ordering_isStrictAndRanksAreConsecutive() {
        List<Match> matches = new ArrayList<>();
        matches.addAll(buildSeries("alice", "bob", "carol", "dan", 1, true, true, false));
        matches.addAll(buildSeries("alice", "carol", "bob", "dan", 10, false, true));

        List<LeaderboardEntry> board = LeaderboardBuilder.build(MatchSnapshot.of(matches, List.of()), 0);

        for (int i = 0; i < board.size(); i++) {
            assertEquals(i + 1, board.get(i).rank());
        }
        for (int i = 1; i < board.size(); i++) {
            LeaderboardEntry prev = board.get(i - 1);
            LeaderboardEntry cur = board.get(i);
            boolean strictlyBefore = prev.winRate() > cur.winRate()
                    || (prev.winRate() == cur.winRate() && prev.totalGames() > cur.totalGames())
                    || (prev.winRate() == cur.winRate() && prev.totalGames() == cur.totalGames()
                        && prev.playerId().compareTo(cur.playerId()) < 0);
            assertTrue(strictlyBefore, prev.playerId() + " should rank above " + cur.playerId());
        }
    }
}

package com.scoreboard.scoreboard_api.stats;

/**
 * Head-to-head record between two players who have been on opposite teams.
 * The pair is unordered; by convention player1Id sorts before player2Id.
 *
 * @param player1Wins matches player1's team won with player2 on the losing side
 * @param player2Wins matches player2's team won with player1 on the losing side
 */
public record RivalryEntry(String player1Id, String player2Id, int player1Wins, int player2Wins) {

    public int totalGames() {
        return player1Wins + player2Wins;
    }

    public boolean involves(String playerId) {
        return player1Id.equals(playerId) || player2Id.equals(playerId);
    }
}

package com.scoreboard.scoreboard_api.model;

/**
 * Final score of a match. Both sides are always present together; a match
 * without a recorded score has no Score at all.
 */
public record Score(int winnerScore, int loserScore) {}

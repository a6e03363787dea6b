package com.scoreboard.scoreboard_api.stats;

import java.util.List;
import java.util.Optional;

/**
 * Summary of who is struggling.
 *
 * @param worstWinRate lowest win rate among players with enough games, if any qualify
 * @param coldStreaks  players on a long enough losing run, longest first
 */
public record HallOfShame(Optional<WinLossStats> worstWinRate, List<WinLossStats> coldStreaks) {}

package com.scoreboard.scoreboard_api.stats;

/**
 * Condition a player must meet to hold a badge.
 */
@FunctionalInterface
public interface AchievementPredicate {

    boolean test(WinLossStats stats, RelationshipStat relationships);
}

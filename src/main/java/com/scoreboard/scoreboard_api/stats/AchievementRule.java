package com.scoreboard.scoreboard_api.stats;

/**
 * One row of the achievement table: a predicate and the badge it awards.
 */
public record AchievementRule(AchievementPredicate predicate, Badge badge) {

    /**
     * Rule that holds when {@code metric >= threshold} and the player has at
     * least {@code minGames} games.
     */
    public static AchievementRule threshold(Badge badge, AchievementMetric metric,
                                            double threshold, int minGames) {
        AchievementPredicate predicate = (stats, relationships) ->
                stats.totalGames() >= minGames && metric.measure(stats, relationships) >= threshold;
        return new AchievementRule(predicate, badge);
    }

    public boolean holds(WinLossStats stats, RelationshipStat relationships) {
        return predicate.test(stats, relationships);
    }
}

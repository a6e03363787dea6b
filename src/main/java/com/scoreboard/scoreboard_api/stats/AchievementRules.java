package com.scoreboard.scoreboard_api.stats;

import java.util.List;

import static com.scoreboard.scoreboard_api.stats.AchievementMetric.*;

/**
 * Built-in achievement table, used when no rules are configured.
 */
public final class AchievementRules {

    private AchievementRules() {}

    public static List<AchievementRule> defaults() {
        return List.of(
                AchievementRule.threshold(
                        new Badge("FIRST_WIN", "First Blood", "🩸", "Won a first match"),
                        WINS, 1, 0),
                AchievementRule.threshold(
                        new Badge("TEN_WINS", "Double Digits", "🔟", "Won 10 matches"),
                        WINS, 10, 0),
                AchievementRule.threshold(
                        new Badge("QUARTER_CENTURY", "Quarter Century", "🏆", "Won 25 matches"),
                        WINS, 25, 0),
                AchievementRule.threshold(
                        new Badge("REGULAR", "Court Regular", "📅", "Played 50 matches"),
                        TOTAL_GAMES, 50, 0),
                AchievementRule.threshold(
                        new Badge("SHARPSHOOTER", "Sharpshooter", "🎯", "80% win rate over at least 5 games"),
                        WIN_RATE, 0.8, 5),
                AchievementRule.threshold(
                        new Badge("HAT_TRICK", "Hat Trick", "🎩", "Won 3 in a row"),
                        WIN_STREAK, 3, 0),
                AchievementRule.threshold(
                        new Badge("ON_FIRE", "On Fire", "🔥", "Won 5 in a row"),
                        WIN_STREAK, 5, 0),
                AchievementRule.threshold(
                        new Badge("DYNAMIC_DUO", "Dynamic Duo", "🤝", "Won 10 matches with the same partner"),
                        PARTNER_WINS, 10, 0),
                AchievementRule.threshold(
                        new Badge("ROUGH_PATCH", "Rough Patch", "🌧️", "Lost 3 in a row"),
                        LOSS_STREAK, 3, 0),
                AchievementRule.threshold(
                        new Badge("HAUNTED", "Haunted", "👻", "Lost 5 times to the same opponent"),
                        NEMESIS_LOSSES, 5, 0)
        );
    }
}

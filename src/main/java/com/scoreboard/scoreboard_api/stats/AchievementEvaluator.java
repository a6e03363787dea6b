package com.scoreboard.scoreboard_api.stats;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates a fixed, ordered rule table against one player's stats.
 *
 * Rules are independent: every rule is checked, a player may hold any subset,
 * and nothing is remembered between calls. Badges come back in table order.
 */
public class AchievementEvaluator {

    private final List<AchievementRule> rules;

    public AchievementEvaluator(List<AchievementRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static AchievementEvaluator withDefaults() {
        return new AchievementEvaluator(AchievementRules.defaults());
    }

    public List<Badge> evaluate(WinLossStats stats, RelationshipStat relationships) {
        List<Badge> earned = new ArrayList<>();
        for (AchievementRule rule : rules) {
            if (rule.holds(stats, relationships)) {
                earned.add(rule.badge());
            }
        }
        return List.copyOf(earned);
    }

    public List<AchievementRule> getRules() {
        return rules;
    }
}

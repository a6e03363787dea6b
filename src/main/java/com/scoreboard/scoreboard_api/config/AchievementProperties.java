package com.scoreboard.scoreboard_api.config;

import com.scoreboard.scoreboard_api.stats.AchievementMetric;
import com.scoreboard.scoreboard_api.stats.AchievementRule;
import com.scoreboard.scoreboard_api.stats.AchievementRules;
import com.scoreboard.scoreboard_api.stats.Badge;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Achievement table, bound from {@code scoreboard.achievements.rules[n].*}.
 *
 * Example:
 * <pre>
 * scoreboard.achievements.rules[0].code=SHARPSHOOTER
 * scoreboard.achievements.rules[0].title=Sharpshooter
 * scoreboard.achievements.rules[0].metric=WIN_RATE
 * scoreboard.achievements.rules[0].threshold=0.8
 * scoreboard.achievements.rules[0].min-games=5
 * </pre>
 * In a .properties file an emoji has to be written as its escaped UTF-16
 * pair (see the commented example in application.properties); the file is
 * read as ISO-8859-1. YAML config takes emoji as-is.
 * An empty table falls back to {@link AchievementRules#defaults()}.
 */
@Configuration
@ConfigurationProperties(prefix = "scoreboard.achievements")
@Data
public class AchievementProperties {

    private List<RuleDefinition> rules = new ArrayList<>();

    public List<AchievementRule> toRules() {
        if (rules.isEmpty()) {
            return AchievementRules.defaults();
        }
        return rules.stream().map(RuleDefinition::toRule).toList();
    }

    @Data
    public static class RuleDefinition {
        private String code;
        private String title;
        private String emoji = "🏅";
        private String description = "";
        private AchievementMetric metric;
        private double threshold;
        private int minGames = 0;

        AchievementRule toRule() {
            if (code == null || code.isBlank() || metric == null) {
                throw new IllegalStateException(
                        "Achievement rules need a code and a metric, got code=" + code + " metric=" + metric);
            }
            Badge badge = new Badge(code, title != null ? title : code, emoji, description);
            return AchievementRule.threshold(badge, metric, threshold, minGames);
        }
    }
}

package com.scoreboard.scoreboard_api.config;

import com.scoreboard.scoreboard_api.stats.AchievementEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StatsConfig {
    private static final Logger log = LoggerFactory.getLogger(StatsConfig.class);

    @Bean
    public AchievementEvaluator achievementEvaluator(AchievementProperties properties) {
        AchievementEvaluator evaluator = new AchievementEvaluator(properties.toRules());
        log.info("Loaded {} achievement rules ({})", evaluator.getRules().size(),
                properties.getRules().isEmpty() ? "built-in" : "configured");
        return evaluator;
    }
}

package com.scoreboard.scoreboard_api.config;

import com.scoreboard.scoreboard_api.config.AchievementProperties.RuleDefinition;
import com.scoreboard.scoreboard_api.stats.AchievementEvaluator;
import com.scoreboard.scoreboard_api.stats.AchievementMetric;
import com.scoreboard.scoreboard_api.stats.AchievementRule;
import com.scoreboard.scoreboard_api.stats.AchievementRules;
import com.scoreboard.scoreboard_api.stats.Badge;
import com.scoreboard.scoreboard_api.stats.RelationshipStat;
import com.scoreboard.scoreboard_api.stats.WinLossStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.PropertiesPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AchievementPropertiesTest {

    private static RuleDefinition definition(String code, AchievementMetric metric, double threshold, int minGames) {
        RuleDefinition def = new RuleDefinition();
        def.setCode(code);
        def.setMetric(metric);
        def.setThreshold(threshold);
        def.setMinGames(minGames);
        return def;
    }

    @Test
    @DisplayName("emptyTable_fallsBackToDefaults")
    void emptyTable_fallsBackToDefaults() {
        List<AchievementRule> rules = new AchievementProperties().toRules();

        assertEquals(
                AchievementRules.defaults().stream().map(r -> r.badge().code()).toList(),
                rules.stream().map(r -> r.badge().code()).toList());
    }

    @Test
    @DisplayName("configuredTable_replacesDefaults_andKeepsOrder")
    void configuredTable_replacesDefaults_andKeepsOrder() {
        AchievementProperties props = new AchievementProperties();
        RuleDefinition veteran = definition("VETERAN", AchievementMetric.TOTAL_GAMES, 3, 0);
        veteran.setTitle("Veteran");
        props.setRules(List.of(veteran, definition("WINNER", AchievementMetric.WINS, 1, 0)));

        AchievementEvaluator evaluator = new AchievementEvaluator(props.toRules());
        List<Badge> badges = evaluator.evaluate(WinLossStats.of("alice", 2, 1, 2), RelationshipStat.none());

        assertEquals(List.of("VETERAN", "WINNER"), badges.stream().map(Badge::code).toList());
        assertEquals("Veteran", badges.get(0).title());
        // untitled rules show their code, with the default emoji
        assertEquals("WINNER", badges.get(1).title());
        assertEquals("🏅", badges.get(1).emoji());
    }

    @Test
    @DisplayName("minGames_gatesConfiguredRule")
    void minGames_gatesConfiguredRule() {
        AchievementProperties props = new AchievementProperties();
        props.setRules(List.of(definition("PERFECT", AchievementMetric.WIN_RATE, 1.0, 3)));
        AchievementEvaluator evaluator = new AchievementEvaluator(props.toRules());

        assertTrue(evaluator.evaluate(WinLossStats.of("alice", 2, 0, 2), RelationshipStat.none()).isEmpty());
        assertEquals(1, evaluator.evaluate(WinLossStats.of("alice", 3, 0, 3), RelationshipStat.none()).size());
    }

    @Test
    @DisplayName("ruleWithoutMetric_failsFast")
    void ruleWithoutMetric_failsFast() {
        AchievementProperties props = new AchievementProperties();
        props.setRules(List.of(definition("BROKEN", null, 1, 0)));

        assertThrows(IllegalStateException.class, props::toRules);
    }

    @Test
    @DisplayName("escapedEmojiInPropertiesFile_bindsToTheRealEmoji")
    void escapedEmojiInPropertiesFile_bindsToTheRealEmoji() throws Exception {
        List<PropertySource<?>> sources = new PropertiesPropertySourceLoader()
                .load("achievements", new ClassPathResource("achievements-escaped.properties"));

        AchievementProperties props = new Binder(ConfigurationPropertySources.from(sources))
                .bind("scoreboard.achievements", AchievementProperties.class)
                .get();

        Badge badge = props.toRules().get(0).badge();
        assertEquals("SHARPSHOOTER", badge.code());
        assertEquals("🎯", badge.emoji());
    }
}

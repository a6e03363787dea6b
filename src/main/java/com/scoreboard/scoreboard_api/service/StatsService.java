package com.scoreboard.scoreboard_api.service;

import com.scoreboard.scoreboard_api.repository.MatchRepository;
import com.scoreboard.scoreboard_api.repository.PlayerRepository;
import com.scoreboard.scoreboard_api.service.MatchService.MatchResponse;
import com.scoreboard.scoreboard_api.stats.*;
import com.scoreboard.scoreboard_api.stats.RelationshipStat.NemesisStat;
import com.scoreboard.scoreboard_api.stats.RelationshipStat.PartnerStat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read side of the scoreboard. Every call loads one snapshot of the full
 * match log and player directory inside a read-only transaction and runs the
 * stats engine over it. Nothing is cached: results always reflect the log as
 * of the call.
 *
 * Request parameters override the configured defaults when given.
 */
@Service
public class StatsService {

    static final Comparator<RivalryEntry> MOST_PLAYED_FIRST =
            Comparator.comparingInt(RivalryEntry::totalGames).reversed()
                    .thenComparing(RivalryEntry::player1Id)
                    .thenComparing(RivalryEntry::player2Id);

    private final MatchRepository matchRepository;
    private final PlayerRepository playerRepository;
    private final AchievementEvaluator achievementEvaluator;

    private final int recentMatchLimit;
    private final int rivalryMinEncounters;
    private final int shameMinGames;
    private final int shameLosingStreakThreshold;

    public StatsService(MatchRepository matchRepository,
                        PlayerRepository playerRepository,
                        AchievementEvaluator achievementEvaluator,
                        @Value("${scoreboard.stats.recent-match-limit:10}") int recentMatchLimit,
                        @Value("${scoreboard.rivalries.min-encounters:2}") int rivalryMinEncounters,
                        @Value("${scoreboard.shame.min-games-for-worst-rate:5}") int shameMinGames,
                        @Value("${scoreboard.shame.losing-streak-threshold:3}") int shameLosingStreakThreshold) {
        this.matchRepository = matchRepository;
        this.playerRepository = playerRepository;
        this.achievementEvaluator = achievementEvaluator;
        this.recentMatchLimit = recentMatchLimit;
        this.rivalryMinEncounters = rivalryMinEncounters;
        this.shameMinGames = shameMinGames;
        this.shameLosingStreakThreshold = shameLosingStreakThreshold;
    }

    /**
     * @throws InvalidMatchDataException if a stored match is corrupt
     */
    MatchSnapshot loadSnapshot() {
        return MatchSnapshot.of(matchRepository.findAllNewestFirst(), playerRepository.findAll());
    }

    // =========================================================================
    // Leaderboard
    // =========================================================================

    @Transactional(readOnly = true)
    public List<LeaderboardEntry> leaderboard(Integer minGames) {
        return LeaderboardBuilder.build(loadSnapshot(), minGames != null ? minGames : 0);
    }

    // =========================================================================
    // Per-player bundle
    // =========================================================================

    /**
     * @throws NotFoundException if the id is neither in the directory nor in any match
     */
    @Transactional(readOnly = true)
    public PlayerStatsResponse playerStats(String playerId, Integer recentLimit) {
        MatchSnapshot snapshot = loadSnapshot();
        if (!snapshot.isKnown(playerId)) {
            throw new NotFoundException("Player '" + playerId + "' not found.");
        }

        WinLossStats stats = StatsAggregator.aggregate(snapshot, playerId);
        RelationshipStat relationships = RelationshipAnalyzer.analyze(snapshot, playerId);
        List<Badge> badges = achievementEvaluator.evaluate(stats, relationships);

        int limit = recentLimit != null ? recentLimit : recentMatchLimit;
        List<MatchResponse> recent = StatsAggregator.recentMatches(snapshot, playerId, limit).stream()
                .map(MatchResponse::from)
                .toList();

        PlayerDisplay display = snapshot.display(playerId);
        PartnerView partner = relationships.bestPartner()
                .map(p -> PartnerView.of(p, snapshot.displayName(p.partnerId())))
                .orElse(null);
        NemesisView nemesis = relationships.nemesis()
                .map(n -> NemesisView.of(n, snapshot.displayName(n.opponentId())))
                .orElse(null);

        return new PlayerStatsResponse(
                playerId, display.name(), display.nickname(), display.avatarEmoji(),
                stats, partner, nemesis, badges, recent);
    }

    // =========================================================================
    // Rivalries
    // =========================================================================

    /**
     * Head-to-head records with at least {@code minEncounters} games,
     * most played first.
     */
    @Transactional(readOnly = true)
    public List<RivalryView> rivalries(Integer minEncounters) {
        MatchSnapshot snapshot = loadSnapshot();
        int min = minEncounters != null ? minEncounters : rivalryMinEncounters;

        return RivalryTableBuilder.build(snapshot).stream()
                .filter(r -> r.totalGames() >= min)
                .sorted(MOST_PLAYED_FIRST)
                .map(r -> new RivalryView(
                        r.player1Id(), snapshot.displayName(r.player1Id()),
                        r.player2Id(), snapshot.displayName(r.player2Id()),
                        r.player1Wins(), r.player2Wins(), r.totalGames()))
                .toList();
    }

    // =========================================================================
    // Hall of shame
    // =========================================================================

    @Transactional(readOnly = true)
    public HallOfShameResponse hallOfShame(Integer minGamesForWorstRate, Integer losingStreakThreshold) {
        MatchSnapshot snapshot = loadSnapshot();
        Map<String, WinLossStats> all = StatsAggregator.aggregateAll(snapshot);

        HallOfShame shame = HallOfShameBuilder.build(
                all.values(),
                minGamesForWorstRate != null ? minGamesForWorstRate : shameMinGames,
                losingStreakThreshold != null ? losingStreakThreshold : shameLosingStreakThreshold);

        ShameEntry worst = shame.worstWinRate()
                .map(s -> ShameEntry.of(s, snapshot.display(s.playerId())))
                .orElse(null);
        List<ShameEntry> cold = shame.coldStreaks().stream()
                .map(s -> ShameEntry.of(s, snapshot.display(s.playerId())))
                .toList();
        return new HallOfShameResponse(worst, cold);
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record PlayerStatsResponse(
            String playerId,
            String playerName,
            String nickname,
            String avatarEmoji,
            WinLossStats stats,
            PartnerView bestPartner,   // null when the player has no games
            NemesisView nemesis,       // null when the player has never lost
            List<Badge> badges,
            List<MatchResponse> recentMatches
    ) {}

    public record PartnerView(String partnerId, String partnerName, int wins, int losses, int totalGames) {
        static PartnerView of(PartnerStat p, String name) {
            return new PartnerView(p.partnerId(), name, p.wins(), p.losses(), p.totalGames());
        }
    }

    public record NemesisView(String opponentId, String opponentName, int lossesAgainst, int winsAgainst) {
        static NemesisView of(NemesisStat n, String name) {
            return new NemesisView(n.opponentId(), name, n.lossesAgainst(), n.winsAgainst());
        }
    }

    public record RivalryView(
            String player1Id, String player1Name,
            String player2Id, String player2Name,
            int player1Wins, int player2Wins,
            int totalGames
    ) {}

    public record ShameEntry(
            String playerId, String playerName, String avatarEmoji,
            int wins, int losses, int totalGames,
            double winRate, int streak
    ) {
        static ShameEntry of(WinLossStats s, PlayerDisplay display) {
            return new ShameEntry(s.playerId(), display.name(), display.avatarEmoji(),
                    s.wins(), s.losses(), s.totalGames(), s.winRate(), s.streak());
        }
    }

    public record HallOfShameResponse(ShameEntry worstWinRate, List<ShameEntry> coldStreaks) {}
}

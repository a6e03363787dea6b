package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Match;
import com.scoreboard.scoreboard_api.stats.RelationshipStat.NemesisStat;
import com.scoreboard.scoreboard_api.stats.RelationshipStat.PartnerStat;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Derives best partner and nemesis for a player from their match history.
 *
 * Best partner: most joint wins, then most joint games, then lowest id.
 * Nemesis:      most losses against, then widest (losses - wins) margin,
 *               then lowest id.
 */
public final class RelationshipAnalyzer {

    static final Comparator<PartnerStat> BEST_PARTNER_FIRST =
            Comparator.comparingInt(PartnerStat::wins).reversed()
                    .thenComparing(Comparator.comparingInt(PartnerStat::totalGames).reversed())
                    .thenComparing(PartnerStat::partnerId);

    static final Comparator<NemesisStat> NEMESIS_FIRST =
            Comparator.comparingInt(NemesisStat::lossesAgainst).reversed()
                    .thenComparing(Comparator.comparingInt(NemesisStat::margin).reversed())
                    .thenComparing(NemesisStat::opponentId);

    private RelationshipAnalyzer() {}

    public static RelationshipStat analyze(MatchSnapshot snapshot, String playerId) {
        Map<String, Tally> withPartner = new HashMap<>();
        Map<String, Tally> againstOpponent = new HashMap<>();

        for (Match m : snapshot.matchesFor(playerId)) {
            boolean won = m.isWinner(playerId);
            withPartner.computeIfAbsent(m.teammateOf(playerId), k -> new Tally()).record(won);
            for (String opponent : m.opponentsOf(playerId)) {
                againstOpponent.computeIfAbsent(opponent, k -> new Tally()).record(won);
            }
        }

        return new RelationshipStat(bestPartner(withPartner), nemesis(againstOpponent));
    }

    // =========================================================================
    // Selection
    // =========================================================================

    private static Optional<PartnerStat> bestPartner(Map<String, Tally> withPartner) {
        return withPartner.entrySet().stream()
                .map(e -> new PartnerStat(e.getKey(), e.getValue().wins, e.getValue().losses))
                .min(BEST_PARTNER_FIRST);
    }

    private static Optional<NemesisStat> nemesis(Map<String, Tally> againstOpponent) {
        return againstOpponent.entrySet().stream()
                .filter(e -> e.getValue().losses > 0)
                .map(e -> new NemesisStat(e.getKey(), e.getValue().losses, e.getValue().wins))
                .min(NEMESIS_FIRST);
    }

    // Mutable per-call counter; never escapes analyze().
    private static final class Tally {
        int wins;
        int losses;

        void record(boolean won) {
            if (won) wins++; else losses++;
        }
    }
}

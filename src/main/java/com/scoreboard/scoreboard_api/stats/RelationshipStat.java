package com.scoreboard.scoreboard_api.stats;

import java.util.Optional;

/**
 * Who a player does best with and who they lose to most.
 * Both sides are empty for a player without history; the nemesis is also
 * empty for a player who has never lost.
 */
public record RelationshipStat(
        Optional<PartnerStat> bestPartner,
        Optional<NemesisStat> nemesis
) {
    public static RelationshipStat none() {
        return new RelationshipStat(Optional.empty(), Optional.empty());
    }

    /** Joint record with one teammate. */
    public record PartnerStat(String partnerId, int wins, int losses) {
        public int totalGames() { return wins + losses; }
    }

    /** Head-to-head record against one opponent, from the player's side. */
    public record NemesisStat(String opponentId, int lossesAgainst, int winsAgainst) {
        public int margin() { return lossesAgainst - winsAgainst; }
    }
}

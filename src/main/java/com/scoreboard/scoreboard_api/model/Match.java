package com.scoreboard.scoreboard_api.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One completed doubles (2v2) game. Append-only: rows are created and
 * deleted, never updated, so the entity exposes no setters.
 *
 * The two score columns are nullable and only ever read together through
 * {@link #getScore()}. A row with exactly one of them set is corrupt and is
 * rejected when a stats snapshot is built.
 */
@Getter
@Entity
@Table(name = "matches", indexes = @Index(name = "idx_matches_played_at", columnList = "played_at"))
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    // =========================================================================
    // Teams
    // =========================================================================
    @Column(name = "winner1_id", nullable = false, length = 32)
    private String winner1Id;

    @Column(name = "winner2_id", nullable = false, length = 32)
    private String winner2Id;

    @Column(name = "loser1_id", nullable = false, length = 32)
    private String loser1Id;

    @Column(name = "loser2_id", nullable = false, length = 32)
    private String loser2Id;

    // =========================================================================
    // Optional score pair
    // =========================================================================
    @Getter(AccessLevel.NONE)
    @Column(name = "winner_score")
    private Integer winnerScore;

    @Getter(AccessLevel.NONE)
    @Column(name = "loser_score")
    private Integer loserScore;

    @Column(nullable = false, length = 500)
    private String comment = "";

    /** User id of whoever submitted the result. */
    @Column(name = "recorded_by", nullable = false)
    private String recordedBy;

    @Column(name = "played_at", nullable = false)
    private Instant playedAt;

    protected Match() {}

    public Match(String winner1Id, String winner2Id,
                 String loser1Id, String loser2Id,
                 Score score, String comment,
                 String recordedBy, Instant playedAt) {
        this.winner1Id = winner1Id;
        this.winner2Id = winner2Id;
        this.loser1Id = loser1Id;
        this.loser2Id = loser2Id;
        if (score != null) {
            this.winnerScore = score.winnerScore();
            this.loserScore = score.loserScore();
        }
        this.comment = comment != null ? comment : "";
        this.recordedBy = recordedBy;
        this.playedAt = playedAt;
    }

    // =========================================================================
    // Score access
    // =========================================================================

    public Optional<Score> getScore() {
        if (winnerScore == null || loserScore == null) return Optional.empty();
        return Optional.of(new Score(winnerScore, loserScore));
    }

    /** True when exactly one of the two score columns is set. */
    public boolean hasPartialScore() {
        return (winnerScore == null) != (loserScore == null);
    }

    // =========================================================================
    // Team helpers
    // =========================================================================

    public List<String> getWinnerIds() {
        return List.of(winner1Id, winner2Id);
    }

    public List<String> getLoserIds() {
        return List.of(loser1Id, loser2Id);
    }

    /** All four participants, winners first. */
    public List<String> getPlayerIds() {
        return List.of(winner1Id, winner2Id, loser1Id, loser2Id);
    }

    public boolean isWinner(String playerId) {
        return winner1Id.equals(playerId) || winner2Id.equals(playerId);
    }

    public boolean isLoser(String playerId) {
        return loser1Id.equals(playerId) || loser2Id.equals(playerId);
    }

    public boolean involves(String playerId) {
        return isWinner(playerId) || isLoser(playerId);
    }

    /** The other member of the player's team. Only valid for a participant. */
    public String teammateOf(String playerId) {
        if (winner1Id.equals(playerId)) return winner2Id;
        if (winner2Id.equals(playerId)) return winner1Id;
        if (loser1Id.equals(playerId)) return loser2Id;
        if (loser2Id.equals(playerId)) return loser1Id;
        throw new IllegalArgumentException("Player " + playerId + " did not play match " + id);
    }

    /** Both members of the opposing team. Only valid for a participant. */
    public List<String> opponentsOf(String playerId) {
        if (isWinner(playerId)) return getLoserIds();
        if (isLoser(playerId)) return getWinnerIds();
        throw new IllegalArgumentException("Player " + playerId + " did not play match " + id);
    }
}

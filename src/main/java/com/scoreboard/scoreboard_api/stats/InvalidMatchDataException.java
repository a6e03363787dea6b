package com.scoreboard.scoreboard_api.stats;

/**
 * A match that cannot take part in aggregation: repeated or blank player ids,
 * or a score pair with only one side set.
 */
public class InvalidMatchDataException extends RuntimeException {

    private final String matchId;

    public InvalidMatchDataException(String matchId, String reason) {
        super(matchId == null ? reason : "Match " + matchId + ": " + reason);
        this.matchId = matchId;
    }

    /** Id of the offending match, or null for a match not yet saved. */
    public String getMatchId() {
        return matchId;
    }
}

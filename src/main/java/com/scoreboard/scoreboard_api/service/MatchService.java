package com.scoreboard.scoreboard_api.service;

import com.scoreboard.scoreboard_api.model.Match;
import com.scoreboard.scoreboard_api.model.Score;
import com.scoreboard.scoreboard_api.repository.MatchRepository;
import com.scoreboard.scoreboard_api.stats.InvalidMatchDataException;
import com.scoreboard.scoreboard_api.stats.MatchSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Append-only match log. Results are checked against the same rules the
 * stats snapshot applies before they are saved.
 */
@Service
public class MatchService {
    private static final Logger log = LoggerFactory.getLogger(MatchService.class);

    static final int MAX_COMMENT_LENGTH = 500;
    /** Width of the four player id columns; directory ids are at most this long too. */
    static final int MAX_PLAYER_ID_LENGTH = 32;

    private final MatchRepository matchRepository;
    private final Clock clock;

    @Autowired
    public MatchService(MatchRepository matchRepository) {
        this(matchRepository, Clock.systemUTC());
    }

    MatchService(MatchRepository matchRepository, Clock clock) {
        this.matchRepository = matchRepository;
        this.clock = clock;
    }

    // =========================================================================
    // Record
    // =========================================================================

    /**
     * Validate and store a new result.
     *
     * @param command    the result; a null playedAt means now
     * @param recordedBy user id of the submitter
     * @throws InvalidMatchDataException if the result is malformed (nothing is saved)
     */
    @Transactional
    public Match recordMatch(RecordMatchCommand command, String recordedBy) {
        if ((command.winnerScore() == null) != (command.loserScore() == null)) {
            throw new InvalidMatchDataException(null, "winner and loser scores must be given together");
        }
        if (command.comment() != null && command.comment().length() > MAX_COMMENT_LENGTH) {
            throw new InvalidMatchDataException(null,
                    "comment must be " + MAX_COMMENT_LENGTH + " characters or fewer");
        }

        Score score = command.winnerScore() != null
                ? new Score(command.winnerScore(), command.loserScore())
                : null;
        Instant playedAt = command.playedAt() != null ? command.playedAt() : Instant.now(clock);

        Match match = new Match(
                trim(command.winner1Id()), trim(command.winner2Id()),
                trim(command.loser1Id()), trim(command.loser2Id()),
                score, command.comment(), recordedBy, playedAt);
        MatchSnapshot.validate(match);
        for (String playerId : match.getPlayerIds()) {
            if (playerId.length() > MAX_PLAYER_ID_LENGTH) {
                throw new InvalidMatchDataException(null,
                        "player id '" + playerId + "' is longer than " + MAX_PLAYER_ID_LENGTH + " characters");
            }
        }

        Match saved = matchRepository.save(match);
        log.info("Recorded match {}: {} + {} beat {} + {}{}", saved.getId(),
                saved.getWinner1Id(), saved.getWinner2Id(), saved.getLoser1Id(), saved.getLoser2Id(),
                saved.getScore().map(s -> " " + s.winnerScore() + "-" + s.loserScore()).orElse(""));
        return saved;
    }

    // =========================================================================
    // Read
    // =========================================================================

    /**
     * Match history, newest first. A null or non-positive limit returns everything.
     */
    @Transactional(readOnly = true)
    public List<Match> listMatches(Integer limit) {
        if (limit == null || limit <= 0) {
            return matchRepository.findAllNewestFirst();
        }
        return matchRepository.findRecent(PageRequest.of(0, limit));
    }

    // =========================================================================
    // Delete (corrections)
    // =========================================================================

    @Transactional
    public void deleteMatch(String matchId) {
        if (!matchRepository.existsById(matchId)) {
            throw new NotFoundException("Match '" + matchId + "' not found.");
        }
        matchRepository.deleteById(matchId);
        log.info("Deleted match {}", matchId);
    }

    private static String trim(String s) {
        return s == null ? null : s.trim();
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record RecordMatchCommand(
            String winner1Id, String winner2Id,
            String loser1Id, String loser2Id,
            Integer winnerScore, Integer loserScore,
            String comment,
            Instant playedAt
    ) {}

    public record MatchResponse(
            String id,
            String winner1Id, String winner2Id,
            String loser1Id, String loser2Id,
            Integer winnerScore, Integer loserScore,
            String comment,
            String recordedBy,
            Instant playedAt
    ) {
        public static MatchResponse from(Match m) {
            Score score = m.getScore().orElse(null);
            return new MatchResponse(
                    m.getId(),
                    m.getWinner1Id(), m.getWinner2Id(),
                    m.getLoser1Id(), m.getLoser2Id(),
                    score != null ? score.winnerScore() : null,
                    score != null ? score.loserScore() : null,
                    m.getComment(),
                    m.getRecordedBy(),
                    m.getPlayedAt());
        }
    }
}

package com.scoreboard.scoreboard_api.repository;

import com.scoreboard.scoreboard_api.model.Match;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface MatchRepository extends JpaRepository<Match, String> {

    /**
     * Full match log, newest first. Same-instant matches fall back to id order
     * so the stats engine and the history view agree on "most recent".
     */
    @Query("""
        SELECT m FROM Match m
        ORDER BY m.playedAt DESC, m.id ASC
        """)
    List<Match> findAllNewestFirst();

    /**
     * Recency-bounded match log for the history view.
     */
    @Query("""
        SELECT m FROM Match m
        ORDER BY m.playedAt DESC, m.id ASC
        """)
    List<Match> findRecent(Pageable pageable);
}

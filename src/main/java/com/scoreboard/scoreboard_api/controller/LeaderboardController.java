package com.scoreboard.scoreboard_api.controller;

import com.scoreboard.scoreboard_api.controller.AuthController.ErrorResponse;
import com.scoreboard.scoreboard_api.service.NotFoundException;
import com.scoreboard.scoreboard_api.service.StatsService;
import com.scoreboard.scoreboard_api.stats.InvalidMatchDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Derived stats. Every endpoint recomputes from the stored match log.
 *
 * An InvalidMatchDataException here means a corrupt row made it into the
 * table; it is logged and reported as a server error.
 */
@RestController
@RequestMapping("/api")
public class LeaderboardController {
    private static final Logger log = LoggerFactory.getLogger(LeaderboardController.class);

    private final StatsService statsService;

    public LeaderboardController(StatsService statsService) {
        this.statsService = statsService;
    }

    // =========================================================================
    // GET /api/leaderboard?minGames=0
    // =========================================================================
    @GetMapping("/leaderboard")
    public ResponseEntity<?> leaderboard(@RequestParam(required = false) Integer minGames) {
        try {
            return ResponseEntity.ok(statsService.leaderboard(minGames));
        } catch (InvalidMatchDataException e) {
            return corruptData(e);
        }
    }

    // =========================================================================
    // GET /api/players/{id}/stats?recentLimit=10
    // =========================================================================
    @GetMapping("/players/{id}/stats")
    public ResponseEntity<?> playerStats(@PathVariable String id,
                                         @RequestParam(required = false) Integer recentLimit) {
        try {
            return ResponseEntity.ok(statsService.playerStats(id, recentLimit));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        } catch (InvalidMatchDataException e) {
            return corruptData(e);
        }
    }

    // =========================================================================
    // GET /api/rivalries?minEncounters=2
    // =========================================================================
    @GetMapping("/rivalries")
    public ResponseEntity<?> rivalries(@RequestParam(required = false) Integer minEncounters) {
        try {
            return ResponseEntity.ok(statsService.rivalries(minEncounters));
        } catch (InvalidMatchDataException e) {
            return corruptData(e);
        }
    }

    // =========================================================================
    // GET /api/hall-of-shame?minGamesForWorstRate=5&losingStreakThreshold=3
    // =========================================================================
    @GetMapping("/hall-of-shame")
    public ResponseEntity<?> hallOfShame(@RequestParam(required = false) Integer minGamesForWorstRate,
                                         @RequestParam(required = false) Integer losingStreakThreshold) {
        try {
            return ResponseEntity.ok(statsService.hallOfShame(minGamesForWorstRate, losingStreakThreshold));
        } catch (InvalidMatchDataException e) {
            return corruptData(e);
        }
    }

    private ResponseEntity<ErrorResponse> corruptData(InvalidMatchDataException e) {
        log.error("Stored match data is invalid (match {}): {}", e.getMatchId(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Stored match data is invalid."));
    }
}

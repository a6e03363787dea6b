package com.scoreboard.scoreboard_api.controller;

import com.scoreboard.scoreboard_api.controller.AuthController.ErrorResponse;
import com.scoreboard.scoreboard_api.model.Match;
import com.scoreboard.scoreboard_api.service.MatchService;
import com.scoreboard.scoreboard_api.service.MatchService.MatchResponse;
import com.scoreboard.scoreboard_api.service.MatchService.RecordMatchCommand;
import com.scoreboard.scoreboard_api.service.NotFoundException;
import com.scoreboard.scoreboard_api.stats.InvalidMatchDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/matches")
public class MatchController {
    private static final Logger log = LoggerFactory.getLogger(MatchController.class);

    /** Broadcast destination for match log changes. */
    public static final String MATCH_TOPIC = "/topic/matches";

    private final MatchService matchService;
    private final SimpMessagingTemplate messagingTemplate;

    public MatchController(MatchService matchService, SimpMessagingTemplate messagingTemplate) {
        this.matchService = matchService;
        this.messagingTemplate = messagingTemplate;
    }

    // =========================================================================
    // GET /api/matches?limit=20
    // =========================================================================
    @GetMapping
    public ResponseEntity<List<MatchResponse>> listMatches(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(matchService.listMatches(limit).stream().map(MatchResponse::from).toList());
    }

    // =========================================================================
    // POST /api/matches
    // =========================================================================
    @PostMapping
    public ResponseEntity<?> recordMatch(@RequestBody RecordMatchCommand request, Principal principal) {
        try {
            Match match = matchService.recordMatch(request, principal.getName());
            messagingTemplate.convertAndSend(MATCH_TOPIC, new MatchEvent(MatchEventType.RECORDED, match.getId()));
            return ResponseEntity.status(HttpStatus.CREATED).body(MatchResponse.from(match));
        } catch (InvalidMatchDataException e) {
            log.warn("Rejected match from {}: {}", principal.getName(), e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // DELETE /api/matches/{id}
    // =========================================================================
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteMatch(@PathVariable String id) {
        try {
            matchService.deleteMatch(id);
            messagingTemplate.convertAndSend(MATCH_TOPIC, new MatchEvent(MatchEventType.DELETED, id));
            return ResponseEntity.noContent().build();
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // WebSocket payloads
    // =========================================================================
    public enum MatchEventType { RECORDED, DELETED }

    /** Tells subscribers to re-query; carries no stats. */
    public record MatchEvent(MatchEventType type, String matchId) {}
}

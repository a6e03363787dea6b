package com.scoreboard.scoreboard_api.controller;

import com.scoreboard.scoreboard_api.controller.AuthController.ErrorResponse;
import com.scoreboard.scoreboard_api.model.Player;
import com.scoreboard.scoreboard_api.service.NotFoundException;
import com.scoreboard.scoreboard_api.service.PlayerService;
import com.scoreboard.scoreboard_api.service.PlayerService.PlayerConflictException;
import com.scoreboard.scoreboard_api.service.PlayerService.PlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerController {
    private static final Logger log = LoggerFactory.getLogger(PlayerController.class);

    private final PlayerService playerService;

    public PlayerController(PlayerService playerService) {
        this.playerService = playerService;
    }

    // =========================================================================
    // GET /api/players
    // =========================================================================
    @GetMapping
    public ResponseEntity<List<PlayerResponse>> listPlayers() {
        return ResponseEntity.ok(playerService.listPlayers().stream().map(PlayerResponse::from).toList());
    }

    // =========================================================================
    // POST /api/players
    // =========================================================================
    @PostMapping
    public ResponseEntity<?> createPlayer(@RequestBody CreatePlayerRequest request) {
        try {
            Player player = playerService.createPlayer(
                    request.id(), request.name(), request.nickname(), request.avatarEmoji());
            return ResponseEntity.status(HttpStatus.CREATED).body(PlayerResponse.from(player));
        } catch (PlayerConflictException e) {
            log.warn("Create player rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
        } catch (PlayerException e) {
            log.warn("Create player rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // PUT /api/players/{id}
    // =========================================================================
    @PutMapping("/{id}")
    public ResponseEntity<?> updatePlayer(@PathVariable String id, @RequestBody UpdatePlayerRequest request) {
        try {
            Player player = playerService.updatePlayer(
                    id, request.name(), request.nickname(), request.avatarEmoji());
            return ResponseEntity.ok(PlayerResponse.from(player));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        } catch (PlayerException e) {
            log.warn("Update of player {} rejected: {}", id, e.getMessage());
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // DELETE /api/players/{id}
    // =========================================================================
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deletePlayer(@PathVariable String id) {
        try {
            playerService.deletePlayer(id);
            return ResponseEntity.noContent().build();
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // DTOs
    // =========================================================================
    public record CreatePlayerRequest(String id, String name, String nickname, String avatarEmoji) {}

    /** Null fields are left unchanged. */
    public record UpdatePlayerRequest(String name, String nickname, String avatarEmoji) {}

    public record PlayerResponse(String id, String name, String nickname, String avatarEmoji, Instant createdAt) {
        static PlayerResponse from(Player p) {
            return new PlayerResponse(p.getId(), p.getName(), p.getNickname(), p.getAvatarEmoji(), p.getCreatedAt());
        }
    }
}

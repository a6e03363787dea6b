package com.scoreboard.scoreboard_api.service;

import com.scoreboard.scoreboard_api.model.Player;
import com.scoreboard.scoreboard_api.repository.PlayerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Player directory CRUD. Ids are URL slugs chosen at creation ("martin",
 * "sarah-k") and never change. Deleting a player leaves their matches in
 * place; stats fall back to the raw id for display.
 */
@Service
public class PlayerService {
    private static final Logger log = LoggerFactory.getLogger(PlayerService.class);

    static final String SLUG_PATTERN = "^[a-z0-9][a-z0-9_-]{0,31}$";
    static final int MAX_NAME_LENGTH = 50;
    /** Counted in characters (code points), as the avatar_emoji column counts them. */
    static final int MAX_AVATAR_LENGTH = 16;

    private final PlayerRepository playerRepository;

    public PlayerService(PlayerRepository playerRepository) {
        this.playerRepository = playerRepository;
    }

    public List<Player> listPlayers() {
        return playerRepository.findAllByOrderByIdAsc();
    }

    // =========================================================================
    // Create
    // =========================================================================

    @Transactional
    public Player createPlayer(String id, String name, String nickname, String avatarEmoji) {
        if (id == null || !id.matches(SLUG_PATTERN)) {
            throw new PlayerException(
                    "Player id must be 1-32 lowercase letters, digits, '-' or '_', starting with a letter or digit.");
        }
        if (name == null || name.isBlank()) {
            throw new PlayerException("Player name is required.");
        }
        checkDisplayLengths(name, nickname, avatarEmoji);
        if (playerRepository.existsById(id)) {
            throw new PlayerConflictException("Player '" + id + "' already exists.");
        }

        Player player = playerRepository.save(new Player(id, name.trim(), nickname, avatarEmoji));
        log.info("Created player {} ({})", player.getId(), player.getName());
        return player;
    }

    // =========================================================================
    // Update (partial: null fields are left unchanged)
    // =========================================================================

    @Transactional
    public Player updatePlayer(String id, String name, String nickname, String avatarEmoji) {
        Player player = playerRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Player '" + id + "' not found."));
        checkDisplayLengths(name, nickname, avatarEmoji);

        if (name != null) {
            if (name.isBlank()) {
                throw new PlayerException("Player name cannot be blank.");
            }
            player.setName(name.trim());
        }
        if (nickname != null) {
            player.setNickname(nickname);
        }
        if (avatarEmoji != null) {
            player.setAvatarEmoji(avatarEmoji);
        }

        log.info("Updated player {}", id);
        return playerRepository.save(player);
    }

    // =========================================================================
    // Delete
    // =========================================================================

    @Transactional
    public void deletePlayer(String id) {
        if (!playerRepository.existsById(id)) {
            throw new NotFoundException("Player '" + id + "' not found.");
        }
        playerRepository.deleteById(id);
        log.info("Deleted player {}", id);
    }

    private static void checkDisplayLengths(String name, String nickname, String avatarEmoji) {
        if (name != null && name.trim().length() > MAX_NAME_LENGTH) {
            throw new PlayerException("Player name must be " + MAX_NAME_LENGTH + " characters or fewer.");
        }
        if (nickname != null && nickname.length() > MAX_NAME_LENGTH) {
            throw new PlayerException("Nickname must be " + MAX_NAME_LENGTH + " characters or fewer.");
        }
        if (avatarEmoji != null && avatarEmoji.codePointCount(0, avatarEmoji.length()) > MAX_AVATAR_LENGTH) {
            throw new PlayerException("Avatar must be " + MAX_AVATAR_LENGTH + " characters or fewer.");
        }
    }

    // =========================================================================
    // Exceptions
    // =========================================================================

    /** Invalid player input. Mapped to 400. */
    public static class PlayerException extends RuntimeException {
        public PlayerException(String message) {
            super(message);
        }
    }

    /** Duplicate player id. Mapped to 409. */
    public static class PlayerConflictException extends PlayerException {
        public PlayerConflictException(String message) {
            super(message);
        }
    }
}

package com.scoreboard.scoreboard_api.service;

import com.scoreboard.scoreboard_api.model.User;
import com.scoreboard.scoreboard_api.repository.UserRepository;
import com.scoreboard.scoreboard_api.security.JwtUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Account registration and login. Accounts are separate from the player
 * directory: any logged-in user can record matches for any players.
 */
@Service
public class AuthService {
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil jwtUtil;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtUtil jwtUtil) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtil = jwtUtil;
    }

    // =========================================================================
    // Register
    // =========================================================================

    @Transactional
    public AuthResult register(String username, String password) {
        if (username == null || username.isBlank()) {
            throw new AuthException("Username is required.");
        }
        if (password == null || password.length() < 6) {
            throw new AuthException("Password must be at least 6 characters.");
        }
        if (username.length() > 20) {
            throw new AuthException("Username must be 20 characters or fewer.");
        }
        if (!username.matches("^[a-zA-Z0-9_]+$")) {
            throw new AuthException("Username can only contain letters, numbers, and underscores.");
        }
        if (userRepository.existsByUsername(username)) {
            throw new AuthException("Username is already taken.");
        }

        User user = userRepository.save(new User(username, passwordEncoder.encode(password)));
        log.info("Registered user {}", user.getUsername());

        String accessToken = jwtUtil.issueFor(user);
        return new AuthResult(accessToken, user.getId(), user.getUsername());
    }

    // =========================================================================
    // Login
    // =========================================================================

    public AuthResult login(String username, String password) {
        User user = userRepository.findByUsername(username)
                .orElseThrow(() -> new AuthException("Invalid username or password."));

        if (password == null || !passwordEncoder.matches(password, user.getPasswordHash())) {
            log.warn("Failed login for {}", username);
            throw new AuthException("Invalid username or password.");
        }

        String accessToken = jwtUtil.issueFor(user);
        return new AuthResult(accessToken, user.getId(), user.getUsername());
    }

    // =========================================================================
    // Current user
    // =========================================================================

    /** Resolve the principal name set by the JWT filter (a user id) to its account. */
    public Optional<User> findUser(String userId) {
        if (userId == null) return Optional.empty();
        try {
            return userRepository.findById(UUID.fromString(userId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    // =========================================================================
    // DTOs & Exception
    // =========================================================================

    public record AuthResult(String accessToken, UUID userId, String username) {}

    public static class AuthException extends RuntimeException {
        public AuthException(String message) {
            super(message);
        }
    }
}

package com.scoreboard.scoreboard_api.security;

import com.scoreboard.scoreboard_api.model.User;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Session tokens for scorekeeper accounts.
 *
 * A token names exactly one {@link User} by id (the JWT subject) and is
 * stamped with this service as issuer. Nothing else rides along: display
 * data such as the username is looked up from the account when needed, so a
 * token never goes stale when an account changes.
 */
@Component
public class JwtUtil {

    static final String ISSUER = "scoreboard-api";

    private final SecretKey signingKey;
    private final Duration sessionLifetime;
    private final Clock clock;

    @Autowired
    public JwtUtil(@Value("${scoreboard.jwt.secret}") String secret,
                   @Value("${scoreboard.jwt.access-token-expiration-ms:86400000}") long sessionLifetimeMs) {
        this(secret, Duration.ofMillis(sessionLifetimeMs), Clock.systemUTC());
    }

    JwtUtil(String secret, Duration sessionLifetime, Clock clock) {
        // HS256 rejects keys shorter than 32 bytes
        this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.sessionLifetime = sessionLifetime;
        this.clock = clock;
    }

    // =========================================================================
    // Issue
    // =========================================================================

    /** Token for a saved account (the id must already be assigned). */
    public String issueFor(User user) {
        if (user.getId() == null) {
            throw new IllegalArgumentException("Cannot issue a session for an unsaved account");
        }
        Instant issuedAt = clock.instant();
        return Jwts.builder()
                .issuer(ISSUER)
                .subject(user.getId().toString())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(sessionLifetime)))
                .signWith(signingKey)
                .compact();
    }

    // =========================================================================
    // Verify
    // =========================================================================

    /**
     * Account id named by a token, if the token is ours, intact and unexpired.
     * Anything else (wrong key, foreign issuer, garbage) comes back empty.
     */
    public Optional<UUID> accountIdOf(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            String subject = Jwts.parser()
                    .verifyWith(signingKey)
                    .requireIssuer(ISSUER)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload()
                    .getSubject();
            return Optional.of(UUID.fromString(subject));
        } catch (JwtException | IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}

package com.scoreboard.scoreboard_api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns a bearer session token into the request principal.
 *
 * The principal's name is the scorekeeper's account id. That is the value
 * controllers receive as {@code Principal#getName()}: match recording stores
 * it as {@code recordedBy} and {@code /api/auth/me} resolves it back to the
 * account. Requests without a usable token pass through unauthenticated and
 * are turned away by the security chain where a login is required.
 */
@Component
public class JwtAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    private static final String BEARER = "Bearer ";

    private final JwtUtil jwtUtil;
    private final WebAuthenticationDetailsSource detailsSource = new WebAuthenticationDetailsSource();

    public JwtAuthFilter(JwtUtil jwtUtil) {
        this.jwtUtil = jwtUtil;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            bearerToken(request).ifPresent(token -> {
                Optional<UUID> accountId = jwtUtil.accountIdOf(token);
                if (accountId.isPresent()) {
                    signIn(accountId.get(), request);
                } else {
                    log.debug("Ignoring unusable session token on {} {}", request.getMethod(), request.getRequestURI());
                }
            });
        }
        filterChain.doFilter(request, response);
    }

    private void signIn(UUID accountId, HttpServletRequest request) {
        // Every scorekeeper has the same rights, so no authorities
        UsernamePasswordAuthenticationToken authentication =
                UsernamePasswordAuthenticationToken.authenticated(accountId.toString(), null, List.of());
        authentication.setDetails(detailsSource.buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    static Optional<String> bearerToken(HttpServletRequest request) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER)) {
            return Optional.empty();
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}

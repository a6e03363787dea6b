package com.scoreboard.scoreboard_api.security;

import com.scoreboard.scoreboard_api.model.User;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import static com.scoreboard.util.TestFixtures.buildUser;
import static org.junit.jupiter.api.Assertions.*;

class JwtAuthFilterTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256";

    private final JwtUtil jwtUtil = new JwtUtil(SECRET, 60_000);
    private final JwtAuthFilter filter = new JwtAuthFilter(jwtUtil);

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    private Authentication run(MockHttpServletRequest request) throws Exception {
        MockFilterChain chain = new MockFilterChain();
        filter.doFilter(request, new MockHttpServletResponse(), chain);
        assertNotNull(chain.getRequest(), "request must always continue down the chain");
        return SecurityContextHolder.getContext().getAuthentication();
    }

    private static MockHttpServletRequest post(String authorization) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/matches");
        if (authorization != null) {
            request.addHeader("Authorization", authorization);
        }
        return request;
    }

    @Test
    @DisplayName("validBearer_principalNameIsTheAccountId")
    void validBearer_principalNameIsTheAccountId() throws Exception {
        User user = buildUser("martin");

        Authentication auth = run(post("Bearer " + jwtUtil.issueFor(user)));

        assertNotNull(auth);
        assertTrue(auth.isAuthenticated());
        // MatchController records this value as recordedBy
        assertEquals(user.getId().toString(), auth.getName());
        assertTrue(auth.getAuthorities().isEmpty());
    }

    @Test
    @DisplayName("noHeader_staysAnonymous")
    void noHeader_staysAnonymous() throws Exception {
        assertNull(run(post(null)));
    }

    @Test
    @DisplayName("otherScheme_staysAnonymous")
    void otherScheme_staysAnonymous() throws Exception {
        assertNull(run(post("Basic bWFydGluOnBhc3N3b3Jk")));
    }

    @Test
    @DisplayName("invalidToken_staysAnonymous")
    void invalidToken_staysAnonymous() throws Exception {
        assertNull(run(post("Bearer not-a-jwt")));
        assertNull(run(post("Bearer ")));
    }
}

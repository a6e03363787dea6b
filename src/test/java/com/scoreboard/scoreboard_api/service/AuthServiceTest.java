package com.scoreboard.scoreboard_api.service;

import com.scoreboard.scoreboard_api.model.User;
import com.scoreboard.scoreboard_api.repository.UserRepository;
import com.scoreboard.scoreboard_api.security.JwtUtil;
import com.scoreboard.scoreboard_api.service.AuthService.AuthException;
import com.scoreboard.scoreboard_api.service.AuthService.AuthResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Optional;
import java.util.UUID;

import static com.scoreboard.util.TestFixtures.DEFAULT_PASSWORD;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "test-secret-key-that-is-long-enough-for-hs256";

    @Mock private UserRepository userRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private final JwtUtil jwtUtil = new JwtUtil(SECRET, 60_000);
    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(userRepository, passwordEncoder, jwtUtil);
    }

    private User storedUser(String username) {
        User user = new User(username, passwordEncoder.encode(DEFAULT_PASSWORD));
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        return user;
    }

    @Test
    @DisplayName("register_storesHashedPassword_andIssuesToken")
    void register_storesHashedPassword_andIssuesToken() {
        UUID id = UUID.randomUUID();
        when(userRepository.existsByUsername("martin")).thenReturn(false);
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            ReflectionTestUtils.setField(u, "id", id);
            return u;
        });

        AuthResult result = authService.register("martin", DEFAULT_PASSWORD);

        assertEquals(id, result.userId());
        assertEquals("martin", result.username());
        assertEquals(Optional.of(id), jwtUtil.accountIdOf(result.accessToken()));
        verify(userRepository).save(argThat(u -> passwordEncoder.matches(DEFAULT_PASSWORD, u.getPasswordHash())));
    }

    @Test
    @DisplayName("register_takenUsername_isRejected")
    void register_takenUsername_isRejected() {
        when(userRepository.existsByUsername("martin")).thenReturn(true);

        assertThrows(AuthException.class, () -> authService.register("martin", DEFAULT_PASSWORD));
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("register_invalidInput_isRejected")
    void register_invalidInput_isRejected() {
        assertThrows(AuthException.class, () -> authService.register("", DEFAULT_PASSWORD));
        assertThrows(AuthException.class, () -> authService.register("martin", "short"));
        assertThrows(AuthException.class, () -> authService.register("bad name", DEFAULT_PASSWORD));
        assertThrows(AuthException.class, () -> authService.register("x".repeat(21), DEFAULT_PASSWORD));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("login_correctPassword_issuesToken")
    void login_correctPassword_issuesToken() {
        User user = storedUser("martin");
        when(userRepository.findByUsername("martin")).thenReturn(Optional.of(user));

        AuthResult result = authService.login("martin", DEFAULT_PASSWORD);

        assertEquals(user.getId(), result.userId());
        assertEquals("martin", result.username());
        assertEquals(Optional.of(user.getId()), jwtUtil.accountIdOf(result.accessToken()));
    }

    @Test
    @DisplayName("login_wrongPasswordOrUnknownUser_isRejected")
    void login_wrongPasswordOrUnknownUser_isRejected() {
        when(userRepository.findByUsername("martin")).thenReturn(Optional.of(storedUser("martin")));
        when(userRepository.findByUsername("ghost")).thenReturn(Optional.empty());

        assertThrows(AuthException.class, () -> authService.login("martin", "wrong-password"));
        assertThrows(AuthException.class, () -> authService.login("ghost", DEFAULT_PASSWORD));
    }

    @Test
    @DisplayName("findUser_toleratesMalformedIds")
    void findUser_toleratesMalformedIds() {
        assertTrue(authService.findUser("not-a-uuid").isEmpty());
        assertTrue(authService.findUser(null).isEmpty());
        verifyNoInteractions(userRepository);
    }
}

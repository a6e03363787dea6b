package com.scoreboard.scoreboard_api.controller;

import com.scoreboard.scoreboard_api.service.AuthService;
import com.scoreboard.scoreboard_api.service.AuthService.AuthException;
import com.scoreboard.scoreboard_api.service.AuthService.AuthResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    // =========================================================================
    // POST /api/auth/register
    // =========================================================================
    @PostMapping("/register")
    public ResponseEntity<?> register(@RequestBody AuthRequest request) {
        try {
            AuthResult result = authService.register(request.username(), request.password());
            return ResponseEntity.status(HttpStatus.CREATED).body(result);
        } catch (AuthException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // POST /api/auth/login
    // =========================================================================
    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody AuthRequest request) {
        try {
            AuthResult result = authService.login(request.username(), request.password());
            return ResponseEntity.ok(result);
        } catch (AuthException e) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(new ErrorResponse(e.getMessage()));
        }
    }

    // =========================================================================
    // GET /api/auth/me  (public; reports whether the caller's token is valid)
    // =========================================================================
    @GetMapping("/me")
    public ResponseEntity<MeResponse> me(Principal principal) {
        if (principal == null) {
            return ResponseEntity.ok(MeResponse.anonymous());
        }
        return ResponseEntity.ok(authService.findUser(principal.getName())
                .map(user -> new MeResponse(true, user.getId().toString(), user.getUsername()))
                .orElseGet(MeResponse::anonymous));
    }

    // =========================================================================
    // Request/Response DTOs
    // =========================================================================
    public record AuthRequest(String username, String password) {}

    public record MeResponse(boolean authenticated, String userId, String username) {
        static MeResponse anonymous() {
            return new MeResponse(false, null, null);
        }
    }

    public record ErrorResponse(String error) {}
}

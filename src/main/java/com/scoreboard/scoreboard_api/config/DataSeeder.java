package com.scoreboard.scoreboard_api.config;

import com.scoreboard.scoreboard_api.model.Player;
import com.scoreboard.scoreboard_api.model.User;
import com.scoreboard.scoreboard_api.repository.PlayerRepository;
import com.scoreboard.scoreboard_api.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Dev convenience: one login and a starter roster on an empty database.
 * Off unless scoreboard.seed.enabled=true.
 */
@Component
@ConditionalOnProperty(name = "scoreboard.seed.enabled", havingValue = "true")
public class DataSeeder implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final UserRepository userRepository;
    private final PlayerRepository playerRepository;
    private final PasswordEncoder passwordEncoder;

    public DataSeeder(UserRepository userRepository,
                      PlayerRepository playerRepository,
                      PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.playerRepository = playerRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public void run(String... args) {
        if (userRepository.count() == 0) {
            // Dev password only
            userRepository.save(new User("admin", passwordEncoder.encode("password123")));
            log.info("Seeded dev user 'admin'");
        }
        if (playerRepository.count() == 0) {
            playerRepository.save(new Player("martin", "Martin", "The Wall", "🧱"));
            playerRepository.save(new Player("sarah", "Sarah", "Dink Queen", "👑"));
            playerRepository.save(new Player("jake", "Jake", "", "🔥"));
            playerRepository.save(new Player("priya", "Priya", "Lobster", "🦞"));
            log.info("Seeded {} players", playerRepository.count());
        }
    }
}

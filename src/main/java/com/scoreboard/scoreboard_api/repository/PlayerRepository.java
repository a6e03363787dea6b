package com.scoreboard.scoreboard_api.repository;

import com.scoreboard.scoreboard_api.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlayerRepository extends JpaRepository<Player, String> {

    /** Directory listing in stable id order. */
    List<Player> findAllByOrderByIdAsc();
}

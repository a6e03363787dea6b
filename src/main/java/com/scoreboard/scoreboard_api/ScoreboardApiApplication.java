package com.scoreboard.scoreboard_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScoreboardApiApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScoreboardApiApplication.class, args);
	}

}

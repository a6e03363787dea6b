package com.scoreboard.scoreboard_api.service;

/**
 * A player or match id that does not exist. Controllers map it to 404.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}

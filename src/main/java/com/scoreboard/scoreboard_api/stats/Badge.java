package com.scoreboard.scoreboard_api.stats;

/**
 * Achievement badge as shown on a player profile.
 */
public record Badge(String code, String title, String emoji, String description) {}

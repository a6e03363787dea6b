package com.scoreboard.scoreboard_api.stats;

import com.scoreboard.scoreboard_api.model.Player;

/**
 * Presentation fields for a player id. Ids missing from the directory get
 * their raw id as the name.
 */
public record PlayerDisplay(String name, String nickname, String avatarEmoji) {

    public static PlayerDisplay of(Player player) {
        return new PlayerDisplay(player.getName(), player.getNickname(), player.getAvatarEmoji());
    }

    public static PlayerDisplay unknown(String playerId) {
        return new PlayerDisplay(playerId, "", Player.DEFAULT_AVATAR);
    }
}

package com.scoreboard.scoreboard_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Player directory entry. The id is a URL-friendly slug chosen at creation
 * time (e.g. "martin") and never changes; the display fields are edited in
 * place.
 *
 * Win/loss numbers are not stored here. The stats engine derives them from
 * the match log on every read.
 */
@Getter
@Entity
@Table(name = "players")
public class Player {

    public static final String DEFAULT_AVATAR = "🏓";

    @Id
    @Column(length = 32)
    private String id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false, length = 50)
    private String nickname = "";

    @Column(name = "avatar_emoji", nullable = false, length = 16)
    private String avatarEmoji = DEFAULT_AVATAR;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    protected Player() {}

    public Player(String id, String name) {
        this(id, name, "", DEFAULT_AVATAR);
    }

    public Player(String id, String name, String nickname, String avatarEmoji) {
        this.id = id;
        this.name = name;
        setNickname(nickname);
        setAvatarEmoji(avatarEmoji);
    }

    // Setters (display fields only; the id is immutable)
    public void setName(String name) { this.name = name; }

    public void setNickname(String nickname) {
        this.nickname = nickname != null ? nickname : "";
    }

    public void setAvatarEmoji(String avatarEmoji) {
        this.avatarEmoji = (avatarEmoji == null || avatarEmoji.isBlank()) ? DEFAULT_AVATAR : avatarEmoji;
    }
}

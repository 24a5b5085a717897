package com.banchess.gameservice.games.banchess.domain.enums;

import com.banchess.rules.Color;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 连接在某个对局中的角色。
 * BOTH 仅出现在单人对局：同一身份同时持有黑白双方座位。
 */
public enum SeatRole {
    WHITE("white"),
    BLACK("black"),
    BOTH("both"),
    SPECTATOR("spectator");

    private final String wireName;

    SeatRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isPlayer() {
        return this != SPECTATOR;
    }

    /** 该角色能否替 color 一方行动 */
    public boolean canActFor(Color color) {
        switch (this) {
            case WHITE:
                return color == Color.WHITE;
            case BLACK:
                return color == Color.BLACK;
            case BOTH:
                return true;
            default:
                return false;
        }
    }

    public static SeatRole of(Color color) {
        return color == Color.WHITE ? WHITE : BLACK;
    }
}

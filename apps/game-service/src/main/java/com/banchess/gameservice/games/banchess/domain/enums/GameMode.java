package com.banchess.gameservice.games.banchess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局模式：单人自对弈 / 在线匹配。
 */
public enum GameMode {

    SOLO("solo"),     // 同一身份同时持有黑白双方座位
    ONLINE("online"); // 两名不同玩家

    private final String wireName;

    GameMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static GameMode fromWire(String s) {
        for (GameMode m : values()) {
            if (m.wireName.equalsIgnoreCase(s) || m.name().equalsIgnoreCase(s)) {
                return m;
            }
        }
        throw new IllegalArgumentException("unknown mode: " + s);
    }
}

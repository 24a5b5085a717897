package com.banchess.gameservice.games.banchess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** 终局原因 */
public enum TerminationReason {
    CHECKMATE("checkmate"),
    STALEMATE("stalemate"),
    RESIGNATION("resignation"),
    /** 行棋时钟走完 */
    TIMEOUT("timeout"),
    /** 断线后宽限期内未重连 */
    TIMEOUT_FORFEIT("timeout-forfeit"),
    DRAW_AGREEMENT("draw-agreement"),
    INSUFFICIENT_MATERIAL("insufficient-material"),
    /** 单人对局断线超时，无胜负 */
    ABANDONMENT("abandonment"),
    /** 对局工作线程内部故障 */
    ERROR("error");

    private final String wireName;

    TerminationReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static TerminationReason fromWire(String s) {
        for (TerminationReason r : values()) {
            if (r.wireName.equals(s) || r.name().equals(s)) {
                return r;
            }
        }
        throw new IllegalArgumentException("unknown termination reason: " + s);
    }
}

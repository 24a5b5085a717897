package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 离开队列的结果。
 */
public enum LeaveResult {
    LEFT("left"),
    NOT_QUEUED("not-queued"),
    /** 离开请求与配对竞争，配对已先完成 */
    ALREADY_MATCHED("already-matched");

    private final String wireName;

    LeaveResult(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}

package com.banchess.gameservice.games.banchess.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局状态，只能单向前进：WAITING → ACTIVE → FINISHED。
 */
public enum SessionStatus {

    WAITING("waiting"),   // 已创建，等待开始（不接受动作）
    ACTIVE("active"),     // 对局中
    FINISHED("finished"); // 已结束（result 必然存在）

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean canTransitionTo(SessionStatus next) {
        return next.ordinal() > this.ordinal();
    }
}

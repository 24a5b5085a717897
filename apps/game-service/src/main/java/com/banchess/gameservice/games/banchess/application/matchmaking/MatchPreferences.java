package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.banchess.gameservice.games.banchess.domain.model.TimeControl;

/**
 * 匹配偏好。偏好相同（时间控制一致）的玩家才会被配对。
 */
public record MatchPreferences(TimeControl timeControl) {

    public MatchPreferences {
        if (timeControl == null) {
            timeControl = TimeControl.DEFAULT;
        }
    }

    /** 偏好分组键 */
    public String preferenceClass() {
        return timeControl.toString();
    }
}

package com.banchess.gameservice.platform.ongoing;

import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 记录某个用户正在进行中的对局，用于前端展示“继续对局”入口。
 */
@Data
@NoArgsConstructor
public class OngoingGameInfo {

    private String sessionId;

    private String mode;

    private String color;

    private String opponent;

    private long updatedAt;

    /**
     * @param color 该用户执子颜色；单人对局为 both
     */
    public static OngoingGameInfo of(SessionView view, String color, String opponent, long now) {
        OngoingGameInfo info = new OngoingGameInfo();
        info.setSessionId(view.sessionId());
        info.setMode(view.mode().wireName());
        info.setColor(color);
        info.setOpponent(opponent);
        info.setUpdatedAt(now);
        return info;
    }
}

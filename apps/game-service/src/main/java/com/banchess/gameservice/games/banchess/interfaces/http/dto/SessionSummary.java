package com.banchess.gameservice.games.banchess.interfaces.http.dto;

import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 进行中对局列表的单行摘要信息。
 * HTTP 层专用 DTO，从 SessionView 映射而来。
 */
@Data
@AllArgsConstructor
public class SessionSummary {
    private String sessionId;
    private String mode;
    private String status;
    private String whitePlayerId;
    private String whitePlayerName;
    private String blackPlayerId;
    private String blackPlayerName;
    private String timeControl;
    private int plies;
    private long createdAt;

    public static SessionSummary from(SessionView view) {
        return new SessionSummary(
                view.sessionId(),
                view.mode().wireName(),
                view.status().wireName(),
                view.white().userId(),
                view.white().displayName(),
                view.black().userId(),
                view.black().displayName(),
                view.timeControl(),
                view.history().size(),
                view.createdAt()
        );
    }
}

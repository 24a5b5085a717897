package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.rules.Color;

/**
 * 一次成功配对：先入队者执白。
 */
public record MatchResult(String sessionId, Identity white, Identity black, String timeControl) {

    public Identity opponentOf(Color color) {
        return color == Color.WHITE ? black : white;
    }
}

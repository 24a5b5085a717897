package com.banchess.gameservice.games.banchess.domain.model;

import com.banchess.gameservice.games.banchess.domain.enums.TerminationReason;
import com.banchess.rules.Color;

/**
 * 对局结果。winner 为 null 表示和棋或无胜负（abandonment / error）。
 */
public record GameResult(Color winner, TerminationReason reason) {

    /** "white" / "black" / "draw" */
    public String winnerName() {
        return winner == null ? "draw" : winner.wireName();
    }
}

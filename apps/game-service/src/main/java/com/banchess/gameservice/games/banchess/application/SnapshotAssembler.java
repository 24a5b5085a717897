package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot.PlayerView;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot.ResultView;

import java.util.List;

/**
 * 把对局视图按接收方角色裁剪成 state 快照。
 * 纯函数：同一视图 + 同一角色永远得到相同快照。
 */
public final class SnapshotAssembler {

    private SnapshotAssembler() {
    }

    public static StateSnapshot assemble(SessionView view, SeatRole role) {
        boolean mayAct = view.isActive() && view.actor() != null && role.canActFor(view.actor());
        return StateSnapshot.builder()
                .sessionId(view.sessionId())
                .mode(view.mode().wireName())
                .status(view.status().wireName())
                .yourRole(role.wireName())
                .white(PlayerView.of(view.white()))
                .black(PlayerView.of(view.black()))
                .fen(view.fen())
                .nextAction(view.phase() == null ? null : view.phase().wireName())
                .actor(view.actor() == null ? null : view.actor().wireName())
                .bannedMove(view.bannedMove())
                .inCheck(view.inCheck())
                .history(view.history())
                .legalActions(mayAct ? view.legalActions() : List.of())
                .result(ResultView.of(view.result()))
                .timeControl(view.timeControl())
                .clock(view.clock())
                .events(view.events())
                .drawOffer(view.drawOfferFrom() == null ? null : view.drawOfferFrom().wireName())
                .revision(view.revision())
                .build();
    }
}

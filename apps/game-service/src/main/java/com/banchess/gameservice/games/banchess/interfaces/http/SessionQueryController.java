package com.banchess.gameservice.games.banchess.interfaces.http;

import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.application.SnapshotAssembler;
import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot;
import com.banchess.gameservice.games.banchess.interfaces.http.dto.SessionSummary;
import com.banchess.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 进行中对局查询（只读）。
 * 数据来自内存中的 SessionRegistry，返回的快照与观战者通过 WebSocket 收到的一致。
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionQueryController {

    private final SessionRegistry registry;

    /**
     * 全部未结束对局的摘要，按创建时间排序。
     */
    @GetMapping
    public ApiResponse<List<SessionSummary>> list() {
        return ApiResponse.success(registry.listActive().stream()
                .map(SessionSummary::from)
                .toList());
    }

    /**
     * 单个对局的观战者快照；对局不存在时 404（由 WebExceptionAdvice 映射）。
     */
    @GetMapping("/{sessionId}")
    public ApiResponse<StateSnapshot> snapshot(@PathVariable String sessionId) {
        return ApiResponse.success(SnapshotAssembler.assemble(registry.require(sessionId).view(), SeatRole.SPECTATOR));
    }
}

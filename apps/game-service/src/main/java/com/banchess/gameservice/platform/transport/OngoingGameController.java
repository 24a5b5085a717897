package com.banchess.gameservice.platform.transport;

import com.banchess.gameservice.platform.ongoing.OngoingGameTracker;
import com.banchess.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 负责“继续对局”相关的查询与清理。
 * 前端可以用它来决定是否展示“继续对局”入口，以及在玩家主动放弃入口时清理状态。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class OngoingGameController {

    private final OngoingGameTracker tracker;

    /**
     * 查询当前登录用户是否存在进行中的对局。
     * 若存在，返回对局ID、模式、执子颜色与对手；否则返回 hasOngoing=false。
     */
    @GetMapping("/ongoing-game")
    public ResponseEntity<ApiResponse<Map<String, Object>>> ongoing(@AuthenticationPrincipal Jwt jwt) {
        String userId = jwt.getSubject();
        return tracker.find(userId)
                .map(info -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("hasOngoing", true);
                    body.put("sessionId", info.getSessionId());
                    body.put("mode", info.getMode());
                    body.put("color", info.getColor());
                    body.put("opponent", info.getOpponent());
                    body.put("updatedAt", info.getUpdatedAt());
                    return body;
                })
                .map(body -> ResponseEntity.ok(ApiResponse.success(body)))
                .orElseGet(() -> ResponseEntity.ok(ApiResponse.success(Map.of("hasOngoing", false))));
    }

    /**
     * 清除“继续对局”提示（不影响对局本身）。
     * 携带 sessionId 时只清除指向该对局的记录。
     */
    @PostMapping("/ongoing-game/end")
    public ResponseEntity<ApiResponse<Map<String, Object>>> end(
            @AuthenticationPrincipal Jwt jwt,
            @RequestBody(required = false) EndRequest request
    ) {
        String userId = jwt.getSubject();
        tracker.clearIfMatches(userId, request == null ? null : request.sessionId());
        return ResponseEntity.ok(ApiResponse.success(Map.of("hasOngoing", false)));
    }

    record EndRequest(String sessionId) {}
}

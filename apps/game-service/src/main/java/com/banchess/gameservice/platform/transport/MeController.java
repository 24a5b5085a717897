package com.banchess.gameservice.platform.transport;

import com.banchess.gameservice.games.banchess.application.LiveSession;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.web.common.ApiResponse;
import com.banchess.web.common.CurrentUserHelper;
import com.banchess.web.common.CurrentUserInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 当前用户信息查询接口
 * 返回 JWT 中解析出的身份，即 WebSocket authenticate 后对局中使用的 userId 与展示名，
 * 以及本进程内该用户进行中的对局（没有则为 null）。
 */
@RestController
@RequestMapping("/api/me")
@RequiredArgsConstructor
public class MeController {

    private final SessionRegistry registry;

    @GetMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> me(@AuthenticationPrincipal Jwt jwt) {
        CurrentUserInfo user = CurrentUserHelper.from(jwt);

        // LinkedHashMap：ongoingSessionId 允许为 null
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sub", user.userId());
        body.put("username", user.username());
        body.put("displayName", user.getDisplayName());
        body.put("realm_roles", user.realmRoles());
        body.put("ongoingSessionId", registry.findOngoingFor(user.userId()).map(LiveSession::id).orElse(null));
        return ResponseEntity.ok(ApiResponse.success(body));
    }
}

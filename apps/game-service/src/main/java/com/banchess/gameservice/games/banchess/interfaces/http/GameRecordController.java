package com.banchess.gameservice.games.banchess.interfaces.http;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.dto.GameRecord;
import com.banchess.gameservice.games.banchess.domain.repository.GameRecordRepository;
import com.banchess.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 终局记录查询。记录包含完整 BCN 序列，前端可据此复盘。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GameRecordController {

    private static final int MAX_LIMIT = 100;

    private final GameRecordRepository repository;

    @GetMapping("/games/{sessionId}")
    public ApiResponse<GameRecord> game(@PathVariable String sessionId) {
        return repository.findFinished(sessionId)
                .map(ApiResponse::success)
                .orElseThrow(() -> new GameException(ErrorCode.GAME_NOT_FOUND, "对局记录不存在: " + sessionId));
    }

    /**
     * 某用户最近的终局对局ID，按结束时间倒序。
     * @param limit 1~100，默认 20
     */
    @GetMapping("/users/{userId}/games")
    public ApiResponse<List<String>> recentGames(@PathVariable String userId,
                                                 @RequestParam(value = "limit", defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return ApiResponse.success(repository.recentFinishedIds(userId, limit));
    }
}

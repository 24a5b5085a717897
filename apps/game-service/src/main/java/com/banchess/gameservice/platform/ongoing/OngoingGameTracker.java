package com.banchess.gameservice.platform.ongoing;

import com.banchess.gameservice.games.banchess.application.SessionEventListener;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.games.banchess.infrastructure.redis.RedisKeys;
import com.banchess.gameservice.infrastructure.redis.RedisOps;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * 负责记录/查询用户正在进行中的对局。
 * Redis String，TTL 与检查点大致一致；对局开始时写入，终局时清除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OngoingGameTracker implements SessionEventListener {

    private static final Duration TTL = Duration.ofHours(48);

    private final RedisOps redisOps;
    private final SessionRegistry registry;
    private final Clock clock;

    @PostConstruct
    void register() {
        registry.addListener(this);
    }

    @Override
    public void onSessionChanged(SessionView view) {
        try {
            if (view.isFinished()) {
                clearIfMatches(view.white().userId(), view.sessionId());
                clearIfMatches(view.black().userId(), view.sessionId());
            } else if (view.isActive() && view.history().isEmpty()) {
                track(view);
            }
        } catch (RuntimeException e) {
            // Redis 不可用不影响对局本身
            log.warn("更新进行中对局提示失败: sessionId={}, err={}", view.sessionId(), e.getMessage());
        }
    }

    private void track(SessionView view) {
        long now = clock.millis();
        if (view.mode() == GameMode.SOLO) {
            save(view.white().userId(), OngoingGameInfo.of(view, "both", null, now));
            return;
        }
        save(view.white().userId(), OngoingGameInfo.of(view, "white", view.black().displayName(), now));
        save(view.black().userId(), OngoingGameInfo.of(view, "black", view.white().displayName(), now));
    }

    public void save(String userId, OngoingGameInfo info) {
        if (userId == null || userId.isBlank() || info == null) {
            return;
        }
        redisOps.setEx(RedisKeys.userOngoing(userId), info, TTL);
    }

    public Optional<OngoingGameInfo> find(String userId) {
        if (userId == null || userId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(redisOps.get(RedisKeys.userOngoing(userId), OngoingGameInfo.class));
    }

    public void clear(String userId) {
        if (userId == null || userId.isBlank()) {
            return;
        }
        redisOps.del(RedisKeys.userOngoing(userId));
    }

    /** 只清除指向该对局的记录，避免误清用户新开的对局 */
    public void clearIfMatches(String userId, String sessionId) {
        find(userId).ifPresent(info -> {
            if (sessionId == null || sessionId.equals(info.getSessionId())) {
                clear(userId);
            }
        });
    }
}

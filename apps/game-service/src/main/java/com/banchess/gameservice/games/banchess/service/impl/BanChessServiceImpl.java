package com.banchess.gameservice.games.banchess.service.impl;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.application.LiveSession;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.application.matchmaking.EnqueueResult;
import com.banchess.gameservice.games.banchess.application.matchmaking.LeaveResult;
import com.banchess.gameservice.games.banchess.application.matchmaking.MatchPreferences;
import com.banchess.gameservice.games.banchess.application.matchmaking.MatchResult;
import com.banchess.gameservice.games.banchess.application.matchmaking.Matchmaker;
import com.banchess.gameservice.games.banchess.application.matchmaking.MatchmakingListener;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.model.GameSession;
import com.banchess.gameservice.games.banchess.domain.model.HistoryEntry;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot;
import com.banchess.gameservice.games.banchess.domain.model.TimeControl;
import com.banchess.gameservice.games.banchess.service.BanChessService;
import com.banchess.gameservice.platform.auth.Credentials;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.gameservice.platform.connection.Connection;
import com.banchess.gameservice.platform.connection.ConnectionMultiplexer;
import com.banchess.gameservice.platform.transport.ServerEvent;
import com.banchess.rules.Action;
import com.banchess.rules.Color;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ban Chess 服务实现
 * ---------------------------------------
 * 把连接上的指令编排到连接复用器、匹配器和对局信箱：
 *  - 认证 / 附着 / 离开 → ConnectionMultiplexer；
 *  - 入队 / 离队 / 单人对局 → Matchmaker；
 *  - 禁着、走子、认输、提和、送时间 → 对应对局的 LiveSession 信箱。
 *
 * 玩家身份（执白/执黑/双方）由连接身份与对局参与者比对得出，观战者不能行动。
 */
@Slf4j
@Service
public class BanChessServiceImpl implements BanChessService, MatchmakingListener {

    private static final String UNTIMED = "none";

    private final ConnectionMultiplexer multiplexer;
    private final Matchmaker matchmaker;
    private final SessionRegistry registry;
    private final BanChessProperties properties;

    public BanChessServiceImpl(ConnectionMultiplexer multiplexer,
                               Matchmaker matchmaker,
                               SessionRegistry registry,
                               BanChessProperties properties) {
        this.multiplexer = multiplexer;
        this.matchmaker = matchmaker;
        this.registry = registry;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        matchmaker.setListener(this);
    }

    // ---------------------------------------------------------------- 连接

    @Override
    public void connectionOpened(String connectionId, Identity preAuthenticated) {
        multiplexer.open(connectionId, preAuthenticated);
    }

    @Override
    public void connectionReady(String connectionId) {
        multiplexer.find(connectionId)
                .map(Connection::identity)
                .ifPresent(identity -> sendAuthenticated(connectionId, identity));
    }

    @Override
    public void connectionClosed(String connectionId) {
        multiplexer.close(connectionId).ifPresent(identity -> {
            LeaveResult r = matchmaker.leave(identity.userId());
            if (r == LeaveResult.LEFT) {
                log.info("用户最后一条连接关闭，移出匹配队列: userId={}", identity.userId());
            }
        });
    }

    @Override
    public Identity authenticate(String connectionId, Credentials credentials) {
        Identity identity = multiplexer.authenticate(connectionId, credentials);
        sendAuthenticated(connectionId, identity);
        return identity;
    }

    private void sendAuthenticated(String connectionId, Identity identity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("identity", identity);
        registry.findOngoingFor(identity.userId())
                .ifPresent(live -> payload.put("ongoingSessionId", live.id()));
        multiplexer.send(connectionId, ServerEvent.of(ServerEvent.AUTHENTICATED, null, payload));
    }

    // ---------------------------------------------------------------- 创建 / 匹配

    @Override
    public String createSolo(String connectionId, String timeControl) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        TimeControl tc = parseTimeControl(timeControl, true);
        LiveSession live = matchmaker.createSolo(identity, tc);
        multiplexer.send(connectionId, ServerEvent.of(ServerEvent.GAME_CREATED, live.id(),
                Map.of("sessionId", live.id())));
        return live.id();
    }

    @Override
    public EnqueueResult joinQueue(String connectionId, String timeControl) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        TimeControl tc = parseTimeControl(timeControl, false);
        EnqueueResult result = matchmaker.enqueue(identity, new MatchPreferences(tc));
        if (!result.isMatched()) {
            multiplexer.send(connectionId, ServerEvent.of(ServerEvent.QUEUE_POSITION, null,
                    Map.of("position", result.position())));
        }
        return result;
    }

    @Override
    public LeaveResult leaveQueue(String connectionId) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        LeaveResult result = matchmaker.leave(identity.userId());
        multiplexer.send(connectionId, ServerEvent.of(ServerEvent.QUEUE_LEFT, null,
                Map.of("result", result.wireName())));
        return result;
    }

    @Override
    public void onMatched(MatchResult match) {
        notifyMatched(match, Color.WHITE);
        notifyMatched(match, Color.BLACK);
    }

    private void notifyMatched(MatchResult match, Color color) {
        Identity me = color == Color.WHITE ? match.white() : match.black();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("sessionId", match.sessionId());
        payload.put("color", color.wireName());
        payload.put("opponent", match.opponentOf(color));
        payload.put("timeControl", match.timeControl());
        multiplexer.sendToUser(me.userId(), ServerEvent.of(ServerEvent.MATCHED, match.sessionId(), payload));
    }

    @Override
    public void onQueuePositions(Map<String, Integer> positions) {
        positions.forEach((userId, position) -> multiplexer.sendToUser(userId,
                ServerEvent.of(ServerEvent.QUEUE_POSITION, null, Map.of("position", position))));
    }

    // ---------------------------------------------------------------- 附着

    @Override
    public CompletableFuture<StateSnapshot> attach(String connectionId, String sessionId) {
        requireSessionId(sessionId);
        return multiplexer.attach(connectionId, sessionId);
    }

    @Override
    public void detach(String connectionId) {
        multiplexer.detach(connectionId);
    }

    // ---------------------------------------------------------------- 对局动作

    @Override
    public CompletableFuture<HistoryEntry> submitAction(String connectionId, String sessionId, Action action) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        LiveSession live = requireLive(sessionId);
        return live.submit(s -> s.submitAction(actingColor(s, identity, true), action));
    }

    @Override
    public CompletableFuture<Void> resign(String connectionId, String sessionId) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        LiveSession live = requireLive(sessionId);
        return live.submit(s -> {
            s.resign(actingColor(s, identity, true));
            return null;
        });
    }

    @Override
    public CompletableFuture<Boolean> offerDraw(String connectionId, String sessionId) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        LiveSession live = requireLive(sessionId);
        return live.submit(s -> s.offerDraw(actingColor(s, identity, false)));
    }

    @Override
    public CompletableFuture<Void> giveTime(String connectionId, String sessionId, Integer seconds) {
        Identity identity = multiplexer.requireIdentity(connectionId);
        LiveSession live = requireLive(sessionId);
        int amount = seconds == null ? properties.getClock().getGiveTimeSeconds() : seconds;
        return live.submit(s -> {
            s.giveTime(actingColor(s, identity, false), amount);
            return null;
        });
    }

    // ---------------------------------------------------------------- 内部

    /**
     * 根据身份推导行动颜色（在对局信箱内调用）。
     * 单人对局的双方座位由同一身份持有：行动和认输都替当前应行动方执行，其余指令记在白方名下。
     */
    private static Color actingColor(GameSession s, Identity identity, boolean forCurrentActor) {
        boolean isWhite = s.participant(Color.WHITE).userId().equals(identity.userId());
        boolean isBlack = s.participant(Color.BLACK).userId().equals(identity.userId());
        SeatRole role = isWhite && isBlack ? SeatRole.BOTH
                : isWhite ? SeatRole.WHITE
                : isBlack ? SeatRole.BLACK
                : SeatRole.SPECTATOR;
        switch (role) {
            case WHITE:
                return Color.WHITE;
            case BLACK:
                return Color.BLACK;
            case BOTH:
                return forCurrentActor ? s.position().actor() : Color.WHITE;
            default:
                throw new GameException(ErrorCode.NOT_A_PLAYER, GameMessages.SPECTATOR_CANNOT_ACT);
        }
    }

    private LiveSession requireLive(String sessionId) {
        requireSessionId(sessionId);
        return registry.require(sessionId);
    }

    private static void requireSessionId(String sessionId) {
        if (StringUtils.isBlank(sessionId)) {
            throw new GameException(ErrorCode.PROTOCOL, "sessionId is required");
        }
    }

    private TimeControl parseTimeControl(String text, boolean allowUntimed) {
        if (StringUtils.isBlank(text)) {
            return TimeControl.parse(properties.getClock().getDefaultTimeControl());
        }
        if (allowUntimed && UNTIMED.equalsIgnoreCase(text.trim())) {
            return null;
        }
        try {
            return TimeControl.parse(text);
        } catch (IllegalArgumentException e) {
            throw new GameException(ErrorCode.INVALID_TIME_CONTROL, e.getMessage());
        }
    }
}

package com.banchess.gameservice.platform.connection;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.application.LiveSession;
import com.banchess.gameservice.games.banchess.application.ReconnectGraceTracker;
import com.banchess.gameservice.games.banchess.application.SessionEventListener;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.application.SnapshotAssembler;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.enums.SessionStatus;
import com.banchess.gameservice.games.banchess.domain.model.GameEvent;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.games.banchess.domain.model.StateSnapshot;
import com.banchess.gameservice.platform.auth.Credentials;
import com.banchess.gameservice.platform.auth.IdentityVerifier;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.gameservice.platform.transport.ServerEvent;
import com.banchess.rules.Color;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * ConnectionMultiplexer
 * ---------------------------------------
 * 连接的唯一持有者：认证、附着/离开对局、按角色裁剪后的广播、按用户投递。
 *
 * 约定：
 *  - 每条连接最多附着一个对局；附着新对局前自动离开旧对局；
 *  - 玩家座位同一时刻只能被一条在线连接占用（seatKey → connectionId，putIfAbsent）；
 *  - 附着登记与快照发送都在对局信箱中执行，因此快照一定先于之后的任何广播；
 *  - 广播对每条连接尽力而为，单条连接失败不影响其它连接，也不阻塞对局工作线程。
 */
@Slf4j
@Component
public class ConnectionMultiplexer implements SessionEventListener {

    private final ConcurrentMap<String, Connection> connections = new ConcurrentHashMap<>();
    // sessionId -> 已附着的连接ID
    private final ConcurrentMap<String, Set<String>> bySession = new ConcurrentHashMap<>();
    // userId -> 该用户的全部连接ID
    private final ConcurrentMap<String, Set<String>> byUser = new ConcurrentHashMap<>();
    // sessionId:seat -> 占座连接ID
    private final ConcurrentMap<String, String> seats = new ConcurrentHashMap<>();

    private final SessionRegistry registry;
    private final ReconnectGraceTracker graceTracker;
    private final ConnectionOutbound outbound;
    private final IdentityVerifier verifier;
    private final BanChessProperties properties;
    private final Clock clock;

    public ConnectionMultiplexer(SessionRegistry registry,
                                 ReconnectGraceTracker graceTracker,
                                 ConnectionOutbound outbound,
                                 IdentityVerifier verifier,
                                 BanChessProperties properties,
                                 Clock clock) {
        this.registry = registry;
        this.graceTracker = graceTracker;
        this.outbound = outbound;
        this.verifier = verifier;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void register() {
        registry.addListener(this);
        graceTracker.setSeatHeldCheck(this::isSeatHeld);
    }

    // ---------------------------------------------------------------- 连接生命周期

    /**
     * 登记一条新连接。
     * @param preAuthenticated STOMP CONNECT 阶段已验证的身份，可为 null
     */
    public Connection open(String connectionId, Identity preAuthenticated) {
        Connection c = connection(connectionId);
        if (preAuthenticated != null) {
            synchronized (c) {
                bindIdentity(c, preAuthenticated);
            }
        }
        log.info("连接建立: connectionId={}, userId={}", connectionId,
                preAuthenticated == null ? null : preAuthenticated.userId());
        return c;
    }

    /**
     * 连接关闭：离开对局（必要时开始宽限期）并移除连接。
     * @return 若这是该用户的最后一条连接，返回其身份；否则 empty
     */
    public Optional<Identity> close(String connectionId) {
        Connection c = connections.remove(connectionId);
        if (c == null) {
            return Optional.empty();
        }
        Identity identity;
        synchronized (c) {
            if (c.attachedSessionId() != null) {
                detachLocked(c);
            }
            identity = c.identity();
        }
        log.info("连接关闭: connectionId={}, userId={}", connectionId, identity == null ? null : identity.userId());
        if (identity == null) {
            return Optional.empty();
        }
        boolean last = unbindUser(identity.userId(), connectionId);
        return last ? Optional.of(identity) : Optional.empty();
    }

    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public int connectionCount() {
        return connections.size();
    }

    // ---------------------------------------------------------------- 认证

    /**
     * 校验凭证并绑定身份。已绑定其他身份的连接会先离开当前对局。
     * @throws GameException AUTH_FAILED
     */
    public Identity authenticate(String connectionId, Credentials credentials) {
        Identity identity = verifier.verify(credentials);
        Connection c = connection(connectionId);
        synchronized (c) {
            Identity previous = c.identity();
            if (previous != null && !previous.userId().equals(identity.userId())) {
                if (c.attachedSessionId() != null) {
                    detachLocked(c);
                }
                unbindUser(previous.userId(), connectionId);
            }
            bindIdentity(c, identity);
        }
        log.info("连接认证成功: connectionId={}, userId={}", connectionId, identity.userId());
        return identity;
    }

    /**
     * @throws GameException UNAUTHENTICATED 连接尚未认证
     */
    public Identity requireIdentity(String connectionId) {
        Connection c = connections.get(connectionId);
        if (c == null || c.identity() == null) {
            throw new GameException(ErrorCode.UNAUTHENTICATED, GameMessages.AUTH_REQUIRED);
        }
        return c.identity();
    }

    // ---------------------------------------------------------------- 附着 / 离开

    /**
     * 附着到对局并发送一份完整快照。
     * <ul>
     *   <li>已附着在同一对局：重发快照（幂等）；</li>
     *   <li>对局已结束（归档宽限期内）：只发最终快照，不附着；</li>
     *   <li>玩家座位已被其它在线连接占用：SEAT_TAKEN。</li>
     * </ul>
     */
    public CompletableFuture<StateSnapshot> attach(String connectionId, String sessionId) {
        Identity identity = requireIdentity(connectionId);
        Connection c = connection(connectionId);
        synchronized (c) {
            if (sessionId.equals(c.attachedSessionId())) {
                LiveSession current = registry.require(sessionId);
                SeatRole role = c.role();
                return current.submit(s -> sendSnapshot(c, s.view(), role));
            }
            if (c.attachedSessionId() != null) {
                detachLocked(c);
            }
            LiveSession live = registry.findOrRestore(sessionId).orElseThrow(() ->
                    new GameException(ErrorCode.SESSION_NOT_FOUND, GameMessages.formatSessionNotFound(sessionId)));
            SessionView view = live.view();
            SeatRole role = view.roleOf(identity.userId());
            if (view.isFinished()) {
                return CompletableFuture.completedFuture(sendSnapshot(c, view, role));
            }
            if (!role.isPlayer() && !properties.getSession().isAllowSpectators()) {
                throw new GameException(ErrorCode.UNSUPPORTED, GameMessages.SPECTATORS_DISABLED);
            }
            if (role.isPlayer()) {
                String holder = seats.putIfAbsent(seatKey(sessionId, role), connectionId);
                if (holder != null && !holder.equals(connectionId)) {
                    throw new GameException(ErrorCode.SEAT_TAKEN, GameMessages.SEAT_TAKEN);
                }
            }
            c.attach(sessionId, role);
            log.info("连接附着对局: connectionId={}, sessionId={}, role={}", connectionId, sessionId, role.wireName());
            CompletableFuture<StateSnapshot> future = live.submit(s -> {
                bySession.computeIfAbsent(sessionId, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
                if (role.isPlayer() && s.status() == SessionStatus.ACTIVE && graceTracker.cancelGrace(sessionId, role)) {
                    s.recordEvent(GameEvent.PLAYER_RECONNECTED, colorOf(role),
                            GameMessages.formatReconnected(identity.displayName()));
                }
                return sendSnapshot(c, s.view(), role);
            });
            future.whenComplete((snap, ex) -> {
                if (ex != null) {
                    rollbackAttach(c, sessionId, role);
                }
            });
            return future;
        }
    }

    /**
     * 主动离开当前对局。
     * @throws GameException NOT_ATTACHED
     */
    public void detach(String connectionId) {
        Connection c = connections.get(connectionId);
        if (c == null) {
            throw new GameException(ErrorCode.NOT_ATTACHED, GameMessages.NOT_ATTACHED);
        }
        synchronized (c) {
            if (c.attachedSessionId() == null) {
                throw new GameException(ErrorCode.NOT_ATTACHED, GameMessages.NOT_ATTACHED);
            }
            detachLocked(c);
        }
    }

    /** 玩家座位当前是否有在线连接占用 */
    public boolean isSeatHeld(String sessionId, SeatRole role) {
        return seats.containsKey(seatKey(sessionId, role));
    }

    /** 当前附着在对局上的连接数 */
    public int attachedCount(String sessionId) {
        Set<String> ids = bySession.get(sessionId);
        return ids == null ? 0 : ids.size();
    }

    // 调用方持有 c 的监视器
    private void detachLocked(Connection c) {
        String sessionId = c.attachedSessionId();
        SeatRole role = c.role();
        c.detach();
        boolean vacated = role != null && role.isPlayer() && seats.remove(seatKey(sessionId, role), c.id());
        Optional<LiveSession> live = registry.get(sessionId);
        if (live.isEmpty()) {
            removeFromSession(sessionId, c.id());
            return;
        }
        log.info("连接离开对局: connectionId={}, sessionId={}, role={}", c.id(), sessionId,
                role == null ? null : role.wireName());
        Identity identity = c.identity();
        live.get().submit(s -> {
            removeFromSession(sessionId, c.id());
            // 座位最后一条连接离开且对局进行中：开始宽限期（观战者不影响对局）
            // 座位可能已被重连占回，此时其附着任务可能先于本任务执行
            if (vacated && s.status() == SessionStatus.ACTIVE && !isSeatHeld(sessionId, role)) {
                graceTracker.startGrace(sessionId, role);
                s.recordEvent(GameEvent.PLAYER_DISCONNECTED, colorOf(role),
                        GameMessages.formatDisconnected(identity == null ? c.id() : identity.displayName()));
            }
            return null;
        });
    }

    private void rollbackAttach(Connection c, String sessionId, SeatRole role) {
        synchronized (c) {
            if (sessionId.equals(c.attachedSessionId())) {
                c.detach();
            }
        }
        if (role.isPlayer()) {
            seats.remove(seatKey(sessionId, role), c.id());
        }
        removeFromSession(sessionId, c.id());
    }

    private void removeFromSession(String sessionId, String connectionId) {
        bySession.computeIfPresent(sessionId, (k, ids) -> {
            ids.remove(connectionId);
            return ids.isEmpty() ? null : ids;
        });
    }

    // ---------------------------------------------------------------- 广播 / 投递

    /**
     * 对局变更：向所有附着连接推送按角色裁剪的快照。
     * 在对局工作线程上执行，与附着/离开登记同序。
     */
    @Override
    public void onSessionChanged(SessionView view) {
        Set<String> ids = bySession.get(view.sessionId());
        if (ids == null || ids.isEmpty()) {
            return;
        }
        Map<SeatRole, ServerEvent> perRole = new EnumMap<>(SeatRole.class);
        for (String id : ids) {
            Connection c = connections.get(id);
            SeatRole role = c == null ? null : c.role();
            if (role == null || !view.sessionId().equals(c.attachedSessionId())) {
                continue;
            }
            ServerEvent event = perRole.computeIfAbsent(role,
                    r -> ServerEvent.state(view.sessionId(), SnapshotAssembler.assemble(view, r)));
            deliver(c, event);
        }
    }

    @Override
    public void onGameEvent(SessionView view, GameEvent event) {
        broadcast(view.sessionId(), ServerEvent.of(ServerEvent.GAME_EVENT, view.sessionId(), event));
    }

    /** 向附着在对局上的所有连接发送同一条消息 */
    public void broadcast(String sessionId, ServerEvent event) {
        Set<String> ids = bySession.get(sessionId);
        if (ids == null) {
            return;
        }
        for (String id : ids) {
            Connection c = connections.get(id);
            if (c != null) {
                deliver(c, event);
            }
        }
    }

    /** 发送到单条连接 */
    public void send(String connectionId, ServerEvent event) {
        Connection c = connections.get(connectionId);
        if (c != null) {
            deliver(c, event);
        }
    }

    /** 发送到该用户的全部连接 */
    public void sendToUser(String userId, ServerEvent event) {
        Set<String> ids = byUser.get(userId);
        if (ids == null) {
            return;
        }
        for (String id : ids) {
            send(id, event);
        }
    }

    /**
     * 关闭前断开所有连接。
     */
    @PreDestroy
    public void shutdown() {
        log.info("关闭全部连接: {} 个", connections.size());
        for (Connection c : connections.values()) {
            deliver(c, ServerEvent.error(ErrorCode.INTERNAL.name(), GameMessages.SERVER_SHUTTING_DOWN));
            try {
                outbound.close(c.id());
            } catch (RuntimeException e) {
                log.warn("关闭连接失败: connectionId={}", c.id(), e);
            }
        }
        connections.clear();
        bySession.clear();
        byUser.clear();
        seats.clear();
    }

    // ---------------------------------------------------------------- 内部

    private StateSnapshot sendSnapshot(Connection c, SessionView view, SeatRole role) {
        StateSnapshot snap = SnapshotAssembler.assemble(view, role);
        deliver(c, ServerEvent.state(view.sessionId(), snap));
        return snap;
    }

    private void deliver(Connection c, ServerEvent event) {
        try {
            outbound.send(c.id(), event);
        } catch (RuntimeException e) {
            log.warn("消息投递失败: connectionId={}, type={}, err={}", c.id(), event.type(), e.getMessage());
        }
    }

    private Connection connection(String connectionId) {
        return connections.computeIfAbsent(connectionId, id -> new Connection(id, clock.millis()));
    }

    // 调用方持有 c 的监视器
    private void bindIdentity(Connection c, Identity identity) {
        c.identity(identity);
        byUser.computeIfAbsent(identity.userId(), k -> ConcurrentHashMap.newKeySet()).add(c.id());
    }

    /** @return true 表示该用户已没有其它连接 */
    private boolean unbindUser(String userId, String connectionId) {
        boolean[] last = {false};
        byUser.computeIfPresent(userId, (k, ids) -> {
            ids.remove(connectionId);
            last[0] = ids.isEmpty();
            return ids.isEmpty() ? null : ids;
        });
        return last[0];
    }

    private static String seatKey(String sessionId, SeatRole role) {
        return sessionId + ":" + role.wireName();
    }

    private static Color colorOf(SeatRole role) {
        switch (role) {
            case WHITE:
                return Color.WHITE;
            case BLACK:
                return Color.BLACK;
            default:
                return null;
        }
    }
}

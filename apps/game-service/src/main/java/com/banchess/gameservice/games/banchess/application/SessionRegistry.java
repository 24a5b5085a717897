package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.clock.scheduler.CountdownScheduler;
import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.dto.GameRecord;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.model.GameSession;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.games.banchess.domain.model.TimeControl;
import com.banchess.gameservice.games.banchess.domain.repository.GameRecordRepository;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.rules.Bcn;
import com.banchess.rules.RulesEngine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;

/**
 * SessionRegistry
 * ---------------------------------------
 * 进程内全部活动对局的唯一持有者。
 *
 * 职责：
 *  - create / activate / get / retire / restore；
 *  - 维护 userId → 进行中对局 的索引（匹配时拒绝重复入局、认证时提示继续对局）；
 *  - 每次状态变更写检查点（尽力而为），终局写终局记录并在宽限期后移出内存。
 *
 * 并发：id → 对局 用 ConcurrentHashMap；对局内部的串行由 LiveSession 的信箱保证。
 */
@Slf4j
@Component
public class SessionRegistry implements SessionEventListener {

    private static final String RETIRE_KEY_PREFIX = "retire:";

    private final ConcurrentMap<String, LiveSession> sessions = new ConcurrentHashMap<>();
    // userId -> 进行中（waiting/active）的对局ID
    private final ConcurrentMap<String, Set<String>> ongoingByUser = new ConcurrentHashMap<>();
    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

    private final ExecutorService workerPool;
    private final RulesEngine rules;
    private final Clock clock;
    private final GameRecordRepository repository;
    private final CountdownScheduler scheduler;
    private final BanChessProperties properties;

    public SessionRegistry(@Qualifier("sessionWorkerExecutor") ExecutorService workerPool,
                           RulesEngine rules,
                           Clock clock,
                           GameRecordRepository repository,
                           CountdownScheduler scheduler,
                           BanChessProperties properties) {
        this.workerPool = workerPool;
        this.rules = rules;
        this.clock = clock;
        this.repository = repository;
        this.scheduler = scheduler;
        this.properties = properties;
        // 自身排第一：先落盘，再广播/计时
        this.listeners.add(this);
    }

    /**
     * 注册对局变更监听器（广播、计时、断线宽限、继续对局提示）。
     */
    public void addListener(SessionEventListener listener) {
        listeners.add(listener);
    }

    // ---------------------------------------------------------------- 创建 / 激活

    /**
     * 创建对局。单人对局立即激活；在线对局停留在 waiting，由匹配器随后调用 {@link #activate(String)}。
     *
     * @param timeControl 为 null 表示不计时
     */
    public LiveSession create(Identity white, Identity black, GameMode mode, TimeControl timeControl) {
        String id = UUID.randomUUID().toString();
        GameSession session = new GameSession(id, mode, white, black, timeControl, rules, clock);
        LiveSession live = register(session);
        log.info("创建对局: sessionId={}, mode={}, white={}, black={}, timeControl={}",
                id, mode.wireName(), white.userId(), black.userId(), timeControl);
        if (mode == GameMode.SOLO) {
            activate(id);
        }
        return live;
    }

    /**
     * waiting → active，并启动时钟。
     */
    public CompletableFuture<SessionView> activate(String sessionId) {
        LiveSession live = require(sessionId);
        return live.submit(s -> {
            s.activate();
            return s.view();
        });
    }

    // ---------------------------------------------------------------- 查询

    public Optional<LiveSession> get(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * @throws GameException SESSION_NOT_FOUND
     */
    public LiveSession require(String sessionId) {
        return get(sessionId).orElseThrow(() ->
                new GameException(ErrorCode.SESSION_NOT_FOUND, GameMessages.formatSessionNotFound(sessionId)));
    }

    /**
     * 内存中找不到时尝试从检查点恢复。
     */
    public Optional<LiveSession> findOrRestore(String sessionId) {
        Optional<LiveSession> live = get(sessionId);
        if (live.isPresent()) {
            return live;
        }
        return restore(sessionId);
    }

    /** 用户当前进行中（waiting/active）的对局，优先返回在线对局 */
    public Optional<LiveSession> findOngoingFor(String userId) {
        Set<String> ids = userId == null ? null : ongoingByUser.get(userId);
        if (ids == null || ids.isEmpty()) {
            return Optional.empty();
        }
        LiveSession fallback = null;
        for (String id : ids) {
            LiveSession live = sessions.get(id);
            if (live == null || live.view().isFinished()) {
                continue;
            }
            if (live.view().mode() == GameMode.ONLINE) {
                return Optional.of(live);
            }
            fallback = live;
        }
        return Optional.ofNullable(fallback);
    }

    /** 全部未结束对局的视图，按创建时间排序 */
    public List<SessionView> listActive() {
        List<SessionView> out = new ArrayList<>();
        for (LiveSession live : sessions.values()) {
            SessionView v = live.view();
            if (!v.isFinished()) {
                out.add(v);
            }
        }
        out.sort(Comparator.comparingLong(SessionView::createdAt));
        return out;
    }

    public int size() {
        return sessions.size();
    }

    // ---------------------------------------------------------------- 恢复

    /**
     * 从检查点重放出一个进行中的对局（参与者 + BCN 历史 + 剩余时间）。
     * 检查点不存在或与规则不符时返回 empty。
     */
    public Optional<LiveSession> restore(String sessionId) {
        Optional<GameRecord> checkpoint;
        try {
            checkpoint = repository.findCheckpoint(sessionId);
        } catch (RuntimeException e) {
            log.warn("读取检查点失败: sessionId={}", sessionId, e);
            return Optional.empty();
        }
        if (checkpoint.isEmpty()) {
            return Optional.empty();
        }
        GameRecord rec = checkpoint.get();
        GameSession session;
        try {
            TimeControl tc = rec.getTimeControl() == null ? null : TimeControl.parse(rec.getTimeControl());
            session = new GameSession(rec.getSessionId(), GameMode.fromWire(rec.getMode()),
                    new Identity(rec.getWhitePlayerId(), rec.getWhitePlayerName()),
                    new Identity(rec.getBlackPlayerId(), rec.getBlackPlayerName()),
                    tc, rules, clock);
            session.restore(Bcn.decodeAll(rec.getBcn()), rec.getMoveTimes(), rec.getStartedAt(),
                    rec.getWhiteRemainingMs(), rec.getBlackRemainingMs());
        } catch (RuntimeException e) {
            log.warn("检查点无法重放，放弃恢复: sessionId={}", sessionId, e);
            return Optional.empty();
        }
        LiveSession created = new LiveSession(session, newMailbox(sessionId), listeners);
        LiveSession existing = sessions.putIfAbsent(sessionId, created);
        if (existing != null) {
            return Optional.of(existing);
        }
        indexParticipants(created.view());
        log.info("从检查点恢复对局: sessionId={}, actions={}", sessionId, rec.getBcn().size());
        // 重新驱动监听器（计时、继续对局提示）
        created.republish();
        return Optional.of(created);
    }

    // ---------------------------------------------------------------- 监听：检查点 / 归档

    @Override
    public void onSessionChanged(SessionView view) {
        if (view.isFinished()) {
            retire(view.sessionId());
            return;
        }
        if (view.isActive()) {
            checkpoint(view);
        }
    }

    /**
     * 终局归档：写终局记录、删除检查点、移除用户索引，并在宽限期后移出内存。
     * 宽限期内迟到的观战者仍能拿到最终快照。重复调用无副作用。
     */
    public void retire(String sessionId) {
        LiveSession live = sessions.get(sessionId);
        if (live == null || !live.markRetired()) {
            return;
        }
        SessionView view = live.view();
        try {
            repository.saveFinished(GameRecord.from(view));
            repository.deleteCheckpoint(sessionId);
        } catch (RuntimeException e) {
            log.warn("保存终局记录失败: sessionId={}", sessionId, e);
        }
        unindexParticipants(view);
        long deadline = System.currentTimeMillis() + properties.getSession().getRetireGrace().toMillis();
        scheduler.startOrResume(RETIRE_KEY_PREFIX + sessionId, "registry", deadline, String.valueOf(view.revision()),
                (key, owner, version) -> {
                    sessions.remove(sessionId, live);
                    log.info("对局已移出内存: sessionId={}", sessionId);
                });
        log.info("对局结束并归档: sessionId={}, winner={}, reason={}", sessionId,
                view.result() == null ? null : view.result().winnerName(),
                view.result() == null ? null : view.result().reason().wireName());
    }

    private void checkpoint(SessionView view) {
        try {
            repository.saveCheckpoint(GameRecord.from(view));
        } catch (RuntimeException e) {
            log.warn("写检查点失败（对局继续）: sessionId={}, err={}", view.sessionId(), e.getMessage());
        }
    }

    /**
     * 关闭前为所有进行中的对局写检查点。
     */
    @PreDestroy
    public void checkpointAll() {
        int n = 0;
        for (LiveSession live : sessions.values()) {
            SessionView view = live.view();
            if (view.isActive()) {
                checkpoint(view);
                n++;
            }
        }
        log.info("关闭前写检查点完成: {} 个对局", n);
    }

    // ---------------------------------------------------------------- 内部

    private LiveSession register(GameSession session) {
        LiveSession live = new LiveSession(session, newMailbox(session.id()), listeners);
        sessions.put(session.id(), live);
        indexParticipants(live.view());
        return live;
    }

    private SessionMailbox newMailbox(String sessionId) {
        return new SessionMailbox("session-" + sessionId, workerPool);
    }

    private void indexParticipants(SessionView view) {
        ongoingByUser.computeIfAbsent(view.white().userId(), k -> ConcurrentHashMap.newKeySet()).add(view.sessionId());
        ongoingByUser.computeIfAbsent(view.black().userId(), k -> ConcurrentHashMap.newKeySet()).add(view.sessionId());
    }

    private void unindexParticipants(SessionView view) {
        unindex(view.white().userId(), view.sessionId());
        unindex(view.black().userId(), view.sessionId());
    }

    private void unindex(String userId, String sessionId) {
        ongoingByUser.computeIfPresent(userId, (k, ids) -> {
            ids.remove(sessionId);
            return ids.isEmpty() ? null : ids;
        });
    }
}

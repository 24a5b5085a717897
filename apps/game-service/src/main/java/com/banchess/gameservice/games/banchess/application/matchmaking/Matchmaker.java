package com.banchess.gameservice.games.banchess.application.matchmaking;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.application.LiveSession;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.domain.constants.GameMessages;
import com.banchess.gameservice.games.banchess.domain.enums.GameMode;
import com.banchess.gameservice.games.banchess.domain.model.Identity;
import com.banchess.gameservice.games.banchess.domain.model.TimeControl;
import com.banchess.gameservice.platform.config.BanChessProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Matchmaker
 * ---------------------------------------
 * 按偏好分组的 FIFO 匹配队列。
 *
 * 原子性：“取出双方 + 创建对局 + 激活”在同一把锁内完成，
 * 同一玩家不可能被配进两个对局，也不可能在配对后仍留在队列中。
 * 通知（matched / queue-position）在锁外回调。
 */
@Slf4j
@Component
public class Matchmaker {

    private final Object lock = new Object();
    // 偏好分组 -> 等待队列
    private final Map<String, Deque<QueueEntry>> queues = new LinkedHashMap<>();
    // userId -> 队列条目
    private final Map<String, QueueEntry> byUser = new HashMap<>();
    // userId -> 最近配对的过期时刻，用于识别“离开与配对竞争”
    private final Map<String, Long> recentlyMatched = new HashMap<>();

    private final SessionRegistry registry;
    private final BanChessProperties properties;
    private final Clock clock;

    private volatile MatchmakingListener listener;

    public Matchmaker(SessionRegistry registry, BanChessProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    public void setListener(MatchmakingListener listener) {
        this.listener = listener;
    }

    /**
     * 入队。已在队列中则返回原位置；队列中有同偏好的等待者则立即配对。
     *
     * @throws GameException ALREADY_IN_GAME 已有进行中的在线对局
     */
    public EnqueueResult enqueue(Identity identity, MatchPreferences preferences) {
        EnqueueResult result;
        Map<String, Integer> positions;
        synchronized (lock) {
            Optional<LiveSession> ongoing = registry.findOngoingFor(identity.userId())
                    .filter(l -> l.view().mode() == GameMode.ONLINE);
            if (ongoing.isPresent()) {
                throw new GameException(ErrorCode.ALREADY_IN_GAME,
                        GameMessages.formatAlreadyInGame(ongoing.get().id()));
            }
            QueueEntry existing = byUser.get(identity.userId());
            if (existing != null) {
                return EnqueueResult.waiting(positionOf(existing));
            }
            String cls = preferences.preferenceClass();
            Deque<QueueEntry> queue = queues.computeIfAbsent(cls, k -> new ArrayDeque<>());
            QueueEntry opponent = queue.pollFirst();
            if (opponent == null) {
                QueueEntry entry = new QueueEntry(identity, clock.millis(), preferences);
                queue.addLast(entry);
                byUser.put(identity.userId(), entry);
                log.info("玩家入队: userId={}, class={}, position={}", identity.userId(), cls, queue.size());
                return EnqueueResult.waiting(queue.size());
            }
            byUser.remove(opponent.identity().userId());
            MatchResult match = createMatch(opponent, identity, preferences.timeControl());
            positions = positionsIn(queue);
            dropIfEmpty(cls, queue);
            result = EnqueueResult.matched(match);
        }
        notifyMatched(result.match());
        notifyPositions(positions);
        return result;
    }

    /**
     * 离开队列。
     */
    public LeaveResult leave(String userId) {
        Map<String, Integer> positions;
        synchronized (lock) {
            QueueEntry entry = byUser.remove(userId);
            if (entry == null) {
                Long until = recentlyMatched.get(userId);
                if (until != null && until > clock.millis()) {
                    return LeaveResult.ALREADY_MATCHED;
                }
                recentlyMatched.remove(userId);
                return LeaveResult.NOT_QUEUED;
            }
            String cls = entry.preferences().preferenceClass();
            Deque<QueueEntry> queue = queues.get(cls);
            queue.remove(entry);
            positions = positionsIn(queue);
            dropIfEmpty(cls, queue);
        }
        log.info("玩家离开队列: userId={}", userId);
        notifyPositions(positions);
        return LeaveResult.LEFT;
    }

    /** 当前排队位置（从 1 开始） */
    public OptionalInt positionOf(String userId) {
        synchronized (lock) {
            QueueEntry entry = byUser.get(userId);
            return entry == null ? OptionalInt.empty() : OptionalInt.of(positionOf(entry));
        }
    }

    public int queuedCount() {
        synchronized (lock) {
            return byUser.size();
        }
    }

    /** 仍有等待者的偏好分组数 */
    int preferenceClassCount() {
        synchronized (lock) {
            return queues.size();
        }
    }

    /**
     * 单人自对弈：同一身份同时持有黑白双方，创建即开始。
     */
    public LiveSession createSolo(Identity identity, TimeControl timeControl) {
        return registry.create(identity, identity, GameMode.SOLO, timeControl);
    }

    // ---------------------------------------------------------------- 内部（调用方持锁）

    private MatchResult createMatch(QueueEntry first, Identity second, TimeControl timeControl) {
        // 先入队者执白
        Identity white = first.identity();
        LiveSession live = registry.create(white, second, GameMode.ONLINE, timeControl);
        registry.activate(live.id());
        long until = clock.millis() + properties.getMatchmaking().getRecentlyMatchedTtl().toMillis();
        purgeExpired();
        recentlyMatched.put(white.userId(), until);
        recentlyMatched.put(second.userId(), until);
        log.info("匹配成功: sessionId={}, white={}, black={}, timeControl={}",
                live.id(), white.userId(), second.userId(), timeControl);
        return new MatchResult(live.id(), white, second, timeControl.toString());
    }

    // 分组来自客户端输入，空队列立即移除
    private void dropIfEmpty(String cls, Deque<QueueEntry> queue) {
        if (queue.isEmpty()) {
            queues.remove(cls);
        }
    }

    private int positionOf(QueueEntry entry) {
        Deque<QueueEntry> queue = queues.get(entry.preferences().preferenceClass());
        int i = 1;
        for (QueueEntry e : queue) {
            if (e == entry) {
                return i;
            }
            i++;
        }
        return 0;
    }

    private Map<String, Integer> positionsIn(Deque<QueueEntry> queue) {
        Map<String, Integer> out = new LinkedHashMap<>();
        int i = 1;
        for (QueueEntry e : queue) {
            out.put(e.identity().userId(), i++);
        }
        return out;
    }

    private void purgeExpired() {
        long now = clock.millis();
        Iterator<Map.Entry<String, Long>> it = recentlyMatched.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue() <= now) {
                it.remove();
            }
        }
    }

    // ---------------------------------------------------------------- 通知（锁外）

    private void notifyMatched(MatchResult match) {
        MatchmakingListener l = listener;
        if (l != null) {
            try {
                l.onMatched(match);
            } catch (RuntimeException e) {
                log.warn("匹配通知失败: sessionId={}", match.sessionId(), e);
            }
        }
    }

    private void notifyPositions(Map<String, Integer> positions) {
        MatchmakingListener l = listener;
        if (l != null && !positions.isEmpty()) {
            try {
                l.onQueuePositions(positions);
            } catch (RuntimeException e) {
                log.warn("队列位置通知失败", e);
            }
        }
    }
}

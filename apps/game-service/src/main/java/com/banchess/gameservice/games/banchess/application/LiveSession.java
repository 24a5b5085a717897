package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.common.ErrorCode;
import com.banchess.gameservice.common.GameException;
import com.banchess.gameservice.games.banchess.domain.model.GameEvent;
import com.banchess.gameservice.games.banchess.domain.model.GameSession;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * LiveSession
 * ---------------------------------------
 * 内存中的活动对局 = GameSession + 串行信箱 + 最新视图。
 *
 * 规则：
 *  - 对 GameSession 的所有读写都通过 {@link #submit(Function)} 进入信箱执行（单写者）；
 *  - 每个任务执行完若 revision 变化，立即生成新视图并通知监听器；
 *  - 任务抛出 GameException 视为业务拒绝，状态不变，只回给调用方；
 *  - 其它异常视为内部故障：仅结束本局（finished(error)），不影响其它对局。
 */
@Slf4j
public class LiveSession {

    private final GameSession session;
    private final SessionMailbox mailbox;
    private final List<SessionEventListener> listeners;
    private final AtomicBoolean retired = new AtomicBoolean(false);
    private volatile SessionView latest;

    /**
     * @param listeners 由注册表持有的监听器列表（线程安全，可在运行期追加）
     */
    public LiveSession(GameSession session, SessionMailbox mailbox, List<SessionEventListener> listeners) {
        this.session = session;
        this.mailbox = mailbox;
        this.listeners = listeners;
        this.latest = session.view();
    }

    public String id() {
        return session.id();
    }

    /** 最近一次发布的视图（任意线程可读） */
    public SessionView view() {
        return latest;
    }

    /**
     * 在对局工作线程上执行 op。
     * @return op 的结果；业务拒绝以 GameException 异常完成
     */
    public <T> CompletableFuture<T> submit(Function<GameSession, T> op) {
        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            mailbox.execute(() -> run(op, future));
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new GameException(ErrorCode.INTERNAL, "session worker unavailable"));
        }
        return future;
    }

    /**
     * 无条件重新发布当前视图（恢复对局后用于重新驱动计时器等监听器）。
     */
    public CompletableFuture<SessionView> republish() {
        CompletableFuture<SessionView> future = new CompletableFuture<>();
        try {
            mailbox.execute(() -> {
                publish();
                future.complete(latest);
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(new GameException(ErrorCode.INTERNAL, "session worker unavailable"));
        }
        return future;
    }

    /** 标记为已归档；只有第一次调用返回 true */
    boolean markRetired() {
        return retired.compareAndSet(false, true);
    }

    private <T> void run(Function<GameSession, T> op, CompletableFuture<T> future) {
        long before = session.revision();
        try {
            T result = op.apply(session);
            publishIfChanged(before);
            future.complete(result);
        } catch (GameException e) {
            publishIfChanged(before);
            future.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.error("对局工作线程内部故障，结束本局: sessionId={}", session.id(), e);
            try {
                session.abort();
            } finally {
                publishIfChanged(before);
            }
            future.completeExceptionally(new GameException(ErrorCode.INTERNAL, e.getMessage()));
        }
    }

    private void publishIfChanged(long before) {
        if (session.revision() != before) {
            publish();
        }
    }

    private void publish() {
        SessionView view = session.view();
        latest = view;
        List<GameEvent> events = session.drainNewEvents();
        for (SessionEventListener l : listeners) {
            try {
                l.onSessionChanged(view);
                for (GameEvent e : events) {
                    l.onGameEvent(view, e);
                }
            } catch (RuntimeException e) {
                log.warn("对局监听器执行失败: sessionId={}, listener={}", session.id(),
                        l.getClass().getSimpleName(), e);
            }
        }
    }
}

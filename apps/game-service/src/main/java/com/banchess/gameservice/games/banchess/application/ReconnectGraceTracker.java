package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.clock.scheduler.CountdownScheduler;
import com.banchess.gameservice.games.banchess.domain.enums.SeatRole;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.rules.Color;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.BiPredicate;

/**
 * 断线重连宽限期。
 * ---------------------------------------
 * 玩家座位最后一条连接断开后开始计时；宽限期内重新附着则取消，不留任何痕迹；
 * 到期后向对局投递 forfeit（在线：对方胜 timeout-forfeit；单人：abandonment）。
 *
 * 一次性：调度器同 key 只保留一个任务，到期后 forfeit 只会在对局仍进行中时生效一次。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconnectGraceTracker implements SessionEventListener {

    private static final String KEY_PREFIX = "grace:";

    private final CountdownScheduler scheduler;
    private final SessionRegistry registry;
    private final BanChessProperties properties;
    private volatile BiPredicate<String, SeatRole> seatHeld = (sessionId, seat) -> false;

    @PostConstruct
    public void register() {
        registry.addListener(this);
    }

    /**
     * 由连接层注入：座位当前是否已被重新占用。到期时座位已被占用则不判负。
     */
    public void setSeatHeldCheck(BiPredicate<String, SeatRole> seatHeld) {
        this.seatHeld = seatHeld;
    }

    /**
     * 座位空出，开始宽限期。
     * @param seat WHITE / BLACK / BOTH（单人对局）
     */
    public void startGrace(String sessionId, SeatRole seat) {
        if (!seat.isPlayer()) {
            return;
        }
        long window = properties.getReconnect().getGraceWindow().toMillis();
        scheduler.startOrResume(key(sessionId, seat), seat.wireName(), System.currentTimeMillis() + window, "0",
                (k, owner, version) -> expire(sessionId, seat));
        log.info("座位空出，开始重连宽限: sessionId={}, seat={}, windowMs={}", sessionId, seat.wireName(), window);
    }

    /**
     * 座位重新附着，取消宽限期。
     * @return true 表示确实取消了一个未到期的宽限
     */
    public boolean cancelGrace(String sessionId, SeatRole seat) {
        boolean cancelled = scheduler.stop(key(sessionId, seat));
        if (cancelled) {
            log.info("宽限期内重连，取消判负: sessionId={}, seat={}", sessionId, seat.wireName());
        }
        return cancelled;
    }

    public boolean isPending(String sessionId, SeatRole seat) {
        return scheduler.isScheduled(key(sessionId, seat));
    }

    @Override
    public void onSessionChanged(SessionView view) {
        if (view.isFinished()) {
            for (SeatRole seat : new SeatRole[]{SeatRole.WHITE, SeatRole.BLACK, SeatRole.BOTH}) {
                scheduler.stop(key(view.sessionId(), seat));
            }
        }
    }

    private void expire(String sessionId, SeatRole seat) {
        Color color = seat == SeatRole.BLACK ? Color.BLACK : Color.WHITE;
        registry.get(sessionId).ifPresent(live -> live
                .submit(s -> !seatHeld.test(sessionId, seat) && s.forfeit(color))
                .whenComplete((applied, ex) -> {
                    if (ex != null) {
                        log.warn("宽限期到期处理失败: sessionId={}, seat={}", sessionId, seat.wireName(), ex);
                    } else if (Boolean.TRUE.equals(applied)) {
                        log.info("宽限期到期判负: sessionId={}, seat={}", sessionId, seat.wireName());
                    } else {
                        log.debug("宽限期到期但无需判负: sessionId={}, seat={}", sessionId, seat.wireName());
                    }
                }));
    }

    private String key(String sessionId, SeatRole seat) {
        return KEY_PREFIX + sessionId + ":" + seat.wireName();
    }
}

package com.banchess.gameservice.games.banchess.application;

import com.banchess.gameservice.clock.scheduler.CountdownScheduler;
import com.banchess.gameservice.games.banchess.domain.model.ClockView;
import com.banchess.gameservice.games.banchess.domain.model.SessionView;
import com.banchess.rules.Color;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * TurnClockCoordinator
 * -------------------------------------------------
 * 行棋时钟协调器（应用编排层）：将通用倒计时引擎与 Ban Chess 对局对接。
 *
 * 职责与边界：
 * 1) 每次对局变更后根据最新视图决定“启动/续上/停止”计时：
 *    - 非进行中或不计时：停止；
 *    - 其他：为当前行动方（actor）按剩余时间重新设定截止时刻，version = revision；
 * 2) 到期时不直接修改对局，而是把 timeout(actor, revision) 投递进对局信箱，
 *    由 GameSession 按 revision 判断是否仍然有效（期间有新动作/送时间则作废）。
 *
 * 本类不管理线程池，也不负责广播（状态变更后的广播由 ConnectionMultiplexer 统一完成）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnClockCoordinator implements SessionEventListener {

    private static final String KEY_PREFIX = "clock:";

    // 通用倒计时调度器（不懂业务）
    private final CountdownScheduler scheduler;
    private final SessionRegistry registry;

    @PostConstruct
    public void register() {
        registry.addListener(this);
    }

    @Override
    public void onSessionChanged(SessionView view) {
        syncFromView(view);
    }

    /**
     * 根据最新视图驱动倒计时。
     */
    public void syncFromView(SessionView view) {
        ClockView clock = view.clock();
        Color actor = view.actor();
        if (!view.isActive() || clock == null || actor == null) {
            stop(view.sessionId());
            return;
        }
        long left = actor == Color.WHITE ? clock.whiteMs() : clock.blackMs();
        long deadline = clock.serverTime() + left;
        String sessionId = view.sessionId();
        scheduler.startOrResume(key(sessionId), actor.wireName(), deadline, String.valueOf(view.revision()),
                (k, owner, version) -> handleTimeout(sessionId, owner, version));
    }

    public void stop(String sessionId) {
        scheduler.stop(key(sessionId));
    }

    /**
     * 到期：向对局投递 timeout，由对局自行判断是否过期。
     */
    private void handleTimeout(String sessionId, String owner, String version) {
        registry.get(sessionId).ifPresent(live -> live
                .submit(s -> s.timeout(Color.fromWire(owner), Long.parseLong(version)))
                .whenComplete((applied, ex) -> {
                    if (ex != null) {
                        log.warn("超时处理失败: sessionId={}, side={}", sessionId, owner, ex);
                    } else if (Boolean.TRUE.equals(applied)) {
                        log.info("行棋超时判负: sessionId={}, side={}", sessionId, owner);
                    } else {
                        log.debug("超时已过期，忽略: sessionId={}, side={}, revision={}", sessionId, owner, version);
                    }
                }));
    }

    private String key(String sessionId) {
        return KEY_PREFIX + sessionId;
    }
}

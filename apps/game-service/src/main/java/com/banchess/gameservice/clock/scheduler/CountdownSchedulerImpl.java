package com.banchess.gameservice.clock.scheduler;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CountdownSchedulerImpl
 * ---------------------------------------
 * 通用倒计时调度引擎的默认实现（进程内）。
 *
 * 职责：
 *  - 使用 ScheduledExecutorService 在截止时刻触发一次；
 *  - key → 任务句柄，同 key 重新启动会先取消旧任务；
 *  - 回调异常只记录日志，不影响调度线程。
 *
 * 不做的事：
 *  - 不持久化：对局本身在内存中，重启后由检查点恢复时重新计时；
 *  - 不做任何业务逻辑（如判负、广播）。
 */
@Slf4j
public class CountdownSchedulerImpl implements CountdownScheduler {

    // 调度线程池
    private final ScheduledExecutorService scheduler;

    // key -> 任务句柄
    private final ConcurrentMap<String, ScheduledFuture<?>> activeTasks = new ConcurrentHashMap<>();

    public CountdownSchedulerImpl(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public void startOrResume(String key, String owner, long deadlineEpochMs, String version, TimeoutHandler onTimeout) {
        // 防止重复任务：先取消老任务
        stop(key);
        long delay = Math.max(0, deadlineEpochMs - System.currentTimeMillis());
        // 句柄数组：任务体内需要拿到自己的句柄做条件移除
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        synchronized (self) {
            self[0] = scheduler.schedule(() -> {
                ScheduledFuture<?> mine;
                synchronized (self) {
                    mine = self[0];
                }
                // 只有表里仍是自己时才算到期；已被替换/停止则放弃
                if (mine == null || !activeTasks.remove(key, mine)) {
                    return;
                }
                safeTimeout(onTimeout, key, owner, version);
            }, delay, TimeUnit.MILLISECONDS);
            activeTasks.put(key, self[0]);
        }
    }

    @Override
    public boolean stop(String key) {
        ScheduledFuture<?> f = activeTasks.remove(key);
        // 取消调度，但不打断正在运行
        return f != null && f.cancel(false);
    }

    @Override
    public boolean isScheduled(String key) {
        return activeTasks.containsKey(key);
    }

    /**
     * 触发超时回调，异常只记录。
     */
    private void safeTimeout(TimeoutHandler onTimeout, String key, String owner, String version) {
        if (onTimeout == null) return;
        try {
            onTimeout.onTimeout(key, owner, version);
        } catch (Exception e) {
            log.error("倒计时回调异常: key={}, owner={}, version={}", key, owner, version, e);
        }
    }
}

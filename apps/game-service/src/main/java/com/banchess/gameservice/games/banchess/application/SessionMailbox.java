package com.banchess.gameservice.games.banchess.application;

import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SessionMailbox
 * ---------------------------------------
 * 单个对局的串行信箱：任务按提交顺序逐个执行，同一时刻最多一个线程在跑。
 * 底层线程由所有对局共享（shared executor），不同对局互不阻塞。
 *
 * 每轮最多连续执行 {@link #BATCH} 个任务后让出线程，避免单个繁忙对局占满工作线程。
 */
@Slf4j
public class SessionMailbox implements Executor {

    private static final int BATCH = 32;

    private final String name;
    private final Executor pool;
    private final Queue<Runnable> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    public SessionMailbox(String name, Executor pool) {
        this.name = name;
        this.pool = pool;
    }

    /**
     * 投递任务。
     * @throws RejectedExecutionException 工作线程池已关闭
     */
    @Override
    public void execute(Runnable task) {
        queue.add(task);
        schedule();
    }

    /** 待执行任务数（不含正在执行的） */
    public int pending() {
        return queue.size();
    }

    private void schedule() {
        if (!scheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            pool.execute(this::drain);
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            queue.clear();
            throw e;
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < BATCH; i++) {
                Runnable task = queue.poll();
                if (task == null) {
                    break;
                }
                try {
                    task.run();
                } catch (Throwable t) {
                    log.error("对局信箱任务异常: mailbox={}", name, t);
                }
            }
        } finally {
            scheduled.set(false);
            // 释放标记后仍有任务（含执行期间新投递的），重新调度
            if (!queue.isEmpty()) {
                try {
                    schedule();
                } catch (RejectedExecutionException e) {
                    log.warn("对局信箱重新调度失败（线程池已关闭）: mailbox={}", name);
                }
            }
        }
    }
}

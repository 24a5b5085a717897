package com.banchess.gameservice.clock;

import com.banchess.gameservice.clock.scheduler.CountdownScheduler;
import com.banchess.gameservice.clock.scheduler.CountdownSchedulerImpl;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 倒计时装配：一个共享的定时线程池 + 基于它的通用倒计时调度器。
 *
 * 行棋时钟（clock:）、断线宽限（grace:）、终局移除（retire:）都走同一个调度器，
 * 到期回调只负责把动作投递进对局信箱，因此线程数很少即可（scheduler.clock.corePoolSize）。
 * 关闭后提交的任务直接丢弃；cancel 的任务立即移出队列。
 */
@Configuration
public class ClockSchedulerConfig {

    @Value("${scheduler.clock.corePoolSize:2}")
    private int corePoolSize;

    @Bean(name = "countdownExecutor", destroyMethod = "shutdownNow")
    public ScheduledThreadPoolExecutor countdownExecutor() {
        AtomicInteger seq = new AtomicInteger(1);
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(corePoolSize, r -> {
            Thread t = new Thread(r, "banchess-timer-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }, new ThreadPoolExecutor.DiscardPolicy());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public CountdownScheduler countdownScheduler(@Qualifier("countdownExecutor") ScheduledThreadPoolExecutor executor) {
        return new CountdownSchedulerImpl(executor);
    }
}

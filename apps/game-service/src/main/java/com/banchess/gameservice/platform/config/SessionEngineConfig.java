package com.banchess.gameservice.platform.config;

import com.banchess.rules.BanChessRules;
import com.banchess.rules.RulesEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 对局引擎装配：规则引擎、时间源、对局工作线程池。
 *
 * 工作线程池被所有对局共享；单个对局的串行性由 SessionMailbox 保证，
 * 因此线程数只影响不同对局之间的并行度。
 */
@Configuration
public class SessionEngineConfig {

    @Bean
    public RulesEngine rulesEngine() {
        return new BanChessRules(); // 纯函数，无状态
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "sessionWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService sessionWorkerExecutor(BanChessProperties properties) {
        ThreadFactory tf = new ThreadFactory() {
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "session-worker-" + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getSession().getWorkerThreads()), tf);
    }
}

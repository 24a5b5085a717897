package com.banchess.gameservice.support;

import com.banchess.gameservice.clock.scheduler.CountdownSchedulerImpl;
import com.banchess.gameservice.games.banchess.application.ReconnectGraceTracker;
import com.banchess.gameservice.games.banchess.application.SessionRegistry;
import com.banchess.gameservice.games.banchess.application.TurnClockCoordinator;
import com.banchess.gameservice.games.banchess.application.matchmaking.Matchmaker;
import com.banchess.gameservice.games.banchess.domain.repository.GameRecordRepository;
import com.banchess.gameservice.games.banchess.service.impl.BanChessServiceImpl;
import com.banchess.gameservice.platform.auth.JwtDecoderConfig;
import com.banchess.gameservice.platform.auth.JwtIdentityVerifier;
import com.banchess.gameservice.platform.config.BanChessProperties;
import com.banchess.gameservice.platform.connection.ConnectionMultiplexer;
import com.banchess.rules.BanChessRules;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.function.Consumer;

import static org.mockito.Mockito.mock;

/**
 * 不依赖 Spring 容器、按生产顺序手工装配的完整引擎（Redis 仓储为 mock）。
 */
public class TestEngine implements AutoCloseable {

    public static final String SECRET = "test-secret-0123456789-0123456789-abcdef";

    public final BanChessProperties properties = new BanChessProperties();
    public final Clock clock = Clock.systemUTC();
    public final ExecutorService workers = Executors.newFixedThreadPool(4);
    public final ScheduledThreadPoolExecutor timers = new ScheduledThreadPoolExecutor(2);
    public final CountdownSchedulerImpl scheduler = new CountdownSchedulerImpl(timers);
    public final GameRecordRepository repository = mock(GameRecordRepository.class);
    public final RecordingOutbound outbound = new RecordingOutbound();

    public final SessionRegistry registry;
    public final TurnClockCoordinator clocks;
    public final ReconnectGraceTracker grace;
    public final ConnectionMultiplexer multiplexer;
    public final Matchmaker matchmaker;
    public final BanChessServiceImpl service;

    public TestEngine() {
        this(p -> { });
    }

    public TestEngine(Consumer<BanChessProperties> customizer) {
        properties.getAuth().setJwtSecret(SECRET);
        properties.getAuth().setTrustClientIdentity(true);
        properties.getSession().setRetireGrace(Duration.ofSeconds(30));
        customizer.accept(properties);

        registry = new SessionRegistry(workers, new BanChessRules(), clock, repository, scheduler, properties);
        clocks = new TurnClockCoordinator(scheduler, registry);
        clocks.register();
        grace = new ReconnectGraceTracker(scheduler, registry, properties);
        grace.register();
        JwtIdentityVerifier verifier = new JwtIdentityVerifier(new JwtDecoderConfig().jwtDecoder(properties), properties);
        multiplexer = new ConnectionMultiplexer(registry, grace, outbound, verifier, properties, clock);
        multiplexer.register();
        matchmaker = new Matchmaker(registry, properties, clock);
        service = new BanChessServiceImpl(multiplexer, matchmaker, registry, properties);
        service.register();
    }

    @Override
    public void close() {
        timers.shutdownNow();
        workers.shutdownNow();
    }
}

package com.banchess.gameservice.platform.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ban Chess 对局引擎配置，对应 application.yml 中的 banchess.* 配置项。
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "banchess")
public class BanChessProperties {

    @Valid
    private Session session = new Session();
    @Valid
    private Reconnect reconnect = new Reconnect();
    @Valid
    private Clock clock = new Clock();
    @Valid
    private Matchmaking matchmaking = new Matchmaking();
    @Valid
    private Outbound outbound = new Outbound();
    private Auth auth = new Auth();

    @Data
    public static class Session {
        /** 对局工作线程数（所有对局共享，单个对局内串行） */
        @Min(1)
        private int workerThreads = 4;
        /** 终局后保留在内存中的时长，用于迟到的观战者拿到最终快照 */
        @NotNull
        private Duration retireGrace = Duration.ofMinutes(5);
        /** 检查点过期时间 */
        @NotNull
        private Duration checkpointTtl = Duration.ofHours(24);
        /** 是否允许观战者附着 */
        private boolean allowSpectators = true;
    }

    @Data
    public static class Reconnect {
        /** 玩家座位无在线连接后的重连宽限期 */
        @NotNull
        private Duration graceWindow = Duration.ofSeconds(30);
    }

    @Data
    public static class Clock {
        /** 默认时间控制（initial+increment，单位秒） */
        @NotBlank
        private String defaultTimeControl = "300+0";
        /** give-time 未指定秒数时的默认值 */
        @Min(1)
        private int giveTimeSeconds = 15;
    }

    @Data
    public static class Matchmaking {
        /** 匹配成功后记住该用户的时长，期间 leave 返回 ALREADY_MATCHED */
        @NotNull
        private Duration recentlyMatchedTtl = Duration.ofSeconds(60);
    }

    @Data
    public static class Outbound {
        /** 单连接发送缓冲上限（字节），超过即断开该连接 */
        @Min(1024)
        private int sendBufferSizeLimit = 512 * 1024;
        /** 单条消息发送耗时上限（毫秒） */
        private int sendTimeLimitMs = 10_000;
        /** 入站消息大小上限（字节） */
        private int messageSizeLimit = 64 * 1024;
    }

    @Data
    public static class Auth {
        /** HMAC-SHA256 签名密钥（至少 32 字节） */
        private String jwtSecret;
        /** 是否信任客户端自报的 userId/username（开发与访客模式） */
        private boolean trustClientIdentity = false;
    }
}

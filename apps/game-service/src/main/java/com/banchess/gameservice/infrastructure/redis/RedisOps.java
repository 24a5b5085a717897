package com.banchess.gameservice.infrastructure.redis;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * 公用 Redis 工具类：
 * - 只提供“原语级”方法；业务键名放在 RedisKeys / Repo 层组织
 * - 对象值走 JSON 模板，ZSET 索引走字符串模板
 */
@Component
@RequiredArgsConstructor
public class RedisOps {
    /** 通用对象模板：用于 JSON 存储与反序列化 */
    private final RedisTemplate<String, Object> redis;
    /** 字符串模板：用于 ZSET 索引 */
    private final StringRedisTemplate strRedis;

    // -------------- String --------------

    /**
     * 写入键值（无 TTL）
     */
    public void set(String key, Object val) {
        redis.opsForValue().set(key, val);
    }

    /**
     * 写入键值（带 TTL）
     */
    public void setEx(String key, Object val, Duration ttl) {
        redis.opsForValue().set(key, val, ttl);
    }

    /**
     * 获取键值；类型不符时返回 null
     */
    public <T> T get(String key, Class<T> type) {
        Object v = redis.opsForValue().get(key);
        return type.isInstance(v) ? type.cast(v) : null;
    }

    // -------------- ZSET --------------

    /**
     * 写入 ZSET 成员
     */
    public void zAdd(String key, String member, double score) {
        strRedis.opsForZSet().add(key, member, score);
    }

    /**
     * 按 score 倒序取前 limit 个成员
     */
    public List<String> zRevRange(String key, int limit) {
        Set<String> members = strRedis.opsForZSet().reverseRange(key, 0, limit - 1L);
        return members == null ? List.of() : new ArrayList<>(members);
    }

    /**
     * 仅保留 score 最高的 keep 个成员
     */
    public void zTrim(String key, int keep) {
        strRedis.opsForZSet().removeRange(key, 0, -keep - 1L);
    }

    // -------------- Key & TTL --------------

    /**
     * 删除一个或多个 Key
     */
    public Long del(String... keys) {
        return redis.delete(Arrays.asList(keys));
    }
}

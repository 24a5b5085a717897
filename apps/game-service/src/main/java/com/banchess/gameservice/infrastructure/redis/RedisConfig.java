package com.banchess.gameservice.infrastructure.redis;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * RedisConfig
 * -------------------------------------------------------
 * Redis 序列化配置（通用基础设施层）
 * -------------------------------------------------------
 *  - Key：String，保证键名在 redis-cli 中可读；
 *  - Value：GenericJackson2JsonRedisSerializer，携带类型信息，
 *    读取时可直接还原成 GameRecord / OngoingGameInfo；
 *  - StringRedisTemplate：用于 ZSET 索引等纯字符串操作。
 */
@Configuration
public class RedisConfig {

    /**
     * 通用 RedisTemplate（Key 为 String，Value 为 JSON）
     *
     * @param factory Spring Data Redis 提供的连接工厂（Lettuce）
     */
    @Bean
    public RedisTemplate<String, Object> redisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, Object> tpl = new RedisTemplate<>();
        tpl.setConnectionFactory(factory);

        StringRedisSerializer keySer = new StringRedisSerializer();
        GenericJackson2JsonRedisSerializer valSer = new GenericJackson2JsonRedisSerializer();

        tpl.setKeySerializer(keySer);
        tpl.setValueSerializer(valSer);
        tpl.setHashKeySerializer(keySer);
        tpl.setHashValueSerializer(valSer);

        tpl.afterPropertiesSet();
        return tpl;
    }

    /**
     * 纯字符串操作模板
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }
}

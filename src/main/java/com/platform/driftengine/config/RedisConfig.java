package com.platform.driftengine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "drift-engine.redis.enabled", havingValue = "true")
public class RedisConfig {

    @Value("${drift-engine.redis.cache-ttl-seconds:3600}")
    private int cacheTtlSeconds;

    @Value("${drift-engine.redis.key-prefix:de:}")
    private String keyPrefix;

    @Bean
    public RedisTemplate<String, byte[]> baselineRedisTemplate(RedisConnectionFactory factory) {
        RedisTemplate<String, byte[]> template = new RedisTemplate<>();
        template.setConnectionFactory(factory);
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(RedisSerializer.byteArray());
        template.afterPropertiesSet();
        return template;
    }

    @Bean
    public Duration redisCacheTtl() {
        return Duration.ofSeconds(cacheTtlSeconds);
    }

    @Bean
    public String redisKeyPrefix() {
        return keyPrefix;
    }
}

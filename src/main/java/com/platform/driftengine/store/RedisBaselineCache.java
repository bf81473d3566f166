package com.platform.driftengine.store;

import com.platform.driftengine.domain.BaselineRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis hot cache in front of the RocksDB baseline store.
 * <p>
 * Failures are logged and treated as misses; RocksDB stays authoritative.
 */
@Component
@ConditionalOnProperty(name = "drift-engine.redis.enabled", havingValue = "true")
public class RedisBaselineCache {

    private static final Logger log = LoggerFactory.getLogger(RedisBaselineCache.class);

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final Duration cacheTtl;
    private final String keyPrefix;

    @Autowired
    public RedisBaselineCache(RedisTemplate<String, byte[]> baselineRedisTemplate,
                              Duration redisCacheTtl,
                              String redisKeyPrefix) {
        this.redisTemplate = baselineRedisTemplate;
        this.cacheTtl = redisCacheTtl;
        this.keyPrefix = redisKeyPrefix;
    }

    public Optional<BaselineRecord> get(String tenantId, String datasetId) {
        String key = cacheKey(tenantId, datasetId);
        try {
            byte[] raw = redisTemplate.opsForValue().get(key);
            if (raw == null) {
                return Optional.empty();
            }
            return Optional.of(BaselineCodec.decode(raw));
        } catch (Exception e) {
            log.warn("Redis cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(BaselineRecord record) {
        String key = cacheKey(record.tenantId(), record.datasetId());
        try {
            redisTemplate.opsForValue().set(key, BaselineCodec.encode(record), cacheTtl);
        } catch (Exception e) {
            log.warn("Redis cache write failed for {}: {}", key, e.getMessage());
        }
    }

    public void invalidate(String tenantId, String datasetId) {
        String key = cacheKey(tenantId, datasetId);
        try {
            redisTemplate.delete(key);
        } catch (Exception e) {
            log.warn("Redis cache invalidation failed for {}: {}", key, e.getMessage());
        }
    }

    /**
     * Cache key format: de:b:{tenantId}:{datasetId}
     */
    String cacheKey(String tenantId, String datasetId) {
        return keyPrefix + "b:" + tenantId + ":" + datasetId;
    }
}

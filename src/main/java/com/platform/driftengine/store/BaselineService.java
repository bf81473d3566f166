package com.platform.driftengine.store;

import com.platform.driftengine.domain.BaselineRecord;
import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.exception.BaselineNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Baseline access with an optional Redis layer.
 * <p>
 * Read path: Redis, then RocksDB (populating Redis on hit).
 * Write path: RocksDB, then Redis. Delete removes from both.
 * <p>
 * Every Redis write happens under the RocksDB key lock, so Redis never ends
 * up holding an older record than RocksDB.
 */
@Service
@Primary
public class BaselineService implements BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineService.class);

    private final RocksDBBaselineStore rocksStore;
    private final RedisBaselineCache redisCache;

    @Autowired
    public BaselineService(RocksDBBaselineStore rocksStore,
                           @Autowired(required = false) RedisBaselineCache redisCache) {
        this.rocksStore = rocksStore;
        this.redisCache = redisCache;
    }

    @Override
    public Optional<BaselineRecord> get(String tenantId, String datasetId) {
        if (redisCache != null) {
            Optional<BaselineRecord> cached = redisCache.get(tenantId, datasetId);
            if (cached.isPresent()) {
                return cached;
            }
        }
        if (redisCache == null) {
            return rocksStore.get(tenantId, datasetId);
        }
        return rocksStore.withKeyLock(tenantId, datasetId, () -> {
            Optional<BaselineRecord> stored = rocksStore.get(tenantId, datasetId);
            stored.ifPresent(redisCache::put);
            return stored;
        });
    }

    public BaselineRecord require(String tenantId, String datasetId) {
        return get(tenantId, datasetId).orElseThrow(() -> new BaselineNotFoundException(tenantId, datasetId));
    }

    public List<String> listDatasets(String tenantId) {
        return rocksStore.listDatasets(tenantId);
    }

    @Override
    public void put(BaselineRecord record) {
        if (redisCache == null) {
            rocksStore.put(record);
            return;
        }
        rocksStore.withKeyLock(record.tenantId(), record.datasetId(), () -> {
            rocksStore.put(record);
            redisCache.put(record);
            return record;
        });
    }

    @Override
    public boolean delete(String tenantId, String datasetId) {
        if (redisCache == null) {
            return rocksStore.delete(tenantId, datasetId);
        }
        return rocksStore.withKeyLock(tenantId, datasetId, () -> {
            boolean existed = rocksStore.delete(tenantId, datasetId);
            redisCache.invalidate(tenantId, datasetId);
            return existed;
        });
    }

    @Override
    public BaselineRecord compute(String tenantId, String datasetId,
                                  Function<Optional<BaselineRecord>, BaselineRecord> remapping) {
        if (redisCache == null) {
            return rocksStore.compute(tenantId, datasetId, remapping);
        }
        return rocksStore.withKeyLock(tenantId, datasetId, () -> {
            BaselineRecord updated = rocksStore.compute(tenantId, datasetId, remapping);
            redisCache.put(updated);
            return updated;
        });
    }

    /**
     * Replace the baseline with one built from {@code snapshot}. Row count
     * history restarts from this snapshot.
     */
    public BaselineRecord establish(String tenantId, String datasetId, DatasetSnapshot snapshot) {
        BaselineRecord record = compute(tenantId, datasetId,
                existing -> BaselineRecord.establish(tenantId, datasetId, snapshot, Instant.now()));
        log.info("Established baseline {}: {} rows, {} columns",
                record.key(), record.rowCount(), record.columns().size());
        return record;
    }
}

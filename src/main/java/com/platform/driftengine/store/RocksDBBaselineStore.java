package com.platform.driftengine.store;

import com.platform.driftengine.config.RocksDBConfig;
import com.platform.driftengine.domain.BaselineRecord;
import com.platform.driftengine.exception.BaselineStoreException;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Baseline persistence backed by RocksDB.
 * <p>
 * Column family {@code baselines}; key {@code tenant_id NUL dataset_id};
 * value is the JSON-encoded {@link BaselineRecord}.
 */
@Component
public class RocksDBBaselineStore implements BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(RocksDBBaselineStore.class);

    private final RocksDB db;
    private final ColumnFamilyHandle baselines;
    private final ConcurrentHashMap<String, ReentrantLock> keyLocks = new ConcurrentHashMap<>();

    public RocksDBBaselineStore(RocksDB db, Map<String, ColumnFamilyHandle> columnFamilyHandles) {
        this.db = db;
        this.baselines = Objects.requireNonNull(columnFamilyHandles.get(RocksDBConfig.CF_BASELINES),
                "missing column family " + RocksDBConfig.CF_BASELINES);
    }

    /**
     * Key: [tenant_id:varB][NUL:1B][dataset_id:varB]
     */
    public static byte[] baselineKey(String tenantId, String datasetId) {
        return (tenantId + "\0" + datasetId).getBytes(StandardCharsets.UTF_8);
    }

    // ------------------------------------------------------------------
    // Read path
    // ------------------------------------------------------------------

    @Override
    public Optional<BaselineRecord> get(String tenantId, String datasetId) {
        byte[] raw;
        try {
            raw = db.get(baselines, baselineKey(tenantId, datasetId));
        } catch (RocksDBException e) {
            throw new BaselineStoreException("RocksDB read failed for baseline " + tenantId + "/" + datasetId, e);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(BaselineCodec.decode(raw));
        } catch (IOException e) {
            log.error("Failed to deserialize baseline {}/{}", tenantId, datasetId, e);
            throw new BaselineStoreException("Corrupt baseline " + tenantId + "/" + datasetId, e);
        }
    }

    /**
     * Dataset ids with a baseline for the tenant, in key order.
     */
    public List<String> listDatasets(String tenantId) {
        byte[] prefix = (tenantId + "\0").getBytes(StandardCharsets.UTF_8);
        List<String> datasets = new ArrayList<>();
        try (RocksIterator it = db.newIterator(baselines)) {
            for (it.seek(prefix); it.isValid(); it.next()) {
                byte[] key = it.key();
                if (!startsWith(key, prefix)) {
                    break;
                }
                datasets.add(new String(key, prefix.length, key.length - prefix.length, StandardCharsets.UTF_8));
            }
        }
        return datasets;
    }

    // ------------------------------------------------------------------
    // Write path
    // ------------------------------------------------------------------

    @Override
    public void put(BaselineRecord record) {
        try {
            db.put(baselines, baselineKey(record.tenantId(), record.datasetId()), BaselineCodec.encode(record));
        } catch (RocksDBException | IOException e) {
            throw new BaselineStoreException("RocksDB write failed for baseline " + record.key(), e);
        }
        log.debug("Stored baseline {} ({} rows, {} history entries)",
                record.key(), record.rowCount(), record.rowCountHistory().size());
    }

    @Override
    public boolean delete(String tenantId, String datasetId) {
        ReentrantLock lock = lockFor(tenantId, datasetId);
        lock.lock();
        try {
            byte[] key = baselineKey(tenantId, datasetId);
            boolean existed = db.get(baselines, key) != null;
            if (existed) {
                db.delete(baselines, key);
                log.info("Deleted baseline {}/{}", tenantId, datasetId);
            }
            return existed;
        } catch (RocksDBException e) {
            throw new BaselineStoreException("RocksDB delete failed for baseline " + tenantId + "/" + datasetId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BaselineRecord compute(String tenantId, String datasetId,
                                  Function<Optional<BaselineRecord>, BaselineRecord> remapping) {
        ReentrantLock lock = lockFor(tenantId, datasetId);
        lock.lock();
        try {
            BaselineRecord updated = remapping.apply(get(tenantId, datasetId));
            put(updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@code action} while holding the write lock of the key. Lets a cache
     * layer update in the same order as RocksDB.
     */
    public <T> T withKeyLock(String tenantId, String datasetId, Supplier<T> action) {
        ReentrantLock lock = lockFor(tenantId, datasetId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String tenantId, String datasetId) {
        return keyLocks.computeIfAbsent(tenantId + "\0" + datasetId, k -> new ReentrantLock());
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) return false;
        }
        return true;
    }
}

package com.platform.driftengine.store;

import com.platform.driftengine.domain.BaselineRecord;

import java.util.Optional;
import java.util.function.Function;

/**
 * Keyed store of the live baseline per (tenant, dataset).
 * <p>
 * {@link #put} is the only write primitive. {@link #compute} runs a
 * read-modify-write under the key's lock and persists through {@code put},
 * so concurrent runs on the same key never lose an update. Reads are not locked.
 */
public interface BaselineStore {

    Optional<BaselineRecord> get(String tenantId, String datasetId);

    void put(BaselineRecord record);

    /**
     * @return true if a baseline existed
     */
    boolean delete(String tenantId, String datasetId);

    /**
     * @param remapping receives the stored baseline (if any) and returns the one to store
     * @return the stored baseline
     */
    BaselineRecord compute(String tenantId, String datasetId,
                           Function<Optional<BaselineRecord>, BaselineRecord> remapping);
}

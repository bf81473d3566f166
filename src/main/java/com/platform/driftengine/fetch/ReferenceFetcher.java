package com.platform.driftengine.fetch;

import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.domain.TableRef;
import com.platform.driftengine.exception.DataFetchException;

/**
 * Source of bounded table snapshots. The warehouse connector lives behind this
 * interface; {@link LocalSnapshotFetcher} is the in-process implementation.
 */
public interface ReferenceFetcher {

    /**
     * Latest sample of the table.
     */
    DatasetSnapshot fetchCurrent(TableRef table) throws DataFetchException;

    /**
     * Sample of the table as it was {@code offsetDays} ago. Implementations
     * that cannot time travel return the current sample tagged
     * {@link com.platform.driftengine.domain.SnapshotSource#CURRENT_FALLBACK}.
     * An empty snapshot means no version is old enough.
     */
    DatasetSnapshot fetchReference(TableRef table, int offsetDays) throws DataFetchException;
}

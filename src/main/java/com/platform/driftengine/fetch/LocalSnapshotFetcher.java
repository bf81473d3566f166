package com.platform.driftengine.fetch;

import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.domain.SnapshotSource;
import com.platform.driftengine.domain.TableRef;
import com.platform.driftengine.exception.DataFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory snapshot source.
 * <p>
 * Keeps every registered snapshot per table, ordered by capture time, so
 * time-travel reads can be served from older versions. Samples are truncated
 * to {@code drift-engine.snapshot.sample-size} rows on registration.
 */
@Component
public class LocalSnapshotFetcher implements ReferenceFetcher {

    private static final Logger log = LoggerFactory.getLogger(LocalSnapshotFetcher.class);

    private final Map<String, List<DatasetSnapshot>> history = new ConcurrentHashMap<>();
    private final int sampleSize;
    private final boolean timeTravelEnabled;
    private final Clock clock;

    @Autowired
    public LocalSnapshotFetcher(@Value("${drift-engine.snapshot.sample-size:10000}") int sampleSize,
                                @Value("${drift-engine.snapshot.time-travel-enabled:false}") boolean timeTravelEnabled) {
        this(sampleSize, timeTravelEnabled, Clock.systemUTC());
    }

    public LocalSnapshotFetcher(int sampleSize, boolean timeTravelEnabled, Clock clock) {
        if (sampleSize < 1) {
            throw new IllegalArgumentException("sample size must be positive: " + sampleSize);
        }
        this.sampleSize = sampleSize;
        this.timeTravelEnabled = timeTravelEnabled;
        this.clock = clock;
    }

    /**
     * Add a version of the table. Versions are ordered by {@code capturedAt}.
     *
     * @return the stored (possibly truncated) snapshot
     */
    public DatasetSnapshot register(TableRef table, DatasetSnapshot snapshot) {
        DatasetSnapshot stored = snapshot.limit(sampleSize).withSource(SnapshotSource.CURRENT);
        List<DatasetSnapshot> versions = history.computeIfAbsent(table.qualifiedName(),
                k -> Collections.synchronizedList(new ArrayList<>()));
        synchronized (versions) {
            versions.add(stored);
            versions.sort(Comparator.comparing(DatasetSnapshot::capturedAt));
        }
        log.info("Registered snapshot of {}: {} rows, {} columns, captured at {}",
                table, stored.rowCount(), stored.columns().size(), stored.capturedAt());
        return stored;
    }

    public int versionCount(TableRef table) {
        List<DatasetSnapshot> versions = history.get(table.qualifiedName());
        return versions == null ? 0 : versions.size();
    }

    @Override
    public DatasetSnapshot fetchCurrent(TableRef table) {
        List<DatasetSnapshot> versions = versions(table, null);
        synchronized (versions) {
            return versions.get(versions.size() - 1);
        }
    }

    @Override
    public DatasetSnapshot fetchReference(TableRef table, int offsetDays) {
        if (offsetDays < 1) {
            throw new DataFetchException(table, offsetDays, "Time travel offset must be positive: " + offsetDays);
        }
        List<DatasetSnapshot> versions = versions(table, offsetDays);

        if (!timeTravelEnabled) {
            log.warn("Time travel not available for {}; using current snapshot as reference ({} day(s) requested)",
                    table, offsetDays);
            return fetchCurrent(table).withSource(SnapshotSource.CURRENT_FALLBACK);
        }

        Instant cutoff = clock.instant().minus(Duration.ofDays(offsetDays));
        synchronized (versions) {
            for (int i = versions.size() - 1; i >= 0; i--) {
                DatasetSnapshot candidate = versions.get(i);
                if (!candidate.capturedAt().isAfter(cutoff)) {
                    log.debug("Serving {} as of {} (version captured at {})", table, cutoff, candidate.capturedAt());
                    return candidate.withSource(SnapshotSource.TIME_TRAVEL);
                }
            }
            log.info("No version of {} at or before {}", table, cutoff);
            return versions.get(0).emptyCopy(SnapshotSource.TIME_TRAVEL);
        }
    }

    private List<DatasetSnapshot> versions(TableRef table, Integer offsetDays) {
        List<DatasetSnapshot> versions = history.get(table.qualifiedName());
        if (versions == null || versions.isEmpty()) {
            throw new DataFetchException(table, offsetDays, "Table not found: " + table.qualifiedName());
        }
        return versions;
    }
}

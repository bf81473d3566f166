package com.platform.driftengine.controller;

import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.domain.SnapshotSource;
import com.platform.driftengine.dto.Dtos.*;
import com.platform.driftengine.fetch.LocalSnapshotFetcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

/**
 * Feeds the local snapshot fetcher. Stands in for the warehouse connector.
 */
@RestController
@RequestMapping("/api/v1/snapshots")
public class SnapshotController {

    private final LocalSnapshotFetcher snapshotFetcher;

    public SnapshotController(LocalSnapshotFetcher snapshotFetcher) {
        this.snapshotFetcher = snapshotFetcher;
    }

    @PostMapping
    public ResponseEntity<SnapshotResponse> register(@RequestBody RegisterSnapshotRequest req) {
        if (req.table() == null || req.columns() == null || req.rows() == null) {
            throw new IllegalArgumentException("table, columns and rows are required");
        }
        DatasetSnapshot snapshot = new DatasetSnapshot(req.columns(), req.columnTypes(), req.rows(),
                req.capturedAt() != null ? req.capturedAt() : Instant.now(), SnapshotSource.CURRENT);
        DatasetSnapshot stored = snapshotFetcher.register(req.table(), snapshot);
        return ResponseEntity.ok(new SnapshotResponse(req.table().qualifiedName(), stored.rowCount(),
                stored.columns().size(), stored.capturedAt(), snapshotFetcher.versionCount(req.table())));
    }
}

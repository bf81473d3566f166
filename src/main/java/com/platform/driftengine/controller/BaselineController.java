package com.platform.driftengine.controller;

import com.platform.driftengine.domain.BaselineRecord;
import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.dto.Dtos.*;
import com.platform.driftengine.fetch.ReferenceFetcher;
import com.platform.driftengine.store.BaselineService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;

@RestController
@RequestMapping("/api/v1/baselines")
public class BaselineController {

    private final BaselineService baselineService;
    private final ReferenceFetcher fetcher;

    public BaselineController(BaselineService baselineService, ReferenceFetcher fetcher) {
        this.baselineService = baselineService;
        this.fetcher = fetcher;
    }

    @GetMapping("/{tenantId}")
    public ResponseEntity<BaselineListResponse> list(@PathVariable String tenantId) {
        return ResponseEntity.ok(new BaselineListResponse(tenantId, baselineService.listDatasets(tenantId)));
    }

    @GetMapping("/{tenantId}/{datasetId}")
    public ResponseEntity<BaselineResponse> get(@PathVariable String tenantId, @PathVariable String datasetId) {
        return ResponseEntity.ok(toResponse(baselineService.require(tenantId, datasetId)));
    }

    /**
     * Replace the baseline with the table's current snapshot.
     */
    @PostMapping("/{tenantId}/{datasetId}")
    public ResponseEntity<BaselineResponse> refresh(@PathVariable String tenantId,
                                                    @PathVariable String datasetId,
                                                    @RequestBody RefreshBaselineRequest req) {
        if (req.table() == null) {
            throw new IllegalArgumentException("table is required");
        }
        DatasetSnapshot current = fetcher.fetchCurrent(req.table());
        return ResponseEntity.ok(toResponse(baselineService.establish(tenantId, datasetId, current)));
    }

    @DeleteMapping("/{tenantId}/{datasetId}")
    public ResponseEntity<DeleteBaselineResponse> delete(@PathVariable String tenantId,
                                                         @PathVariable String datasetId) {
        boolean deleted = baselineService.delete(tenantId, datasetId);
        if (!deleted) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new DeleteBaselineResponse(tenantId, datasetId, true));
    }

    private BaselineResponse toResponse(BaselineRecord record) {
        return new BaselineResponse(record.tenantId(), record.datasetId(), record.rowCount(),
                record.columns(), record.columnTypes(), record.createdAt(), record.updatedAt(),
                record.rowCountHistory(), new ArrayList<>(record.columnProfiles().keySet()));
    }
}

package com.platform.driftengine.controller;

import com.platform.driftengine.domain.ConfigValidation;
import com.platform.driftengine.domain.DriftRunResult;
import com.platform.driftengine.dto.Dtos.*;
import com.platform.driftengine.service.DriftEngine;
import com.platform.driftengine.service.DriftRunRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/drift")
public class DriftController {

    private final DriftEngine driftEngine;

    public DriftController(DriftEngine driftEngine) {
        this.driftEngine = driftEngine;
    }

    @PostMapping("/validate")
    public ResponseEntity<ValidationResponse> validate(@RequestBody ValidateConfigRequest req) {
        ConfigValidation validation = driftEngine.validate(req.config());
        return ResponseEntity.ok(new ValidationResponse(
                validation.valid(), validation.errors(), validation.warnings(), validation.monitorCount(),
                validation.config() != null ? validation.config().timeTravelDays() : null));
    }

    /**
     * Runs synchronously. A failed fetch still returns 200 with {@code status=failed}.
     */
    @PostMapping("/runs")
    public ResponseEntity<DriftRunResult> run(@RequestBody RunDriftRequest req) {
        if (req.tenantId() == null || req.datasetId() == null || req.table() == null) {
            throw new IllegalArgumentException("tenantId, datasetId and table are required");
        }
        DriftRunResult result = driftEngine.run(
                new DriftRunRequest(req.tenantId(), req.datasetId(), req.table(), req.config()));
        return ResponseEntity.ok(result);
    }
}

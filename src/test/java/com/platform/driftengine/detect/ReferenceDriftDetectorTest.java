package com.platform.driftengine.detect;

import com.platform.driftengine.TestSnapshots;
import com.platform.driftengine.domain.*;
import com.platform.driftengine.monitor.MonitorConfigParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDriftDetectorTest {

    private final ReferenceDriftDetector detector = new ReferenceDriftDetector(null, 0.1);

    private DriftRunResult run(List<MonitorSpec> monitors, DatasetSnapshot current, DatasetSnapshot reference) {
        DriftRunContext context = new DriftRunContext(DriftRunResult.start("orders"), "t1", TableRef.of("ORDERS"), 7);
        return detector.evaluate(context, monitors, current, reference);
    }

    @Test
    void testRequiresReference() {
        assertTrue(detector.requiresReference());
    }

    @Test
    void testFallbackIsFlaggedOnEveryResult() {
        DatasetSnapshot current = TestSnapshots.orders(100, 50);
        DatasetSnapshot fallback = current.withSource(SnapshotSource.CURRENT_FALLBACK);

        DriftRunResult result = run(List.of(
                MonitorSpec.schema("s"),
                MonitorSpec.distribution("d", "STATUS", 0.1),
                new MonitorSpec("bad", MonitorKind.DISTRIBUTION, "STATUS", 0.05, StatTest.KS)), current, fallback);

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(0, result.getDriftDetectedCount());
        for (DriftResult r : result.getResults()) {
            assertEquals(true, r.details().get("reference_fallback"), r.monitorName());
            assertEquals("current_fallback", r.details().get("reference_source"));
        }
        assertEquals(Severity.ERROR, result.getResults().get(2).severity());
    }

    @Test
    void testTimeTravelReferenceDetectsSchemaChange() {
        DatasetSnapshot reference = TestSnapshots.withSchema(Map.of("id", "int"), 10)
                .withSource(SnapshotSource.TIME_TRAVEL);
        DatasetSnapshot current = TestSnapshots.withSchema(new java.util.LinkedHashMap<>(Map.of("id", "bigint")), 10);

        DriftRunResult result = run(List.of(MonitorSpec.schema("s")), current, reference);

        DriftResult r = result.getResults().get(0);
        assertTrue(r.detected());
        assertEquals(List.of("id: int -> bigint"), r.details().get("modified"));
        assertEquals(false, r.details().get("reference_fallback"));
    }

    @Test
    void testVolumeChangeRatio() {
        DriftRunResult result = run(List.of(
                        MonitorSpec.volume("strict", 0.3),
                        MonitorSpec.volume("loose", 0.6)),
                TestSnapshots.orders(150, 50), TestSnapshots.orders(100, 50).withSource(SnapshotSource.TIME_TRAVEL));

        assertEquals(0.5, result.getResults().get(0).metricValue(), 1e-12);
        assertTrue(result.getResults().get(0).detected());
        assertFalse(result.getResults().get(1).detected());
    }

    @Test
    void testDefaultVolumeThresholdIsChangeRatio() {
        DriftConfig config = new MonitorConfigParser()
                .parse("monitors:\n  - type: volume\n", detector.thresholdDefaults())
                .config();

        DriftRunResult result = run(config.monitors(),
                TestSnapshots.orders(3500, 100), TestSnapshots.orders(1000, 100).withSource(SnapshotSource.TIME_TRAVEL));

        DriftResult volume = result.getResults().get(0);
        assertEquals(ReferenceDriftDetector.DEFAULT_VOLUME_CHANGE_RATIO, volume.threshold(), 1e-12);
        assertEquals(2.5, volume.metricValue(), 1e-12);
        assertTrue(volume.detected());
        assertEquals(Severity.WARNING, volume.severity());
    }

    @Test
    void testChangeRatioFromEmptyReference() {
        assertEquals(0.0, ReferenceDriftDetector.changeRatio(0, 0));
        assertEquals(Double.POSITIVE_INFINITY, ReferenceDriftDetector.changeRatio(0, 5));
        assertEquals(0.25, ReferenceDriftDetector.changeRatio(100, 75), 1e-12);
    }

    @Test
    void testDistributionAgainstReference() {
        DatasetSnapshot reference = TestSnapshots.orders(100, 50).withSource(SnapshotSource.TIME_TRAVEL);

        DriftRunResult result = run(List.of(
                MonitorSpec.distribution("status", "STATUS", 0.1),
                new MonitorSpec("amount_ks", MonitorKind.DISTRIBUTION, "AMOUNT", 0.05, StatTest.KS)),
                TestSnapshots.orders(100, 95), reference);

        assertTrue(result.getResults().get(0).detected());
        DriftResult ks = result.getResults().get(1);
        assertFalse(ks.detected());
        assertEquals("ks", ks.details().get("stat_test"));
    }

    @Test
    void testMissingReferenceFailsRun() {
        DriftRunResult result = run(List.of(MonitorSpec.schema("s")), TestSnapshots.orders(10, 5), null);

        assertEquals(RunStatus.FAILED, result.getStatus());
        assertNotNull(result.getError());
        assertEquals(0, result.getTotalMonitors());
    }
}

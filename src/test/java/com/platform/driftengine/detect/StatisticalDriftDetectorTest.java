package com.platform.driftengine.detect;

import com.platform.driftengine.TestSnapshots;
import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.BaselineStoreException;
import com.platform.driftengine.store.InMemoryBaselineStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.io.IOException;
import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalDriftDetectorTest {

    private static final String TENANT = "tenant-1";
    private static final String DATASET = "orders";

    private InMemoryBaselineStore store;
    private ExecutorService pool;
    private StatisticalDriftDetector detector;

    @BeforeEach
    void setUp() {
        store = new InMemoryBaselineStore();
        pool = Executors.newFixedThreadPool(4);
        detector = new StatisticalDriftDetector(store, pool, 30, 0.1);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private DriftRunContext context() {
        return new DriftRunContext(DriftRunResult.start(DATASET), TENANT, TableRef.of("ORDERS"), 1);
    }

    private DriftRunResult run(List<MonitorSpec> monitors, DatasetSnapshot current) {
        return detector.evaluate(context(), monitors, current, null);
    }

    private void seedBaseline(DatasetSnapshot snapshot) {
        store.put(BaselineRecord.establish(TENANT, DATASET, snapshot, Instant.now()));
    }

    private static DatasetSnapshot statusSnapshot(int pending, int completed) {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < pending; i++) rows.add(List.of("pending"));
        for (int i = 0; i < completed; i++) rows.add(List.of("completed"));
        return DatasetSnapshot.of(Map.of("STATUS", "string"), rows);
    }

    private static Map<String, String> schema(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) map.put(pairs[i], pairs[i + 1]);
        return map;
    }

    @Test
    void testFirstRunEstablishesBaseline() {
        DriftRunResult result = run(List.of(
                MonitorSpec.schema("schema_check"),
                MonitorSpec.distribution("status_dist", "STATUS", 0.1)), TestSnapshots.orders(100, 50));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getTotalMonitors());
        assertEquals(0, result.getDriftDetectedCount());
        for (DriftResult r : result.getResults()) {
            assertFalse(r.detected());
            assertEquals(Severity.INFO, r.severity());
            assertEquals(true, r.details().get("baseline_established"));
        }

        BaselineRecord baseline = store.get(TENANT, DATASET).orElseThrow();
        assertEquals(100, baseline.rowCount());
        assertEquals(List.of("ID", "STATUS", "AMOUNT"), baseline.columns());
        assertEquals(1, store.writeCount());
    }

    @Test
    void testSchemaColumnAdded() {
        seedBaseline(TestSnapshots.withSchema(schema("id", "int", "amount", "float"), 10));

        DriftRunResult result = run(List.of(MonitorSpec.schema("schema_check")),
                TestSnapshots.withSchema(schema("id", "int", "amount", "float", "status", "string"), 10));

        assertEquals(1, result.getTotalMonitors());
        DriftResult r = result.getResults().get(0);
        assertTrue(r.detected());
        assertEquals(Severity.CRITICAL, r.severity());
        assertEquals(List.of("status"), r.details().get("added"));
        assertEquals(1.0, r.metricValue());
    }

    @Test
    void testMetricEqualToThresholdIsNotDrift() {
        seedBaseline(TestSnapshots.withSchema(schema("id", "int"), 10));

        DriftRunResult result = run(List.of(new MonitorSpec("s", MonitorKind.SCHEMA, null, 1.0, null)),
                TestSnapshots.withSchema(schema("id", "int", "extra", "string"), 10));

        DriftResult r = result.getResults().get(0);
        assertEquals(1.0, r.metricValue());
        assertFalse(r.detected());
        assertEquals(Severity.INFO, r.severity());
    }

    @Test
    void testSmallVolumeChangeNotDrift() {
        seedBaseline(TestSnapshots.orders(1000, 500));

        DriftRunResult result = run(List.of(MonitorSpec.volume("rows", 0.5)), TestSnapshots.orders(1003, 500));

        DriftResult r = result.getResults().get(0);
        assertFalse(r.detected());
        assertEquals(0.03, r.metricValue(), 1e-9);
        assertEquals("percent_change", r.details().get("method"));
        assertEquals(List.of(1000L, 1003L), store.get(TENANT, DATASET).orElseThrow().rowCountHistory());
    }

    @Test
    void testVolumeZscoreWithHistory() {
        Instant now = Instant.now();
        store.put(BaselineRecord.establish(TENANT, DATASET, TestSnapshots.orders(1000, 500), now)
                .withRowCountObserved(1010, 30, now)
                .withRowCountObserved(990, 30, now));

        DriftRunResult result = run(List.of(MonitorSpec.volume("rows", 3.0)), TestSnapshots.orders(1100, 500));

        DriftResult r = result.getResults().get(0);
        assertEquals("zscore", r.details().get("method"));
        assertEquals(10.0, r.metricValue(), 1e-9);
        assertTrue(r.detected());
        assertEquals(Severity.WARNING, r.severity());
    }

    @Test
    void testVolumeHistoryIsBounded() {
        detector = new StatisticalDriftDetector(store, pool, 3, 0.1);
        seedBaseline(TestSnapshots.orders(10, 5));

        for (int rows = 11; rows <= 14; rows++) {
            run(List.of(MonitorSpec.volume("rows", 100.0)), TestSnapshots.orders(rows, 5));
        }

        assertEquals(List.of(12L, 13L, 14L), store.get(TENANT, DATASET).orElseThrow().rowCountHistory());
    }

    @Test
    void testDistributionShiftDetected() {
        seedBaseline(statusSnapshot(50, 50));

        DriftRunResult result = run(List.of(MonitorSpec.distribution("status_dist", "STATUS", 0.1)),
                statusSnapshot(5, 95));

        DriftResult r = result.getResults().get(0);
        assertTrue(r.detected());
        assertEquals(Severity.WARNING, r.severity());
        assertTrue(r.metricValue() > 0.1);
        assertEquals("psi", r.details().get("stat_test"));
        assertEquals("STATUS", r.details().get("column"));
    }

    @Test
    void testNewColumnProfileIsAddedToBaseline() {
        seedBaseline(statusSnapshot(50, 50));
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 20; i++) rows.add(List.of("pending", "x" + (i % 2)));
        DatasetSnapshot current = DatasetSnapshot.of(schema("STATUS", "string", "NOTE", "string"), rows);

        DriftRunResult result = run(List.of(MonitorSpec.distribution("note_dist", "NOTE", 0.1)), current);

        DriftResult r = result.getResults().get(0);
        assertFalse(r.detected());
        assertEquals(true, r.details().get("baseline_established"));
        BaselineRecord baseline = store.get(TENANT, DATASET).orElseThrow();
        assertTrue(baseline.profile("NOTE").isPresent());
        assertEquals(List.of("STATUS"), baseline.columns());
    }

    @Test
    void testMonitorErrorsDoNotFailRun() {
        seedBaseline(TestSnapshots.withSchema(schema("id", "int", "status", "string"), 10));

        DriftRunResult result = run(List.of(
                MonitorSpec.schema("schema_check"),
                MonitorSpec.distribution("gone", "status", 0.1),
                new MonitorSpec("ks_on_text", MonitorKind.DISTRIBUTION, "name", 0.05, StatTest.KS)),
                TestSnapshots.withSchema(schema("id", "int", "name", "string"), 10));

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(3, result.getTotalMonitors());
        assertEquals(1, result.getDriftDetectedCount());
        assertEquals(result.getResults().stream().filter(DriftResult::detected).count(),
                result.getDriftDetectedCount());

        DriftResult missing = result.getResults().get(1);
        assertEquals(Severity.ERROR, missing.severity());
        assertFalse(missing.detected());
        assertTrue(missing.message().contains("status"));
    }

    @Test
    void testKsOnTextColumnIsError() {
        seedBaseline(statusSnapshot(50, 50));

        DriftRunResult result = run(List.of(
                new MonitorSpec("ks", MonitorKind.DISTRIBUTION, "STATUS", 0.05, StatTest.KS)), statusSnapshot(40, 60));

        DriftResult r = result.getResults().get(0);
        assertEquals(Severity.ERROR, r.severity());
        assertTrue(r.message().contains("numeric"));
    }

    @Test
    void testDatasetDriftShare() {
        seedBaseline(TestSnapshots.orders(100, 50));
        DatasetSnapshot current = TestSnapshots.orders(100, 100);

        DriftRunResult result = run(List.of(
                MonitorSpec.dataset("dataset_low", 0.3),
                MonitorSpec.dataset("dataset_high", 0.5)), current);

        DriftResult low = result.getResults().get(0);
        assertEquals(1.0 / 3.0, low.metricValue(), 1e-9);
        assertTrue(low.detected());
        assertEquals(Severity.CRITICAL, low.severity());
        assertEquals(List.of("STATUS"), low.details().get("drifted_columns"));

        assertFalse(result.getResults().get(1).detected());
    }

    @Test
    void testResultsKeepConfigurationOrder() {
        seedBaseline(TestSnapshots.orders(100, 50));
        List<MonitorSpec> monitors = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            monitors.add(i % 2 == 0
                    ? MonitorSpec.distribution("m" + i, "STATUS", 0.1)
                    : MonitorSpec.volume("m" + i, 3.0));
        }

        DriftRunResult result = run(monitors, TestSnapshots.orders(100, 50));

        for (int i = 0; i < 12; i++) {
            assertEquals("m" + i, result.getResults().get(i).monitorName());
        }
    }

    @Test
    void testNoWriteWhenNothingChanged() {
        seedBaseline(TestSnapshots.orders(10, 5));
        int writesBefore = store.writeCount();

        run(List.of(MonitorSpec.schema("s")), TestSnapshots.orders(10, 5));

        assertEquals(writesBefore, store.writeCount());
    }

    @Test
    void testDoesNotRequireReference() {
        assertFalse(detector.requiresReference());
    }

    @Test
    void testFailedBaselineWriteKeepsRunCompleted() {
        InMemoryBaselineStore failingStore = new InMemoryBaselineStore() {
            @Override
            public BaselineRecord compute(String tenantId, String datasetId,
                                          Function<Optional<BaselineRecord>, BaselineRecord> remapping) {
                throw new BaselineStoreException("RocksDB write failed for baseline " + tenantId + "/" + datasetId,
                        new IOException("disk full"));
            }
        };
        StatisticalDriftDetector failing = new StatisticalDriftDetector(failingStore, pool, 30, 0.1);

        DriftRunResult result = failing.evaluate(context(), List.of(
                MonitorSpec.schema("schema_check"),
                MonitorSpec.volume("rows", 3.0)), TestSnapshots.orders(100, 50), null);

        assertEquals(RunStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getTotalMonitors());
        assertNotNull(result.getCompletedAt());
        assertTrue(result.getError().startsWith("Baseline not persisted"), result.getError());
    }
}

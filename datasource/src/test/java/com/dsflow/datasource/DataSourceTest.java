package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.config.DataSourceConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DataSource single-worker Tests")
public class DataSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Three batches of 4 over 10 entities cover every id within one epoch")
    public void testEpochCoverage() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(10)
                .config(new DataSourceConfig().batchSize(4).seed(7L))
                .build()) {
            List<Integer> seen = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                Batch<double[], Integer> b = ds.next();
                assertEquals(4, b.size());
                seen.addAll(TestEntities.values(b));
            }
            assertEquals(12, seen.size());
            assertEquals(10, new HashSet<>(seen.subList(0, 10)).size());
            assertEquals(1, ds.getEpoch());
            assertEquals(1.0, ds.getMetrics().epochs());
            assertEquals(12.0, ds.getMetrics().accepted());
        }
    }

    @Test
    @DisplayName("Labels travel with their data")
    public void testLabelsAligned() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(9)
                .config(new DataSourceConfig().batchSize(9).convertBatchToDense(false))
                .build()) {
            Batch<double[], Integer> b = ds.next();
            for (int i = 0; i < b.size(); i++) {
                int v = (int) b.getData().get(i)[0];
                assertEquals(v % 3, b.getLabels().get(i));
            }
            assertFalse(b.isDense());
            assertThrows(IllegalStateException.class, b::getDenseData);
        }
    }

    @Test
    @DisplayName("Dense conversion yields numeric matrices")
    public void testDenseConversion() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(5)
                .config(new DataSourceConfig().batchSize(3))
                .build()) {
            Batch<double[], Integer> b = ds.next();
            assertTrue(b.isDense());
            double[][] x = b.getDenseData();
            double[][] y = b.getDenseLabels();
            assertEquals(3, x.length);
            for (int i = 0; i < 3; i++) {
                assertEquals(2, x[i].length);
                assertEquals(2 * x[i][0], x[i][1]);
                assertEquals(x[i][0] % 3, y[i][0]);
            }
        }
    }

    @Test
    @DisplayName("Controllers filter and transform samples")
    public void testControllers() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(20)
                .controller(Controller.filter(s -> s.getLabel() == 0))
                .controller(Controller.map(s -> s.withLabel(s.getLabel() + 100)))
                .config(new DataSourceConfig().batchSize(10))
                .build()) {
            Batch<double[], Integer> b = ds.next();
            assertEquals(10, b.size());
            for (int i = 0; i < b.size(); i++) {
                assertEquals(0, (int) b.getData().get(i)[0] % 3);
                assertEquals(100, b.getLabels().get(i));
            }
            assertTrue(ds.getMetrics().rejected() > 0);
        }
    }

    @Test
    @DisplayName("Failing samples are dropped, never surfaced")
    public void testExceptionsSwallowed() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(10)
                .controller(s -> {
                    if (((int) s.getData()[0]) % 2 == 1) throw new IllegalStateException("odd");
                    return ControllerResult.accept();
                })
                .config(new DataSourceConfig().batchSize(6))
                .build()) {
            Batch<double[], Integer> b = ds.next();
            assertEquals(6, b.size());
            for (int v : TestEntities.values(b)) {
                assertEquals(0, v % 2);
            }
            assertTrue(ds.getMetrics().failed() > 0);
        }
    }

    @Test
    @DisplayName("A controller that rejects everything stalls with a bounded error")
    public void testStall() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(3)
                .controller(s -> ControllerResult.reject())
                .config(new DataSourceConfig().batchSize(2).maxRejectedAttempts(50))
                .build()) {
            BatchStallException ex = assertThrows(BatchStallException.class, ds::next);
            assertEquals(0, ex.getCollected());
            assertEquals(2, ex.getRequested());
            assertEquals(50.0, ds.getMetrics().rejected());
        }
    }

    @Test
    @DisplayName("next(n) overrides the batch size once")
    public void testNextOverride() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(4)
                .config(new DataSourceConfig().batchSize(2))
                .build()) {
            assertEquals(7, ds.next(7).size());
            assertEquals(2, ds.next().size());
            assertThrows(IllegalArgumentException.class, () -> ds.next(0));
        }
    }

    @Test
    @DisplayName("Without a retrieval there is a single synthetic entity")
    public void testSyntheticEntity() throws Exception {
        try (DataSource<double[], Integer> ds = DataSource.builder(TestEntities.FACTORY)
                .config(new DataSourceConfig().batchSize(3))
                .build()) {
            assertEquals(1, ds.size());
            assertEquals(List.of("0"), ds.getEntityIds());
            assertEquals(List.of(0, 0, 0), TestEntities.values(ds.next()));
        }
    }

    @Test
    @DisplayName("Prefilters run in order and may not empty the source")
    public void testPrefilters() throws Exception {
        List<String> order = new ArrayList<>();
        try (DataSource<double[], Integer> ds = TestEntities.builder(30)
                .prefilter(e -> { order.add("a"); return e.getLabel() != 2; })
                .prefilter(e -> { order.add("b"); return Integer.parseInt(e.getUniqueId()) < 15; })
                .build()) {
            assertEquals(10, ds.size());
            assertEquals(30, Collections.frequency(order, "a"));
            assertEquals(20, Collections.frequency(order, "b"));
            assertEquals("a", order.get(0));
            assertEquals("b", order.get(order.size() - 1));
        }

        assertThrows(IllegalStateException.class, () -> TestEntities.builder(5)
                .prefilter(e -> false)
                .build());
        assertThrows(IllegalArgumentException.class, () -> TestEntities.builder(5).prefilters(null));
    }

    @Test
    @DisplayName("Invalid configuration is rejected at build time")
    public void testInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> TestEntities.builder(5)
                .config(new DataSourceConfig().batchSize(0)).build());
        assertThrows(IllegalArgumentException.class, () -> TestEntities.builder(5)
                .config(new DataSourceConfig().queueSize(10)).build());
        assertThrows(IllegalArgumentException.class, () -> DataSource.builder(null));
    }

    @Test
    @DisplayName("saveIds then filterIds restricts the source to the saved ids")
    public void testSaveAndFilterIds() throws Exception {
        Path ids = tempDir.resolve("ids.txt");
        try (DataSource<double[], Integer> small = TestEntities.builder(20)
                .prefilter(e -> Integer.parseInt(e.getUniqueId()) >= 12)
                .build()) {
            small.saveIds(ids);
        }
        String text = Files.readString(ids, StandardCharsets.UTF_8);
        assertFalse(text.endsWith("\n"));
        assertEquals(8, text.split("\n").length);

        try (DataSource<double[], Integer> ds = TestEntities.builder(20)
                .config(new DataSourceConfig().batchSize(16))
                .build()) {
            ds.filterIds(ids);
            assertEquals(8, ds.size());
            for (int v : TestEntities.values(ds.next())) {
                assertTrue(v >= 12);
            }
        }
    }

    @Test
    @DisplayName("filterIds rejects a result that would be empty and leaves the source untouched")
    public void testFilterIdsEmpty() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(5).build()) {
            assertThrows(IllegalStateException.class, () -> ds.filterIds(List.of("nope")));
            assertEquals(5, ds.size());
        }
    }

    @Test
    @DisplayName("Slow samples time out and are counted as rejections")
    public void testSampleTimeout() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(6)
                .controller(s -> {
                    if (((int) s.getData()[0]) == 0) Thread.sleep(10_000);
                    return ControllerResult.accept();
                })
                .config(new DataSourceConfig().batchSize(12).timeoutMs(100L))
                .build()) {
            List<Integer> values = TestEntities.values(ds.next());
            assertFalse(values.contains(0));
            assertTrue(ds.getMetrics().timedOut() >= 1);
        }
    }

    @Test
    @DisplayName("Raw data is evicted under memory pressure")
    public void testMemoryPressureEviction() throws Exception {
        try (DataSource<double[], Integer> ds = TestEntities.builder(4)
                .memoryMonitor(() -> 0.99)
                .config(new DataSourceConfig().batchSize(4).maxMemPercent(0.5))
                .build()) {
            ds.next();
            assertEquals(4.0, ds.getMetrics().evictions());
            for (Entity<double[], Integer> e : ds.members()) {
                assertFalse(e.isDataLoaded());
            }
        }
    }

    @Test
    @DisplayName("Closed sources refuse further use")
    public void testClose() throws Exception {
        DataSource<double[], Integer> ds = TestEntities.builder(3).build();
        assertTrue(ds.hasNext());
        ds.close();
        ds.close();
        assertTrue(ds.isClosed());
        assertFalse(ds.hasNext());
        assertThrows(IllegalStateException.class, ds::next);
    }

    @Test
    @DisplayName("Unnamed sources sharing a registry keep separate metrics")
    public void testUnnamedSourcesHaveOwnMetrics() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (DataSource<double[], Integer> a = TestEntities.builder(3).meterRegistry(registry).build();
             DataSource<double[], Integer> b = TestEntities.builder(3).meterRegistry(registry).build()) {
            assertNotEquals(a.getName(), b.getName());
            a.next(5);
            assertEquals(5.0, a.getMetrics().accepted());
            assertEquals(0.0, b.getMetrics().accepted());
        }
    }

    @Test
    @DisplayName("Metrics are registered in the supplied registry under the source name")
    public void testMetricsRegistry() throws Exception {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        try (DataSource<double[], Integer> ds = TestEntities.builder(3)
                .meterRegistry(registry)
                .name("train")
                .config(new DataSourceConfig().batchSize(2))
                .build()) {
            ds.next();
            assertEquals(2.0, registry.get(PipelineMetrics.SAMPLES)
                    .tag("source", "train").tag("outcome", "accepted").counter().count());
            assertEquals(1, registry.get(PipelineMetrics.BATCH_DURATION).timer().count());
        }
    }
}

package com.dsflow.datasource;

import com.dsflow.common.Entity;
import com.dsflow.config.DataSourceConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Per-sample deadline Tests")
@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class SampleDeadlineTest {

    /** Blocks in loadData until released, swallowing interrupts like a hung remote read. */
    static final class StuckEntity extends Entity<double[], Integer> {
        private final transient AtomicBoolean release;

        StuckEntity(String id, AtomicBoolean release) {
            super(id);
            this.release = release;
        }

        @Override
        public Integer getLabel() {
            return 0;
        }

        @Override
        protected double[] loadData() {
            while (!release.get()) {
                try {
                    Thread.sleep(5);
                } catch (InterruptedException ignored) {
                    // deliberately deaf to cancellation
                }
            }
            return new double[]{Integer.parseInt(getUniqueId())};
        }
    }

    private static long liveThreads(String prefix) {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.isAlive() && t.getName().startsWith(prefix))
                .count();
    }

    private static long awaitNoThreads(String prefix) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (liveThreads(prefix) > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        return liveThreads(prefix);
    }

    private static DataSource.Builder<double[], Integer> stuck(int n, AtomicBoolean release) {
        return DataSource.<double[], Integer>builder((id, r, v) -> new StuckEntity(id, release))
                .retrieval(new TestEntities.RangeRetrieval(n));
    }

    @Test
    @DisplayName("Fetches that ignore interrupts hold at most one thread in single-worker mode")
    public void testSingleWorkerThreadBound() throws Exception {
        AtomicBoolean release = new AtomicBoolean();
        DataSource<double[], Integer> ds = stuck(5, release)
                .name("stuck1")
                .config(new DataSourceConfig().batchSize(2).timeoutMs(10L).maxRejectedAttempts(200))
                .build();
        try {
            assertThrows(BatchStallException.class, ds::next);
            assertEquals(1, liveThreads("dsflow-stuck1-sample-"));
            assertEquals(200.0, ds.getMetrics().timedOut());
            assertEquals(1.0, ds.getMetrics().abandoned());
        } finally {
            ds.close();
            release.set(true);
        }
        assertEquals(0, awaitNoThreads("dsflow-stuck1-sample-"));
    }

    @Test
    @DisplayName("Deadline threads never exceed the worker count")
    public void testMultiWorkerThreadBound() throws Exception {
        AtomicBoolean release = new AtomicBoolean();
        DataSource<double[], Integer> ds = stuck(8, release)
                .name("stuck2")
                .config(new DataSourceConfig().batchSize(2).workers(2).timeoutMs(10L).stallTimeoutMs(500))
                .build();
        try {
            assertThrows(BatchStallException.class, ds::next);
            assertTrue(liveThreads("dsflow-stuck2-sample-") <= 2);
            assertTrue(ds.getMetrics().abandoned() <= 2);
            assertTrue(ds.getMetrics().timedOut() > 2);
        } finally {
            ds.close();
            release.set(true);
        }
        assertEquals(0, awaitNoThreads("dsflow-stuck2-sample-"));
    }

    @Test
    @DisplayName("A released entity is submitted again once its task has returned")
    public void testResubmittedAfterRelease() throws Exception {
        AtomicBoolean release = new AtomicBoolean();
        try (DataSource<double[], Integer> ds = stuck(1, release)
                .name("stuck3")
                .config(new DataSourceConfig().batchSize(1).timeoutMs(20L).maxRejectedAttempts(5))
                .build()) {
            assertThrows(BatchStallException.class, ds::next);
            release.set(true);
            long deadline = System.currentTimeMillis() + 5_000;
            while (ds.processor().inFlight() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, ds.processor().inFlight());
            assertEquals(1, ds.next().size());
        }
    }
}

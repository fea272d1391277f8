package guraa.paintquality.analysis;

import guraa.paintquality.TestImages;
import guraa.paintquality.exception.AnalysisCancelledException;
import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.image.RasterImage;
import guraa.paintquality.model.AnalysisConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CellBatchRunnerTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final AnalysisConfig config = AnalysisConfig.builder().cellSize(10).batchSize(7).build();
    private final RasterImage before = TestImages.solid(100, 80, TestImages.gray(200));
    private final RasterImage after = TestImages.withPatch(100, 80, TestImages.gray(200),
            20, 20, 30, 30, TestImages.rgb(120, 80, 80));
    private final ImagePair pair = new ImagePair(before, after);
    private final Grid grid = AnalyzerFixtures.grid(before, config);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    @Test
    void pooledAndInlineMeasurementsAgree() throws AnalysisException {
        ColorAnalyzer analyzer = new ColorAnalyzer();

        List<ColorCellMeasurement> inline = new CellBatchRunner(null)
                .submit(analyzer, grid, pair, config, new AtomicBoolean()).await();
        List<ColorCellMeasurement> pooled = new CellBatchRunner(executor)
                .submit(analyzer, grid, pair, config, new AtomicBoolean()).await();

        assertEquals(grid.size(), pooled.size());
        assertEquals(inline, pooled);
    }

    @Test
    void failingCellBecomesNeutral() throws AnalysisException {
        ColorAnalyzer failing = new ColorAnalyzer() {
            @Override
            public ColorCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
                if (cell.getIndex() == 22) {
                    throw new IllegalStateException("boom");
                }
                return super.measure(cell, pair, config);
            }
        };

        List<ColorCellMeasurement> measurements = new CellBatchRunner(executor)
                .submit(failing, grid, pair, config, new AtomicBoolean()).await();

        assertEquals(0.0, measurements.get(22).getDeltaE());
        assertTrue(measurements.get(33).getDeltaE() > 0);
    }

    @Test
    void cancelledTokenStopsTheJob() {
        AtomicBoolean token = new AtomicBoolean(true);

        CellBatchRunner.MeasurementJob<ColorCellMeasurement> job = new CellBatchRunner(executor)
                .submit(new ColorAnalyzer(), grid, pair, config, token);

        assertThrows(AnalysisCancelledException.class, job::await);
    }

    @Test
    void abortedJobSkipsQueuedBatchesAndLeavesTokenAlone() throws Exception {
        ExecutorService single = Executors.newSingleThreadExecutor();
        CountDownLatch gate = new CountDownLatch(1);
        AtomicInteger measured = new AtomicInteger();
        ColorAnalyzer counting = new ColorAnalyzer() {
            @Override
            public ColorCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
                measured.incrementAndGet();
                return super.measure(cell, pair, config);
            }
        };
        AtomicBoolean token = new AtomicBoolean();
        try {
            single.execute(() -> {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            CellBatchRunner.MeasurementJob<ColorCellMeasurement> job = new CellBatchRunner(single)
                    .submit(counting, grid, pair, config, token);
            job.abort();
            gate.countDown();

            assertThrows(AnalysisCancelledException.class, job::await);
            assertEquals(0, measured.get());
            assertFalse(token.get());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void batchLargerThanGridIsOneBatch() throws AnalysisException {
        AnalysisConfig huge = config.toBuilder().batchSize(Integer.MAX_VALUE).build();

        List<ColorCellMeasurement> measurements = new CellBatchRunner(executor)
                .submit(new ColorAnalyzer(), grid, pair, huge, new AtomicBoolean()).await();

        assertEquals(grid.size(), measurements.size());
    }
}

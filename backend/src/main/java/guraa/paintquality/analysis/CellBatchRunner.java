package guraa.paintquality.analysis;

import guraa.paintquality.exception.AnalysisCancelledException;
import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.exception.InternalComputationException;
import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Schedules per-cell measurements in batches of cells.
 * <p>
 * Batch tasks never wait on other tasks, so jobs for several axes can share one bounded pool
 * without risk of starvation. Every measurement lands in its own cell-index slot, and callers
 * reduce the slots in index order, so scheduling never changes results.
 */
@Slf4j
public class CellBatchRunner {

    private final ExecutorService executor;

    /**
     * @param executor Pool for batch tasks, or null to measure on the calling thread
     */
    public CellBatchRunner(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Schedule every cell of the grid for one analyzer.
     *
     * @param analyzer The analyzer
     * @param grid The shared grid
     * @param pair The normalized images
     * @param config The analysis configuration
     * @param cancellationToken Checked before every batch
     * @param <M> The measurement type
     * @return A job whose measurements can be awaited
     */
    public <M> MeasurementJob<M> submit(CellAnalyzer<M, ?> analyzer, Grid grid, ImagePair pair,
                                        AnalysisConfig config, AtomicBoolean cancellationToken) {
        Object[] slots = new Object[grid.size()];
        AtomicBoolean aborted = new AtomicBoolean(false);
        List<CompletableFuture<Void>> batches = new ArrayList<>();
        int batchSize = config.getBatchSize();

        for (int start = 0; start < grid.size(); start += Math.min(batchSize, grid.size() - start)) {
            int from = start;
            int to = from + Math.min(batchSize, grid.size() - from);
            Runnable batch = () -> measureBatch(analyzer, grid, pair, config, cancellationToken, aborted,
                    slots, from, to);
            if (executor == null) {
                batch.run();
                batches.add(CompletableFuture.completedFuture(null));
            } else {
                batches.add(CompletableFuture.runAsync(batch, executor));
            }
        }

        log.debug("Scheduled {} batch(es) of up to {} cells for the {} axis", batches.size(), batchSize, analyzer.axis());
        return new MeasurementJob<>(analyzer, slots, batches, cancellationToken, aborted);
    }

    private <M> void measureBatch(CellAnalyzer<M, ?> analyzer, Grid grid, ImagePair pair, AnalysisConfig config,
                                  AtomicBoolean cancellationToken, AtomicBoolean aborted,
                                  Object[] slots, int from, int to) {
        if (cancellationToken.get() || aborted.get()) {
            return;
        }
        for (int i = from; i < to; i++) {
            Cell cell = grid.cell(i);
            try {
                slots[i] = analyzer.measure(cell, pair, config);
            } catch (RuntimeException e) {
                log.warn("{} axis could not measure cell ({}, {}), treating it as unchanged: {}",
                        analyzer.axis(), cell.getRow(), cell.getCol(), e.toString());
                slots[i] = analyzer.neutral(cell);
            }
        }
    }

    /**
     * Pending measurements of one axis.
     *
     * @param <M> The measurement type
     */
    public static final class MeasurementJob<M> {

        private final CellAnalyzer<M, ?> analyzer;
        private final Object[] slots;
        private final List<CompletableFuture<Void>> batches;
        private final AtomicBoolean cancellationToken;
        private final AtomicBoolean aborted;

        private MeasurementJob(CellAnalyzer<M, ?> analyzer, Object[] slots, List<CompletableFuture<Void>> batches,
                               AtomicBoolean cancellationToken, AtomicBoolean aborted) {
            this.analyzer = analyzer;
            this.slots = slots;
            this.batches = batches;
            this.cancellationToken = cancellationToken;
            this.aborted = aborted;
        }

        /**
         * Stop this job without touching the caller's token. Batches that have not started return at once;
         * a later {@link #await()} reports the job as cancelled.
         */
        public void abort() {
            aborted.set(true);
        }

        /**
         * Wait for every batch and return the measurements in cell-index order.
         *
         * @return The measurements
         * @throws AnalysisException If the job was cancelled or a batch failed unexpectedly
         */
        @SuppressWarnings("unchecked")
        public List<M> await() throws AnalysisException {
            for (CompletableFuture<Void> batch : batches) {
                try {
                    batch.get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    cancellationToken.set(true);
                    throw new AnalysisCancelledException("Interrupted while waiting for the " + analyzer.axis() + " axis");
                } catch (ExecutionException e) {
                    throw new InternalComputationException(
                            "The " + analyzer.axis() + " axis failed: " + e.getCause(), e.getCause());
                }
            }

            if (cancellationToken.get()) {
                throw new AnalysisCancelledException("Analysis cancelled during the " + analyzer.axis() + " axis");
            }
            if (aborted.get()) {
                throw new AnalysisCancelledException("The " + analyzer.axis() + " axis was aborted");
            }

            List<Object> measurements = Arrays.asList(slots);
            if (measurements.contains(null)) {
                throw new InternalComputationException(
                        "The " + analyzer.axis() + " axis left cells unmeasured", null);
            }
            return Collections.unmodifiableList((List<M>) (List<?>) measurements);
        }
    }
}

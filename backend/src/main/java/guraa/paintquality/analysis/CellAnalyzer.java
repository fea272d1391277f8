package guraa.paintquality.analysis;

import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;

import java.util.List;

/**
 * One measurement axis, split into an embarrassingly parallel per-cell step and a sequential reduction.
 * Implementations are stateless and safe to call from several threads at once.
 *
 * @param <M> The per-cell measurement type
 * @param <S> The global summary type
 */
public interface CellAnalyzer<M, S> {

    /**
     * @return The axis this analyzer measures
     */
    Axis axis();

    /**
     * Measure one cell of the pair. Must only read the images.
     *
     * @param cell The cell
     * @param pair The normalized images
     * @param config The analysis configuration
     * @return The measurement
     */
    M measure(Cell cell, ImagePair pair, AnalysisConfig config);

    /**
     * A measurement that contributes nothing (zero delta), used when a cell cannot be measured.
     *
     * @param cell The cell
     * @return The neutral measurement
     */
    M neutral(Cell cell);

    /**
     * Reduce the per-cell measurements in cell-index order.
     *
     * @param grid The grid the measurements belong to
     * @param measurements Measurements indexed by cell index
     * @param config The analysis configuration
     * @return Normalized per-cell scores plus the global summary
     */
    AxisResult<S> summarize(Grid grid, List<M> measurements, AnalysisConfig config);
}

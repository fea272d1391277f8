package guraa.paintquality.grid;

import guraa.paintquality.model.AnalysisConfig;
import org.springframework.stereotype.Component;

/**
 * Computes the comparison grid for an image plane. Pure: equal inputs always give equal grids.
 */
@Component
public class GridPartitioner {

    /**
     * Partition a plane according to the configuration.
     * A positive {@code targetCellCount} takes precedence over the fixed {@code cellSize}.
     *
     * @param width The plane width
     * @param height The plane height
     * @param config The analysis configuration
     * @return The grid
     */
    public Grid partition(int width, int height, AnalysisConfig config) {
        return partition(width, height, resolveCellSize(width, height, config));
    }

    /**
     * Partition a plane with a fixed cell size.
     *
     * @param width The plane width
     * @param height The plane height
     * @param cellSize The cell edge length
     * @return The grid
     */
    public Grid partition(int width, int height, int cellSize) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Plane dimensions must be positive: " + width + "x" + height);
        }
        if (cellSize <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellSize);
        }
        return new Grid(width, height, cellSize);
    }

    int resolveCellSize(int width, int height, AnalysisConfig config) {
        if (config.getTargetCellCount() <= 0) {
            return config.getCellSize();
        }
        double areaPerCell = (double) width * height / config.getTargetCellCount();
        int derived = (int) Math.ceil(Math.sqrt(areaPerCell));
        return Math.max(config.getMinCellSize(), derived);
    }
}

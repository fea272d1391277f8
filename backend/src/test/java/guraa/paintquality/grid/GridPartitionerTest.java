package guraa.paintquality.grid;

import guraa.paintquality.model.AnalysisConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridPartitionerTest {

    private final GridPartitioner partitioner = new GridPartitioner();

    @Test
    void partition_exactMultiple() {
        Grid grid = partitioner.partition(400, 300, 50);
        assertEquals(6, grid.getRows());
        assertEquals(8, grid.getCols());
        assertEquals(48, grid.size());
        assertEquals(120_000, grid.totalArea());
    }

    @Test
    void partition_clipsLastRowAndColumn() {
        Grid grid = partitioner.partition(105, 47, 50);
        assertEquals(1, grid.getRows());
        assertEquals(3, grid.getCols());

        Cell last = grid.cell(0, 2);
        assertEquals(100, last.getX());
        assertEquals(5, last.getWidth());
        assertEquals(47, last.getHeight());
    }

    @Test
    void partition_cellsTileThePlaneExactly() {
        int[][] planes = {{1, 1}, {7, 3}, {50, 50}, {101, 99}, {640, 480}, {33, 257}};
        int[] sizes = {1, 3, 8, 50, 64, 1000, 1 << 30, Integer.MAX_VALUE};
        for (int[] plane : planes) {
            for (int size : sizes) {
                int w = plane[0];
                int h = plane[1];
                Grid grid = partitioner.partition(w, h, size);
                int[] coverage = new int[w * h];
                for (Cell cell : grid.getCells()) {
                    assertFalse(cell.isEmpty(), "empty cell for " + w + "x" + h + " / " + size);
                    for (int y = cell.getY(); y < cell.getY() + cell.getHeight(); y++) {
                        for (int x = cell.getX(); x < cell.getX() + cell.getWidth(); x++) {
                            coverage[y * w + x]++;
                        }
                    }
                }
                for (int count : coverage) {
                    assertEquals(1, count, "pixel covered " + count + " times for " + w + "x" + h + " / " + size);
                }
            }
        }
    }

    @Test
    void partition_cellLargerThanPlaneIsOneCell() {
        for (int size : new int[]{401, 100_000, Integer.MAX_VALUE - 1, Integer.MAX_VALUE}) {
            Grid grid = partitioner.partition(400, 300, size);

            assertEquals(1, grid.getRows(), "rows for cell size " + size);
            assertEquals(1, grid.getCols(), "cols for cell size " + size);
            Cell only = grid.cell(0);
            assertEquals(0, only.getX());
            assertEquals(0, only.getY());
            assertEquals(400, only.getWidth());
            assertEquals(300, only.getHeight());
            assertEquals(120_000, grid.totalArea());
        }
    }

    @Test
    void partition_indicesAreRowMajor() {
        Grid grid = partitioner.partition(200, 150, 50);
        for (int row = 0; row < grid.getRows(); row++) {
            for (int col = 0; col < grid.getCols(); col++) {
                Cell cell = grid.cell(row, col);
                assertEquals(row * grid.getCols() + col, cell.getIndex());
                assertSame(cell, grid.cell(cell.getIndex()));
            }
        }
    }

    @Test
    void resolveCellSize_fromTargetCount() {
        AnalysisConfig config = AnalysisConfig.builder().targetCellCount(48).build();
        assertEquals(50, partitioner.resolveCellSize(400, 300, config));
        assertEquals(48, partitioner.partition(400, 300, config).size());
    }

    @Test
    void resolveCellSize_respectsMinimum() {
        AnalysisConfig config = AnalysisConfig.builder().targetCellCount(1000).minCellSize(8).build();
        assertEquals(8, partitioner.resolveCellSize(40, 40, config));
    }

    @Test
    void resolveCellSize_fixedWhenNoTarget() {
        AnalysisConfig config = AnalysisConfig.builder().cellSize(32).build();
        assertEquals(32, partitioner.resolveCellSize(1000, 1000, config));
    }

    @Test
    void partition_rejectsInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> partitioner.partition(0, 10, 5));
        assertThrows(IllegalArgumentException.class, () -> partitioner.partition(10, 10, 0));
    }
}

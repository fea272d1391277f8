package guraa.paintquality.grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A partition of a width x height plane into rows x cols non-overlapping cells.
 * The same instance is shared read-only by every analyzer of one pipeline run, so a cell index
 * denotes the same physical region on every axis.
 */
public final class Grid {

    private final int width;
    private final int height;
    private final int cellSize;
    private final int rows;
    private final int cols;
    private final List<Cell> cells;

    Grid(int width, int height, int cellSize) {
        this.width = width;
        this.height = height;
        this.cellSize = cellSize;
        this.rows = (height - 1) / cellSize + 1;
        this.cols = (width - 1) / cellSize + 1;

        List<Cell> tiles = new ArrayList<>(rows * cols);
        for (int r = 0; r < rows; r++) {
            int y = r * cellSize;
            int h = Math.min(cellSize, height - y);
            for (int c = 0; c < cols; c++) {
                int x = c * cellSize;
                int w = Math.min(cellSize, width - x);
                tiles.add(new Cell(r * cols + c, r, c, x, y, w, h));
            }
        }
        this.cells = Collections.unmodifiableList(tiles);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getCellSize() {
        return cellSize;
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    /**
     * Get all cells in row-major order.
     *
     * @return An unmodifiable list of cells
     */
    public List<Cell> getCells() {
        return cells;
    }

    public int size() {
        return cells.size();
    }

    public Cell cell(int index) {
        return cells.get(index);
    }

    public Cell cell(int row, int col) {
        if (row < 0 || row >= rows || col < 0 || col >= cols) {
            throw new IndexOutOfBoundsException("No cell at (" + row + ", " + col + ") in a " + rows + "x" + cols + " grid");
        }
        return cells.get(row * cols + col);
    }

    public long totalArea() {
        return (long) width * height;
    }

    @Override
    public String toString() {
        return "Grid[" + width + "x" + height + ", cell " + cellSize + ", " + rows + "x" + cols + "]";
    }
}

package guraa.paintquality.grid;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One rectangular tile of a grid. {@code index} is the row-major position in the grid.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class Cell {
    private final int index;
    private final int row;
    private final int col;
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public long area() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }
}

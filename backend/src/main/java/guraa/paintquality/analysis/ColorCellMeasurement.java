package guraa.paintquality.analysis;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Color axis measurement of one cell.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ColorCellMeasurement {

    /**
     * Delta-E between the before and after mean colors.
     */
    private final double deltaE;

    private final long area;

    private final HsvSums before;

    private final HsvSums after;
}

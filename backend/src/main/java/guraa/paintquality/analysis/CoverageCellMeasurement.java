package guraa.paintquality.analysis;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Coverage axis measurement of one cell. Luminance values are in 0-255 units.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class CoverageCellMeasurement {
    private final double beforeMean;
    private final double afterMean;
    private final double absoluteChangeSum;
    private final double absoluteChangeSquares;
    private final long area;
    private final long edgesBoth;
    private final long edgesEither;

    /**
     * False for a cell that could not be measured; it is left out of the surface baseline.
     */
    private final boolean measured;

    /**
     * Signed change of mean luminance on a 0-1 scale.
     */
    public double delta() {
        return (afterMean - beforeMean) / 255.0;
    }
}

package guraa.paintquality.analysis;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Texture descriptors of one cell in both images.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TextureCellMeasurement {

    /**
     * Luminance standard deviation before, in 0-255 units.
     */
    private final double beforeStd;

    private final double afterStd;

    /**
     * Fraction of pixels whose gradient magnitude exceeds the edge threshold.
     */
    private final double beforeEdgeDensity;

    private final double afterEdgeDensity;

    /**
     * Combined normalized descriptor difference (0.0 to 1.0).
     */
    private final double difference;
}

package guraa.paintquality.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Global texture axis statistics.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TextureAnalysis {

    /**
     * One minus the mean normalized per-cell texture difference (0.0 to 1.0).
     */
    private final double textureConsistencyScore;

    /**
     * Mean absolute difference of per-cell luminance standard deviation, in 0-255 units.
     */
    private final double meanTextureDifference;

    /**
     * Standard deviation of the normalized per-cell texture difference.
     */
    private final double textureVarianceChange;
}

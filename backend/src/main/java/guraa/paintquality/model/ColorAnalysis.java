package guraa.paintquality.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Global color axis statistics. Differences are CIELAB delta-E values.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColorAnalysis {

    /**
     * Mean per-cell color difference.
     */
    private final double meanColorDifference;

    /**
     * Standard deviation of the per-cell color difference.
     */
    private final double stdColorDifference;

    /**
     * Largest per-cell color difference.
     */
    private final double maxColorDifference;

    /**
     * Percentage (0-100) of the image area whose cell difference exceeds the change threshold.
     */
    private final double changePercentage;

    private final ColorDistribution beforeColors;

    private final ColorDistribution afterColors;
}

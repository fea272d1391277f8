package guraa.paintquality.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Global coverage (intensity) axis statistics.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CoverageAnalysis {

    /**
     * Mean absolute luminance change per cell, in 0-255 units.
     */
    private final double meanIntensityChange;

    /**
     * Standard deviation of the absolute luminance change, in 0-255 units.
     */
    private final double stdIntensityChange;

    /**
     * Median signed luminance change of the surface (0-1 scale), the baseline cells are compared to.
     */
    private final double referenceIntensityDelta;

    /**
     * Percentage (0-100) of the image area classified as poor coverage.
     */
    private final double poorCoveragePercentage;

    /**
     * Percentage (0-100) of the image area classified as over application.
     */
    private final double overApplicationPercentage;

    /**
     * Intersection over union of edge pixels before and after (1.0 when neither image has edges).
     */
    private final double edgePreservationScore;
}

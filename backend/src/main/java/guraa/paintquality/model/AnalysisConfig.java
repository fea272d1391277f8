package guraa.paintquality.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable tuning for a single analysis call.
 * Every field has a default, so {@code AnalysisConfig.defaults()} is a complete configuration.
 * <p>
 * Fusion weights and the tie-break precedence (color, then coverage, then texture) are
 * heuristics rather than measured constants; they are exposed here so they can be tuned
 * per surface type.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder(toBuilder = true)
public class AnalysisConfig {

    // Grid

    /**
     * Edge length of a grid cell in pixels.
     */
    @Builder.Default
    private final int cellSize = 50;

    /**
     * When positive, the cell size is derived from the image area to yield roughly this many cells.
     */
    @Builder.Default
    private final int targetCellCount = 0;

    /**
     * Lower bound for a derived cell size.
     */
    @Builder.Default
    private final int minCellSize = 8;

    // Input limits

    @Builder.Default
    private final long maxUploadBytes = 20L * 1024 * 1024;

    @Builder.Default
    private final int minWidth = 32;

    @Builder.Default
    private final int minHeight = 32;

    /**
     * Maximum relative aspect-ratio difference that resampling is allowed to absorb.
     */
    @Builder.Default
    private final double aspectTolerance = 0.25;

    // Color axis

    @Builder.Default
    private final ColorDistanceMetric colorMetric = ColorDistanceMetric.CIE76;

    /**
     * Delta-E that maps to a normalized color score of 1.0.
     */
    @Builder.Default
    private final double colorDistanceScale = 50.0;

    /**
     * Delta-E above which a cell counts as changed for the change percentage.
     */
    @Builder.Default
    private final double changedThreshold = 10.0;

    // Coverage axis (luminance deviations on a 0-1 scale)

    @Builder.Default
    private final double coverageLowThreshold = 0.08;

    @Builder.Default
    private final double coverageHighThreshold = 0.08;

    /**
     * Absolute deviation that maps to a normalized coverage score of 1.0.
     */
    @Builder.Default
    private final double coverageScale = 0.5;

    // Texture axis

    /**
     * Sobel gradient magnitude above which a pixel counts as an edge.
     */
    @Builder.Default
    private final double edgeThreshold = 48.0;

    /**
     * Floor for the standard deviation used to normalize texture differences, in 0-255 units.
     */
    @Builder.Default
    private final double textureStdFloor = 4.0;

    // Detection

    @Builder.Default
    private final double colorWeight = 0.45;

    @Builder.Default
    private final double coverageWeight = 0.35;

    @Builder.Default
    private final double textureWeight = 0.20;

    /**
     * Fused severity above which a cell is flagged.
     */
    @Builder.Default
    private final double detectionThreshold = 0.3;

    /**
     * A region needs at least one axis whose peak member score exceeds its threshold.
     */
    @Builder.Default
    private final double colorThreshold = 0.25;

    @Builder.Default
    private final double coverageThreshold = 0.25;

    @Builder.Default
    private final double textureThreshold = 0.25;

    /**
     * Minimum pixel area of a reported region.
     */
    @Builder.Default
    private final long minRegionArea = 100;

    @Builder.Default
    private final SeverityAggregation severityAggregation = SeverityAggregation.MAX;

    // Scoring

    @Builder.Default
    private final double colorPenaltyWeight = 0.5;

    @Builder.Default
    private final double colorPenaltyCap = 30.0;

    @Builder.Default
    private final double coveragePenaltyWeight = 0.4;

    @Builder.Default
    private final double coveragePenaltyCap = 25.0;

    @Builder.Default
    private final double texturePenaltyWeight = 20.0;

    @Builder.Default
    private final double regionPenaltyWeight = 5.0;

    @Builder.Default
    private final double regionPenaltyCap = 20.0;

    /**
     * Pixel area that counts as one unit in the region penalty.
     */
    @Builder.Default
    private final double regionAreaUnit = 10_000.0;

    // Recommendation limits

    @Builder.Default
    private final double changePercentageLimit = 15.0;

    @Builder.Default
    private final double poorCoverageLimit = 20.0;

    @Builder.Default
    private final double textureConsistencyFloor = 0.7;

    @Builder.Default
    private final int maxRegions = 5;

    @Builder.Default
    private final int unevenCoverageRegionLimit = 3;

    // Execution

    /**
     * Number of cells measured per scheduled task.
     */
    @Builder.Default
    private final int batchSize = 64;

    /**
     * Get a configuration with every default applied.
     *
     * @return The default configuration
     */
    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }

    /**
     * Sum of the three fusion weights.
     *
     * @return The weight sum
     */
    public double totalWeight() {
        return colorWeight + coverageWeight + textureWeight;
    }

    /**
     * Get the fusion weight of an axis.
     *
     * @param axis The axis
     * @return The weight
     */
    public double weightOf(Axis axis) {
        switch (axis) {
            case COLOR:
                return colorWeight;
            case COVERAGE:
                return coverageWeight;
            default:
                return textureWeight;
        }
    }

    /**
     * Get the region confirmation threshold of an axis.
     *
     * @param axis The axis
     * @return The threshold
     */
    public double thresholdOf(Axis axis) {
        switch (axis) {
            case COLOR:
                return colorThreshold;
            case COVERAGE:
                return coverageThreshold;
            default:
                return textureThreshold;
        }
    }

    /**
     * Check the configuration for values the pipeline cannot work with.
     *
     * @return A list of problems, empty when the configuration is usable
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (cellSize <= 0) {
            problems.add("cellSize must be positive");
        }
        if (targetCellCount < 0) {
            problems.add("targetCellCount must not be negative");
        }
        if (minCellSize <= 0) {
            problems.add("minCellSize must be positive");
        }
        if (maxUploadBytes <= 0) {
            problems.add("maxUploadBytes must be positive");
        }
        if (minWidth <= 0 || minHeight <= 0) {
            problems.add("minimum dimensions must be positive");
        }
        if (aspectTolerance < 0) {
            problems.add("aspectTolerance must not be negative");
        }
        if (colorDistanceScale <= 0 || coverageScale <= 0) {
            problems.add("normalization scales must be positive");
        }
        if (colorWeight < 0 || coverageWeight < 0 || textureWeight < 0 || totalWeight() <= 0) {
            problems.add("fusion weights must be non-negative with a positive sum");
        }
        if (batchSize <= 0) {
            problems.add("batchSize must be positive");
        }
        return problems;
    }
}

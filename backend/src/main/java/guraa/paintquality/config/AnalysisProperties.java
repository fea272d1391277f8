package guraa.paintquality.config;

import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.ColorDistanceMetric;
import guraa.paintquality.model.SeverityAggregation;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Analysis tunables bound from {@code app.analysis.*}.
 * Unset properties keep the defaults of {@link AnalysisConfig}.
 */
@Component
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {

    private static final AnalysisConfig DEFAULTS = AnalysisConfig.defaults();

    private final Grid grid = new Grid();
    private final Limits limits = new Limits();
    private final ColorAxis color = new ColorAxis();
    private final CoverageAxis coverage = new CoverageAxis();
    private final TextureAxis texture = new TextureAxis();
    private final Detection detection = new Detection();
    private final Scoring scoring = new Scoring();
    private final Recommendations recommendations = new Recommendations();

    public Grid getGrid() {
        return grid;
    }

    public Limits getLimits() {
        return limits;
    }

    public ColorAxis getColor() {
        return color;
    }

    public CoverageAxis getCoverage() {
        return coverage;
    }

    public TextureAxis getTexture() {
        return texture;
    }

    public Detection getDetection() {
        return detection;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public Recommendations getRecommendations() {
        return recommendations;
    }

    /**
     * Build the per-call configuration from the bound properties.
     *
     * @return The analysis configuration
     */
    public AnalysisConfig toAnalysisConfig() {
        return AnalysisConfig.builder()
                .cellSize(grid.cellSize)
                .targetCellCount(grid.targetCellCount)
                .minCellSize(grid.minCellSize)
                .batchSize(grid.batchSize)
                .maxUploadBytes(limits.maxUploadBytes)
                .minWidth(limits.minWidth)
                .minHeight(limits.minHeight)
                .aspectTolerance(limits.aspectTolerance)
                .colorMetric(color.metric)
                .colorDistanceScale(color.distanceScale)
                .changedThreshold(color.changedThreshold)
                .coverageLowThreshold(coverage.lowThreshold)
                .coverageHighThreshold(coverage.highThreshold)
                .coverageScale(coverage.scale)
                .edgeThreshold(texture.edgeThreshold)
                .textureStdFloor(texture.stdFloor)
                .colorWeight(detection.colorWeight)
                .coverageWeight(detection.coverageWeight)
                .textureWeight(detection.textureWeight)
                .detectionThreshold(detection.threshold)
                .colorThreshold(detection.colorThreshold)
                .coverageThreshold(detection.coverageThreshold)
                .textureThreshold(detection.textureThreshold)
                .minRegionArea(detection.minRegionArea)
                .severityAggregation(detection.severityAggregation)
                .colorPenaltyWeight(scoring.colorPenaltyWeight)
                .colorPenaltyCap(scoring.colorPenaltyCap)
                .coveragePenaltyWeight(scoring.coveragePenaltyWeight)
                .coveragePenaltyCap(scoring.coveragePenaltyCap)
                .texturePenaltyWeight(scoring.texturePenaltyWeight)
                .regionPenaltyWeight(scoring.regionPenaltyWeight)
                .regionPenaltyCap(scoring.regionPenaltyCap)
                .regionAreaUnit(scoring.regionAreaUnit)
                .changePercentageLimit(recommendations.changePercentageLimit)
                .poorCoverageLimit(recommendations.poorCoverageLimit)
                .textureConsistencyFloor(recommendations.textureConsistencyFloor)
                .maxRegions(recommendations.maxRegions)
                .unevenCoverageRegionLimit(recommendations.unevenCoverageRegionLimit)
                .build();
    }

    /**
     * Grid and scheduling properties
     */
    @Getter
    @Setter
    public static class Grid {
        private int cellSize = DEFAULTS.getCellSize();
        private int targetCellCount = DEFAULTS.getTargetCellCount();
        private int minCellSize = DEFAULTS.getMinCellSize();
        private int batchSize = DEFAULTS.getBatchSize();
    }

    /**
     * Input limits
     */
    @Getter
    @Setter
    public static class Limits {
        private long maxUploadBytes = DEFAULTS.getMaxUploadBytes();
        private int minWidth = DEFAULTS.getMinWidth();
        private int minHeight = DEFAULTS.getMinHeight();
        private double aspectTolerance = DEFAULTS.getAspectTolerance();
    }

    /**
     * Color axis properties
     */
    @Getter
    @Setter
    public static class ColorAxis {
        private ColorDistanceMetric metric = DEFAULTS.getColorMetric();
        private double distanceScale = DEFAULTS.getColorDistanceScale();
        private double changedThreshold = DEFAULTS.getChangedThreshold();
    }

    /**
     * Coverage axis properties
     */
    @Getter
    @Setter
    public static class CoverageAxis {
        private double lowThreshold = DEFAULTS.getCoverageLowThreshold();
        private double highThreshold = DEFAULTS.getCoverageHighThreshold();
        private double scale = DEFAULTS.getCoverageScale();
    }

    /**
     * Texture axis properties
     */
    @Getter
    @Setter
    public static class TextureAxis {
        private double edgeThreshold = DEFAULTS.getEdgeThreshold();
        private double stdFloor = DEFAULTS.getTextureStdFloor();
    }

    /**
     * Fusion and region detection properties
     */
    @Getter
    @Setter
    public static class Detection {
        private double colorWeight = DEFAULTS.getColorWeight();
        private double coverageWeight = DEFAULTS.getCoverageWeight();
        private double textureWeight = DEFAULTS.getTextureWeight();
        private double threshold = DEFAULTS.getDetectionThreshold();
        private double colorThreshold = DEFAULTS.getColorThreshold();
        private double coverageThreshold = DEFAULTS.getCoverageThreshold();
        private double textureThreshold = DEFAULTS.getTextureThreshold();
        private long minRegionArea = DEFAULTS.getMinRegionArea();
        private SeverityAggregation severityAggregation = DEFAULTS.getSeverityAggregation();
    }

    /**
     * Score penalty properties
     */
    @Getter
    @Setter
    public static class Scoring {
        private double colorPenaltyWeight = DEFAULTS.getColorPenaltyWeight();
        private double colorPenaltyCap = DEFAULTS.getColorPenaltyCap();
        private double coveragePenaltyWeight = DEFAULTS.getCoveragePenaltyWeight();
        private double coveragePenaltyCap = DEFAULTS.getCoveragePenaltyCap();
        private double texturePenaltyWeight = DEFAULTS.getTexturePenaltyWeight();
        private double regionPenaltyWeight = DEFAULTS.getRegionPenaltyWeight();
        private double regionPenaltyCap = DEFAULTS.getRegionPenaltyCap();
        private double regionAreaUnit = DEFAULTS.getRegionAreaUnit();
    }

    /**
     * Recommendation rule limits
     */
    @Getter
    @Setter
    public static class Recommendations {
        private double changePercentageLimit = DEFAULTS.getChangePercentageLimit();
        private double poorCoverageLimit = DEFAULTS.getPoorCoverageLimit();
        private double textureConsistencyFloor = DEFAULTS.getTextureConsistencyFloor();
        private int maxRegions = DEFAULTS.getMaxRegions();
        private int unevenCoverageRegionLimit = DEFAULTS.getUnevenCoverageRegionLimit();
    }
}

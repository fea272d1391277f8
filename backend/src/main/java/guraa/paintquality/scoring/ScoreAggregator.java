package guraa.paintquality.scoring;

import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.ColorAnalysis;
import guraa.paintquality.model.CoverageAnalysis;
import guraa.paintquality.model.ProblemRegion;
import guraa.paintquality.model.TextureAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds the global axis statistics and the region population into a single 0-100 score.
 * The score starts at 100 and loses weighted, capped penalties per axis plus one for the regions.
 */
@Component
public class ScoreAggregator {

    /**
     * Compute the overall score.
     *
     * @param color Color summary
     * @param coverage Coverage summary
     * @param texture Texture summary
     * @param regions Detected regions
     * @param config The analysis configuration
     * @return The score in [0, 100]
     */
    public double score(ColorAnalysis color, CoverageAnalysis coverage, TextureAnalysis texture,
                        List<ProblemRegion> regions, AnalysisConfig config) {
        double score = 100.0;

        score -= Math.min(config.getColorPenaltyCap(),
                color.getChangePercentage() * config.getColorPenaltyWeight());
        score -= Math.min(config.getCoveragePenaltyCap(),
                coverage.getPoorCoveragePercentage() * config.getCoveragePenaltyWeight());
        score -= (1.0 - texture.getTextureConsistencyScore()) * config.getTexturePenaltyWeight();

        double regionPenalty = 0;
        for (ProblemRegion region : regions) {
            regionPenalty += region.getSeverity() * (region.getArea() / config.getRegionAreaUnit())
                    * config.getRegionPenaltyWeight();
        }
        score -= Math.min(config.getRegionPenaltyCap(), regionPenalty);

        return Math.max(0.0, Math.min(100.0, score));
    }
}

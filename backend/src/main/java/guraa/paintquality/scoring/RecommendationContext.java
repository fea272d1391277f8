package guraa.paintquality.scoring;

import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.ColorAnalysis;
import guraa.paintquality.model.CoverageAnalysis;
import guraa.paintquality.model.IssueType;
import guraa.paintquality.model.ProblemRegion;
import guraa.paintquality.model.TextureAnalysis;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Everything a recommendation rule may look at.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class RecommendationContext {
    private final ColorAnalysis color;
    private final CoverageAnalysis coverage;
    private final TextureAnalysis texture;
    private final List<ProblemRegion> regions;
    private final AnalysisConfig config;

    public long count(IssueType type) {
        return regions.stream().filter(region -> region.getIssueType() == type).count();
    }

    public boolean has(IssueType type) {
        return count(type) > 0;
    }
}

package guraa.paintquality.scoring;

import guraa.paintquality.model.IssueType;

import java.util.List;

/**
 * The default recommendation table. Declaration order is output order.
 */
public final class RecommendationRules {

    public static final String ALL_CLEAR = "Paint quality looks good overall!";

    private static final List<RecommendationRule> DEFAULTS = List.of(
            RecommendationRule.of("high-color-change",
                    ctx -> ctx.getColor().getChangePercentage() > ctx.getConfig().getChangePercentageLimit(),
                    "Consider applying additional coats for more uniform color coverage"),
            RecommendationRule.of("poor-coverage",
                    ctx -> ctx.getCoverage().getPoorCoveragePercentage() > ctx.getConfig().getPoorCoverageLimit(),
                    "Some areas show uneven paint application - consider touch-ups"),
            RecommendationRule.of("inconsistent-texture",
                    ctx -> ctx.getTexture().getTextureConsistencyScore() < ctx.getConfig().getTextureConsistencyFloor(),
                    "Paint texture appears inconsistent - check application technique"),
            RecommendationRule.of("many-regions",
                    ctx -> ctx.getRegions().size() > ctx.getConfig().getMaxRegions(),
                    "Multiple problem areas detected - comprehensive touch-up recommended"),
            RecommendationRule.of("recurring-uneven-coverage",
                    ctx -> ctx.count(IssueType.UNEVEN_COVERAGE) > ctx.getConfig().getUnevenCoverageRegionLimit(),
                    "Uneven coverage recurs across the surface - apply a full additional coat"),
            RecommendationRule.of("uneven-coverage",
                    ctx -> ctx.has(IssueType.UNEVEN_COVERAGE),
                    "Apply paint more evenly to avoid streaking and patchy areas"),
            RecommendationRule.of("over-application",
                    ctx -> ctx.has(IssueType.OVER_APPLICATION),
                    "Reduce paint thickness to avoid drips and texture issues"),
            RecommendationRule.of("color-inconsistency",
                    ctx -> ctx.has(IssueType.COLOR_INCONSISTENCY),
                    "Check highlighted areas for color mismatch between paint batches and re-coat them"),
            RecommendationRule.of("texture-variation",
                    ctx -> ctx.has(IssueType.TEXTURE_VARIATION),
                    "Smooth out brush or roller marks in the highlighted areas")
    );

    private RecommendationRules() {
    }

    public static List<RecommendationRule> defaults() {
        return DEFAULTS;
    }
}

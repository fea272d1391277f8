package guraa.paintquality.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * The terminal artifact of one analysis run.
 * This is the only value handed to the report layer and to whatever stores analysis history;
 * it is immutable once built.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnalysisResult {

    /**
     * The status of the analysis.
     */
    private final AnalysisStatus status;

    /**
     * The overall quality score (0 to 100).
     */
    private final double overallScore;

    /**
     * The number of problem regions.
     */
    private final int issuesDetected;

    /**
     * Width of the normalized image plane the regions refer to.
     */
    private final int imageWidth;

    /**
     * Height of the normalized image plane the regions refer to.
     */
    private final int imageHeight;

    private final ColorAnalysis colorAnalysis;

    private final CoverageAnalysis coverageAnalysis;

    private final TextureAnalysis textureAnalysis;

    /**
     * Problem regions, most severe first.
     */
    @Singular
    private final List<ProblemRegion> problemRegions;

    /**
     * Recommendations in rule-table order.
     */
    @Singular
    private final List<String> recommendations;

    /**
     * Wall-clock duration of the analysis in seconds.
     */
    private final double processingDuration;

    /**
     * The error kind, if the analysis did not complete.
     */
    private final AnalysisErrorKind errorKind;

    /**
     * A human-readable error message, if the analysis did not complete.
     */
    private final String errorMessage;

    /**
     * Create a result for an analysis that did not complete.
     *
     * @param kind The error kind
     * @param message The error message
     * @param processingDuration Seconds spent before the failure
     * @return A failed or cancelled result
     */
    public static AnalysisResult failure(AnalysisErrorKind kind, String message, double processingDuration) {
        return AnalysisResult.builder()
                .status(kind == AnalysisErrorKind.CANCELLED ? AnalysisStatus.CANCELLED : AnalysisStatus.FAILED)
                .errorKind(kind)
                .errorMessage(message)
                .processingDuration(processingDuration)
                .build();
    }

    /**
     * Check whether the analysis completed.
     *
     * @return true if the status is COMPLETED
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return status == AnalysisStatus.COMPLETED;
    }
}

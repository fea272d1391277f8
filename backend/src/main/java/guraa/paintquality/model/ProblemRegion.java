package guraa.paintquality.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A reportable cluster of adjacent flagged grid cells.
 * Coordinates are in pixels of the normalized (before) image plane.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProblemRegion {

    /**
     * The x-coordinate of the bounding box.
     */
    private final int x;

    /**
     * The y-coordinate of the bounding box.
     */
    private final int y;

    /**
     * The width of the bounding box.
     */
    private final int width;

    /**
     * The height of the bounding box.
     */
    private final int height;

    /**
     * The pixel area covered by the member cells.
     */
    private final long area;

    /**
     * The number of grid cells merged into this region.
     */
    private final int cellCount;

    /**
     * The severity of the region (0.0 to 1.0).
     */
    private final double severity;

    /**
     * How consistently member cells agree on the dominant axis (0.0 to 1.0).
     */
    private final double confidence;

    /**
     * The classified issue type.
     */
    private final IssueType issueType;

    /**
     * Check whether the bounding box lies inside a plane of the given size.
     *
     * @param planeWidth The plane width
     * @param planeHeight The plane height
     * @return true if the region is fully contained
     */
    @JsonIgnore
    public boolean isWithin(int planeWidth, int planeHeight) {
        return x >= 0 && y >= 0 && width > 0 && height > 0
                && x + width <= planeWidth && y + height <= planeHeight;
    }
}

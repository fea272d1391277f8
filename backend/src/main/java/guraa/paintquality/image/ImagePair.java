package guraa.paintquality.image;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A before/after pair brought to identical dimensions.
 */
@Getter
@ToString
@EqualsAndHashCode
public class ImagePair {

    private final RasterImage before;

    private final RasterImage after;

    public ImagePair(RasterImage before, RasterImage after) {
        if (!before.sameSizeAs(after)) {
            throw new IllegalArgumentException("Normalized images must have identical dimensions: "
                    + before + " vs " + after);
        }
        this.before = before;
        this.after = after;
    }

    public int getWidth() {
        return before.getWidth();
    }

    public int getHeight() {
        return before.getHeight();
    }
}

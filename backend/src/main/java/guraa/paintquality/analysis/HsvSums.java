package guraa.paintquality.analysis;

import guraa.paintquality.model.ColorDistribution;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Running HSV sums for one image, combinable across cells.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class HsvSums {

    public static final HsvSums ZERO = new HsvSums(0, 0, 0, 0, 0);

    private final double hue;
    private final double hueSquares;
    private final double saturation;
    private final double value;
    private final long count;

    public HsvSums plus(HsvSums other) {
        return new HsvSums(hue + other.hue, hueSquares + other.hueSquares,
                saturation + other.saturation, value + other.value, count + other.count);
    }

    public ColorDistribution toDistribution() {
        if (count == 0) {
            return ColorDistribution.builder().build();
        }
        double meanHue = hue / count;
        double hueVariance = Math.max(0.0, hueSquares / count - meanHue * meanHue);
        return ColorDistribution.builder()
                .meanHue(meanHue)
                .meanSaturation(saturation / count)
                .meanValue(value / count)
                .hueStd(Math.sqrt(hueVariance))
                .build();
    }
}

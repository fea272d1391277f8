package guraa.paintquality.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * HSV color statistics of one image. Hue is in degrees, saturation and value in [0, 1].
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ColorDistribution {
    private final double meanHue;
    private final double meanSaturation;
    private final double meanValue;
    private final double hueStd;
}

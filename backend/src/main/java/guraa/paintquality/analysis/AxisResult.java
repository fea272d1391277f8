package guraa.paintquality.analysis;

import guraa.paintquality.model.Axis;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of one analyzer run: normalized per-cell scores and the global summary.
 *
 * @param <S> The summary type
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class AxisResult<S> {
    private final Axis axis;
    private final CellMetrics metrics;
    private final S summary;
}

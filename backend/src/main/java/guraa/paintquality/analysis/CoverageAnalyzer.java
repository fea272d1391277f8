package guraa.paintquality.analysis;

import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;
import guraa.paintquality.model.CoverageAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Measures how much paint changed the brightness of each cell relative to the surface as a whole.
 * <p>
 * The surface baseline is the median signed luminance change over all cells. A cell whose change
 * falls more than {@code coverageLowThreshold} below the baseline is poor coverage; one that rises
 * more than {@code coverageHighThreshold} above it is over application.
 */
@Slf4j
@Component
public class CoverageAnalyzer implements CellAnalyzer<CoverageCellMeasurement, CoverageAnalysis> {

    @Override
    public Axis axis() {
        return Axis.COVERAGE;
    }

    @Override
    public CoverageCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
        if (cell.isEmpty()) {
            return neutral(cell);
        }

        int w = cell.getWidth();
        int h = cell.getHeight();
        double[] before = CellPixels.luminance(pair.getBefore(), cell);
        double[] after = CellPixels.luminance(pair.getAfter(), cell);
        double[] beforeEdges = CellPixels.sobelMagnitudes(before, w, h);
        double[] afterEdges = CellPixels.sobelMagnitudes(after, w, h);

        double absoluteSum = 0;
        double absoluteSquares = 0;
        long both = 0;
        long either = 0;
        for (int i = 0; i < before.length; i++) {
            double change = Math.abs(after[i] - before[i]);
            absoluteSum += change;
            absoluteSquares += change * change;

            boolean edgeBefore = beforeEdges[i] > config.getEdgeThreshold();
            boolean edgeAfter = afterEdges[i] > config.getEdgeThreshold();
            if (edgeBefore && edgeAfter) {
                both++;
            }
            if (edgeBefore || edgeAfter) {
                either++;
            }
        }

        return new CoverageCellMeasurement(CellPixels.mean(before), CellPixels.mean(after),
                absoluteSum, absoluteSquares, cell.area(), both, either, true);
    }

    @Override
    public CoverageCellMeasurement neutral(Cell cell) {
        return new CoverageCellMeasurement(0, 0, 0, 0, cell.area(), 0, 0, false);
    }

    @Override
    public AxisResult<CoverageAnalysis> summarize(Grid grid, List<CoverageCellMeasurement> measurements,
                                                  AnalysisConfig config) {
        int n = measurements.size();
        double[] measuredDeltas = new double[n];
        int measuredCount = 0;
        for (CoverageCellMeasurement m : measurements) {
            if (m.isMeasured()) {
                measuredDeltas[measuredCount++] = m.delta();
            }
        }
        double reference = median(Arrays.copyOf(measuredDeltas, measuredCount));

        double[] scores = new double[n];
        double[] deviations = new double[n];
        long totalArea = 0;
        long poorArea = 0;
        long overArea = 0;
        double absoluteSum = 0;
        double absoluteSquares = 0;
        long both = 0;
        long either = 0;

        for (int i = 0; i < n; i++) {
            CoverageCellMeasurement m = measurements.get(i);
            double deviation = m.isMeasured() ? m.delta() - reference : 0.0;
            deviations[i] = deviation;
            scores[i] = Math.abs(deviation) / config.getCoverageScale();

            totalArea += m.getArea();
            if (deviation < -config.getCoverageLowThreshold()) {
                poorArea += m.getArea();
            } else if (deviation > config.getCoverageHighThreshold()) {
                overArea += m.getArea();
            }
            absoluteSum += m.getAbsoluteChangeSum();
            absoluteSquares += m.getAbsoluteChangeSquares();
            both += m.getEdgesBoth();
            either += m.getEdgesEither();
        }

        double meanChange = totalArea == 0 ? 0.0 : absoluteSum / totalArea;
        double variance = totalArea == 0 ? 0.0 : Math.max(0.0, absoluteSquares / totalArea - meanChange * meanChange);

        CoverageAnalysis summary = CoverageAnalysis.builder()
                .meanIntensityChange(meanChange)
                .stdIntensityChange(Math.sqrt(variance))
                .referenceIntensityDelta(reference)
                .poorCoveragePercentage(percentage(poorArea, totalArea))
                .overApplicationPercentage(percentage(overArea, totalArea))
                .edgePreservationScore(either == 0 ? 1.0 : (double) both / either)
                .build();

        log.debug("Coverage axis over {}: reference delta {}, poor {}%, over {}%", grid, reference,
                summary.getPoorCoveragePercentage(), summary.getOverApplicationPercentage());
        return new AxisResult<>(Axis.COVERAGE, CellMetrics.of(scores, deviations), summary);
    }

    private static double percentage(long part, long total) {
        return total == 0 ? 0.0 : 100.0 * part / total;
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}

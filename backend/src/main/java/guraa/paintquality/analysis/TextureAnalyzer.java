package guraa.paintquality.analysis;

import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;
import guraa.paintquality.model.TextureAnalysis;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Compares local texture of each cell: luminance dispersion and edge density.
 * Brush marks and roller stippling show up here while leaving cell means untouched.
 */
@Slf4j
@Component
public class TextureAnalyzer implements CellAnalyzer<TextureCellMeasurement, TextureAnalysis> {

    @Override
    public Axis axis() {
        return Axis.TEXTURE;
    }

    @Override
    public TextureCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
        if (cell.isEmpty()) {
            return neutral(cell);
        }

        int w = cell.getWidth();
        int h = cell.getHeight();
        double[] before = CellPixels.luminance(pair.getBefore(), cell);
        double[] after = CellPixels.luminance(pair.getAfter(), cell);

        double beforeStd = CellPixels.std(before, CellPixels.mean(before));
        double afterStd = CellPixels.std(after, CellPixels.mean(after));

        double pixels = before.length;
        double beforeEdges = CellPixels.countAbove(CellPixels.sobelMagnitudes(before, w, h), config.getEdgeThreshold()) / pixels;
        double afterEdges = CellPixels.countAbove(CellPixels.sobelMagnitudes(after, w, h), config.getEdgeThreshold()) / pixels;

        double spread = Math.max(Math.max(beforeStd, afterStd), config.getTextureStdFloor());
        double stdDifference = Math.abs(afterStd - beforeStd) / spread;
        double edgeDifference = Math.abs(afterEdges - beforeEdges);
        double difference = Math.min(1.0, (stdDifference + edgeDifference) / 2.0);

        return new TextureCellMeasurement(beforeStd, afterStd, beforeEdges, afterEdges, difference);
    }

    @Override
    public TextureCellMeasurement neutral(Cell cell) {
        return new TextureCellMeasurement(0, 0, 0, 0, 0);
    }

    @Override
    public AxisResult<TextureAnalysis> summarize(Grid grid, List<TextureCellMeasurement> measurements,
                                                 AnalysisConfig config) {
        int n = measurements.size();
        double[] scores = new double[n];
        double differenceSum = 0;
        double rawSum = 0;
        for (int i = 0; i < n; i++) {
            TextureCellMeasurement m = measurements.get(i);
            scores[i] = m.getDifference();
            differenceSum += m.getDifference();
            rawSum += Math.abs(m.getAfterStd() - m.getBeforeStd());
        }

        double meanDifference = n == 0 ? 0.0 : differenceSum / n;
        double squares = 0;
        for (double score : scores) {
            double d = score - meanDifference;
            squares += d * d;
        }

        TextureAnalysis summary = TextureAnalysis.builder()
                .textureConsistencyScore(Math.max(0.0, Math.min(1.0, 1.0 - meanDifference)))
                .meanTextureDifference(n == 0 ? 0.0 : rawSum / n)
                .textureVarianceChange(n == 0 ? 0.0 : Math.sqrt(squares / n))
                .build();

        log.debug("Texture axis over {}: consistency {}", grid, summary.getTextureConsistencyScore());
        return new AxisResult<>(Axis.TEXTURE, CellMetrics.of(scores), summary);
    }
}

package guraa.paintquality.analysis;

import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.image.RasterImage;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;
import guraa.paintquality.model.ColorAnalysis;
import guraa.paintquality.model.ColorDistanceMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.util.List;

/**
 * Compares the mean color of each cell in CIELAB.
 */
@Slf4j
@Component
public class ColorAnalyzer implements CellAnalyzer<ColorCellMeasurement, ColorAnalysis> {

    @Override
    public Axis axis() {
        return Axis.COLOR;
    }

    @Override
    public ColorCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
        if (cell.isEmpty()) {
            return neutral(cell);
        }

        RasterImage before = pair.getBefore();
        RasterImage after = pair.getAfter();
        long[] beforeRgb = new long[3];
        long[] afterRgb = new long[3];
        double[] beforeHsv = new double[4];
        double[] afterHsv = new double[4];
        float[] hsb = new float[3];

        for (int y = cell.getY(); y < cell.getY() + cell.getHeight(); y++) {
            for (int x = cell.getX(); x < cell.getX() + cell.getWidth(); x++) {
                accumulate(before.rgb(x, y), beforeRgb, beforeHsv, hsb);
                accumulate(after.rgb(x, y), afterRgb, afterHsv, hsb);
            }
        }

        long n = cell.area();
        double[] beforeLab = ColorSpaceUtils.srgbToLab(
                (double) beforeRgb[0] / n, (double) beforeRgb[1] / n, (double) beforeRgb[2] / n);
        double[] afterLab = ColorSpaceUtils.srgbToLab(
                (double) afterRgb[0] / n, (double) afterRgb[1] / n, (double) afterRgb[2] / n);

        double deltaE = config.getColorMetric() == ColorDistanceMetric.CIEDE2000
                ? ColorSpaceUtils.ciede2000(beforeLab, afterLab)
                : ColorSpaceUtils.cie76(beforeLab, afterLab);

        return new ColorCellMeasurement(deltaE, n,
                new HsvSums(beforeHsv[0], beforeHsv[1], beforeHsv[2], beforeHsv[3], n),
                new HsvSums(afterHsv[0], afterHsv[1], afterHsv[2], afterHsv[3], n));
    }

    private void accumulate(int rgb, long[] rgbSums, double[] hsvSums, float[] hsb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        rgbSums[0] += r;
        rgbSums[1] += g;
        rgbSums[2] += b;

        Color.RGBtoHSB(r, g, b, hsb);
        double hue = hsb[0] * 360.0;
        hsvSums[0] += hue;
        hsvSums[1] += hue * hue;
        hsvSums[2] += hsb[1];
        hsvSums[3] += hsb[2];
    }

    @Override
    public ColorCellMeasurement neutral(Cell cell) {
        return new ColorCellMeasurement(0.0, cell.area(), HsvSums.ZERO, HsvSums.ZERO);
    }

    @Override
    public AxisResult<ColorAnalysis> summarize(Grid grid, List<ColorCellMeasurement> measurements,
                                               AnalysisConfig config) {
        int n = measurements.size();
        double[] scores = new double[n];
        double sum = 0;
        double max = 0;
        long changedArea = 0;
        long totalArea = 0;
        HsvSums before = HsvSums.ZERO;
        HsvSums after = HsvSums.ZERO;

        for (int i = 0; i < n; i++) {
            ColorCellMeasurement m = measurements.get(i);
            scores[i] = m.getDeltaE() / config.getColorDistanceScale();
            sum += m.getDeltaE();
            max = Math.max(max, m.getDeltaE());
            totalArea += m.getArea();
            if (m.getDeltaE() > config.getChangedThreshold()) {
                changedArea += m.getArea();
            }
            before = before.plus(m.getBefore());
            after = after.plus(m.getAfter());
        }

        double mean = n == 0 ? 0.0 : sum / n;
        double squares = 0;
        for (ColorCellMeasurement m : measurements) {
            double d = m.getDeltaE() - mean;
            squares += d * d;
        }
        double std = n == 0 ? 0.0 : Math.sqrt(squares / n);

        ColorAnalysis summary = ColorAnalysis.builder()
                .meanColorDifference(mean)
                .stdColorDifference(std)
                .maxColorDifference(max)
                .changePercentage(totalArea == 0 ? 0.0 : 100.0 * changedArea / totalArea)
                .beforeColors(before.toDistribution())
                .afterColors(after.toDistribution())
                .build();

        log.debug("Color axis over {}: mean dE {}, change {}%", grid, mean, summary.getChangePercentage());
        return new AxisResult<>(Axis.COLOR, CellMetrics.of(scores), summary);
    }
}

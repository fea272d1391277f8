package guraa.paintquality.analysis;

import guraa.paintquality.TestImages;
import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.RasterImage;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.ColorAnalysis;
import guraa.paintquality.model.ColorDistanceMetric;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColorAnalyzerTest {

    private final ColorAnalyzer analyzer = new ColorAnalyzer();
    private final AnalysisConfig config = AnalysisConfig.defaults();

    private final RasterImage before = TestImages.solid(400, 300, TestImages.gray(200));
    private final RasterImage after = TestImages.withPatch(400, 300, TestImages.gray(200),
            100, 100, 100, 100, TestImages.rgb(120, 80, 80));

    @Test
    void identicalImagesHaveNoColorChange() throws AnalysisException {
        AxisResult<ColorAnalysis> result = AnalyzerFixtures.run(analyzer, before, before, config);

        assertEquals(0.0, result.getSummary().getChangePercentage(), 1e-12);
        assertEquals(0.0, result.getSummary().getMaxColorDifference(), 1e-12);
        for (int i = 0; i < result.getMetrics().size(); i++) {
            assertEquals(0.0, result.getMetrics().score(i), 1e-12);
        }
    }

    @Test
    void patchIsLocalizedToItsCells() throws AnalysisException {
        AxisResult<ColorAnalysis> result = AnalyzerFixtures.run(analyzer, before, after, config);
        Grid grid = AnalyzerFixtures.grid(before, config);

        assertEquals(100.0 * 4 / 48, result.getSummary().getChangePercentage(), 1e-9);
        assertEquals(45.95, result.getSummary().getMaxColorDifference(), 0.5);
        assertEquals(0.919, result.getMetrics().score(grid.cell(2, 2).getIndex()), 0.01);
        assertEquals(0.919, result.getMetrics().score(grid.cell(3, 3).getIndex()), 0.01);
        assertEquals(0.0, result.getMetrics().score(grid.cell(0, 0).getIndex()), 1e-12);
        assertEquals(0.0, result.getMetrics().score(grid.cell(2, 4).getIndex()), 1e-12);
    }

    @Test
    void statisticsAreOverCells() throws AnalysisException {
        ColorAnalysis summary = AnalyzerFixtures.run(analyzer, before, after, config).getSummary();

        double dE = summary.getMaxColorDifference();
        double mean = dE * 4 / 48;
        assertEquals(mean, summary.getMeanColorDifference(), 1e-9);
        double variance = (4 * Math.pow(dE - mean, 2) + 44 * mean * mean) / 48;
        assertEquals(Math.sqrt(variance), summary.getStdColorDifference(), 1e-9);
    }

    @Test
    void ciede2000CanBeSelected() throws AnalysisException {
        AnalysisConfig de2000 = config.toBuilder().colorMetric(ColorDistanceMetric.CIEDE2000).build();

        double cie76 = AnalyzerFixtures.run(analyzer, before, after, config).getSummary().getMaxColorDifference();
        double ciede2000 = AnalyzerFixtures.run(analyzer, before, after, de2000).getSummary().getMaxColorDifference();

        assertTrue(ciede2000 > 0);
        assertNotEquals(cie76, ciede2000, 0.5);
    }

    @Test
    void colorDistributionsDescribeEachImage() throws AnalysisException {
        ColorAnalysis summary = AnalyzerFixtures.run(analyzer, before, after, config).getSummary();

        assertEquals(0.0, summary.getBeforeColors().getMeanSaturation(), 1e-9);
        assertTrue(summary.getAfterColors().getMeanSaturation() > 0);
        assertTrue(summary.getAfterColors().getMeanValue() < summary.getBeforeColors().getMeanValue());
    }

    @Test
    void neutralMeasurementHasNoDifference() {
        Grid grid = AnalyzerFixtures.grid(before, config);
        assertEquals(0.0, analyzer.neutral(grid.cell(0)).getDeltaE());
    }
}

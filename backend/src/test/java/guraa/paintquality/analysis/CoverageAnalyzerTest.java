package guraa.paintquality.analysis;

import guraa.paintquality.TestImages;
import guraa.paintquality.exception.AnalysisException;
import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.image.ImagePair;
import guraa.paintquality.image.RasterImage;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.CoverageAnalysis;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoverageAnalyzerTest {

    private final CoverageAnalyzer analyzer = new CoverageAnalyzer();
    private final AnalysisConfig config = AnalysisConfig.defaults();
    private final RasterImage before = TestImages.solid(400, 300, TestImages.gray(200));

    @Test
    void median_oddAndEvenCounts() {
        assertEquals(2.0, CoverageAnalyzer.median(new double[]{3, 1, 2}));
        assertEquals(2.5, CoverageAnalyzer.median(new double[]{4, 1, 3, 2}));
        assertEquals(0.0, CoverageAnalyzer.median(new double[0]));
    }

    @Test
    void identicalImagesAreEvenlyCovered() throws AnalysisException {
        CoverageAnalysis summary = AnalyzerFixtures.run(analyzer, before, before, config).getSummary();

        assertEquals(0.0, summary.getPoorCoveragePercentage());
        assertEquals(0.0, summary.getOverApplicationPercentage());
        assertEquals(0.0, summary.getMeanIntensityChange(), 1e-12);
        assertEquals(1.0, summary.getEdgePreservationScore());
    }

    @Test
    void uniformRepaintIsTheBaselineNotAProblem() throws AnalysisException {
        RasterImage after = TestImages.solid(400, 300, TestImages.gray(120));

        AxisResult<CoverageAnalysis> result = AnalyzerFixtures.run(analyzer, before, after, config);

        assertEquals(-80.0 / 255, result.getSummary().getReferenceIntensityDelta(), 1e-9);
        assertEquals(0.0, result.getSummary().getPoorCoveragePercentage());
        assertEquals(80.0, result.getSummary().getMeanIntensityChange(), 1e-6);
        assertEquals(0.0, result.getSummary().getStdIntensityChange(), 1e-3);
        assertEquals(0.0, result.getMetrics().score(0), 1e-9);
    }

    @Test
    void unmeasurableCellStaysOutOfTheBaseline() throws AnalysisException {
        CoverageAnalyzer failing = new CoverageAnalyzer() {
            @Override
            public CoverageCellMeasurement measure(Cell cell, ImagePair pair, AnalysisConfig config) {
                if (cell.getIndex() == 5) {
                    throw new IllegalStateException("unreadable cell");
                }
                return super.measure(cell, pair, config);
            }
        };
        RasterImage after = TestImages.solid(400, 300, TestImages.gray(150));

        AxisResult<CoverageAnalysis> result = AnalyzerFixtures.run(failing, before, after, config);

        assertEquals(-50.0 / 255, result.getSummary().getReferenceIntensityDelta(), 1e-9);
        assertEquals(0.0, result.getSummary().getPoorCoveragePercentage());
        assertEquals(0.0, result.getSummary().getOverApplicationPercentage());
        assertEquals(0.0, result.getMetrics().score(5));
        assertEquals(0.0, result.getMetrics().signed(5));
    }

    @Test
    void baselineOfUnmeasurableSurfaceIsZero() {
        Grid grid = AnalyzerFixtures.grid(before, config);
        List<CoverageCellMeasurement> nothing = new ArrayList<>();
        for (Cell cell : grid.getCells()) {
            nothing.add(analyzer.neutral(cell));
        }

        AxisResult<CoverageAnalysis> result = analyzer.summarize(grid, nothing, config);

        assertEquals(0.0, result.getSummary().getReferenceIntensityDelta());
        assertEquals(0.0, result.getSummary().getPoorCoveragePercentage());
    }

    @Test
    void cellChangedLessThanSurfaceIsPoorCoverage() throws AnalysisException {
        RasterImage after = TestImages.withPatch(400, 300, TestImages.gray(200),
                100, 100, 100, 100, TestImages.gray(100));

        AxisResult<CoverageAnalysis> result = AnalyzerFixtures.run(analyzer, before, after, config);
        Grid grid = AnalyzerFixtures.grid(before, config);
        int patchCell = grid.cell(2, 2).getIndex();

        assertEquals(100.0 * 4 / 48, result.getSummary().getPoorCoveragePercentage(), 1e-9);
        assertEquals(0.0, result.getSummary().getOverApplicationPercentage());
        assertTrue(result.getMetrics().signed(patchCell) < 0);
        assertEquals((100.0 / 255) / 0.5, result.getMetrics().score(patchCell), 1e-9);
    }

    @Test
    void cellChangedMoreThanSurfaceIsOverApplication() throws AnalysisException {
        RasterImage after = TestImages.withPatch(400, 300, TestImages.gray(200),
                100, 100, 100, 100, TestImages.gray(250));

        AxisResult<CoverageAnalysis> result = AnalyzerFixtures.run(analyzer, before, after, config);

        assertEquals(100.0 * 4 / 48, result.getSummary().getOverApplicationPercentage(), 1e-9);
        assertEquals(0.0, result.getSummary().getPoorCoveragePercentage());
    }

    @Test
    void lostEdgesLowerEdgePreservation() throws AnalysisException {
        RasterImage striped = TestImages.withStripes(400, 300, TestImages.gray(60),
                0, 0, 400, 300, TestImages.gray(220), 4);
        RasterImage flat = TestImages.solid(400, 300, TestImages.gray(140));

        assertEquals(1.0, AnalyzerFixtures.run(analyzer, striped, striped, config)
                .getSummary().getEdgePreservationScore(), 1e-12);
        assertEquals(0.0, AnalyzerFixtures.run(analyzer, striped, flat, config)
                .getSummary().getEdgePreservationScore(), 1e-12);
    }
}

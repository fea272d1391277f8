package guraa.paintquality.detection;

import guraa.paintquality.analysis.CellMetrics;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.grid.GridPartitioner;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;
import guraa.paintquality.model.IssueType;
import guraa.paintquality.model.ProblemRegion;
import guraa.paintquality.model.SeverityAggregation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProblemDetectorTest {

    private final ProblemDetector detector = new ProblemDetector();
    private final AnalysisConfig config = AnalysisConfig.defaults();
    // 4x4 cells of 50px
    private final Grid grid = new GridPartitioner().partition(200, 200, 50);

    private double[] zeros() {
        return new double[grid.size()];
    }

    private CellMetrics none() {
        return CellMetrics.of(zeros());
    }

    private CellMetrics scores(int[] cells, double value) {
        double[] s = zeros();
        for (int cell : cells) {
            s[cell] = value;
        }
        return CellMetrics.of(s);
    }

    @Test
    void nothingFlaggedWhenAllScoresAreZero() {
        assertTrue(detector.detect(grid, none(), none(), none(), config).isEmpty());
    }

    @Test
    void edgeSharingCellsMerge() {
        CellMetrics color = scores(new int[]{0, 1, 5}, 1.0);

        List<ProblemRegion> regions = detector.detect(grid, color, none(), none(), config);

        assertEquals(1, regions.size());
        ProblemRegion region = regions.get(0);
        assertEquals(0, region.getX());
        assertEquals(0, region.getY());
        assertEquals(100, region.getWidth());
        assertEquals(100, region.getHeight());
        assertEquals(3, region.getCellCount());
        assertEquals(7500, region.getArea());
        assertEquals(IssueType.COLOR_INCONSISTENCY, region.getIssueType());
    }

    @Test
    void diagonalCellsDoNotMerge() {
        CellMetrics color = scores(new int[]{0, 5}, 1.0);

        List<ProblemRegion> regions = detector.detect(grid, color, none(), none(), config);

        assertEquals(2, regions.size());
        assertEquals(1, regions.get(0).getCellCount());
        assertEquals(1, regions.get(1).getCellCount());
    }

    @Test
    void rowWrapDoesNotMerge() {
        // cell 3 ends row 0, cell 4 starts row 1
        CellMetrics color = scores(new int[]{3, 4}, 1.0);

        assertEquals(2, detector.detect(grid, color, none(), none(), config).size());
    }

    @Test
    void fusedSeverityIsNormalizedByWeightSum() {
        CellMetrics all = scores(new int[]{6}, 1.0);

        ProblemRegion region = detector.detect(grid, all, all, all, config).get(0);

        assertEquals(1.0, region.getSeverity(), 1e-12);
    }

    @Test
    void tieGoesToColorThenCoverage() {
        AnalysisConfig equalWeights = config.toBuilder()
                .colorWeight(1).coverageWeight(1).textureWeight(1).build();
        CellMetrics same = scores(new int[]{6}, 0.9);

        assertEquals(Axis.COLOR, ProblemDetector.dominantAxis(new double[]{0.3, 0.3, 0.3}));
        assertEquals(Axis.COVERAGE, ProblemDetector.dominantAxis(new double[]{0.2, 0.3, 0.3}));
        assertEquals(IssueType.COLOR_INCONSISTENCY,
                detector.detect(grid, same, same, same, equalWeights).get(0).getIssueType());
        assertEquals(IssueType.UNEVEN_COVERAGE,
                detector.detect(grid, none(), same, same, equalWeights).get(0).getIssueType());
    }

    @Test
    void coverageDirectionSelectsLabel() {
        double[] s = zeros();
        double[] up = zeros();
        double[] down = zeros();
        s[6] = 1.0;
        up[6] = 0.5;
        down[6] = -0.5;

        assertEquals(IssueType.OVER_APPLICATION, detector.detect(grid, none(),
                CellMetrics.of(s, up), none(), config).get(0).getIssueType());
        assertEquals(IssueType.UNEVEN_COVERAGE, detector.detect(grid, none(),
                CellMetrics.of(s, down), none(), config).get(0).getIssueType());
    }

    @Test
    void textureDominatedRegion() {
        AnalysisConfig textureHeavy = config.toBuilder().textureWeight(0.6).build();

        ProblemRegion region = detector.detect(grid, none(), none(), scores(new int[]{6}, 1.0), textureHeavy).get(0);

        assertEquals(IssueType.TEXTURE_VARIATION, region.getIssueType());
    }

    @Test
    void severityAggregation() {
        double[] s = zeros();
        s[0] = 1.0;
        s[1] = 0.8;
        CellMetrics color = CellMetrics.of(s);
        AnalysisConfig mean = config.toBuilder().severityAggregation(SeverityAggregation.MEAN).build();

        assertEquals(0.45, detector.detect(grid, color, none(), none(), config).get(0).getSeverity(), 1e-9);
        assertEquals(0.405, detector.detect(grid, color, none(), none(), mean).get(0).getSeverity(), 1e-9);
    }

    @Test
    void confidenceIsShareOfAgreeingCells() {
        CellMetrics color = scores(new int[]{0}, 1.0);
        CellMetrics coverage = scores(new int[]{1}, 1.0);

        ProblemRegion region = detector.detect(grid, color, coverage, none(), config).get(0);

        assertEquals(IssueType.COLOR_INCONSISTENCY, region.getIssueType());
        assertEquals(0.5, region.getConfidence(), 1e-12);
    }

    @Test
    void regionsOrderedBySeverityThenPosition() {
        double[] s = zeros();
        s[0] = 0.8;
        s[10] = 1.0;
        s[15] = 0.8;

        List<ProblemRegion> regions = detector.detect(grid, CellMetrics.of(s), none(), none(), config);

        assertEquals(3, regions.size());
        assertEquals(100, regions.get(0).getX());
        assertEquals(0, regions.get(1).getX());
        assertEquals(150, regions.get(2).getX());
    }

    @Test
    void smallRegionsAreDropped() {
        Grid fine = new GridPartitioner().partition(20, 20, 5);
        double[] s = new double[fine.size()];
        s[0] = 1.0;

        assertTrue(detector.detect(fine, CellMetrics.of(s), CellMetrics.of(new double[fine.size()]),
                CellMetrics.of(new double[fine.size()]), config).isEmpty());
    }

    @Test
    void raisingAxisThresholdNeverAddsRegions() {
        double[] s = zeros();
        s[0] = 0.7;
        s[1] = 0.9;
        s[3] = 0.75;
        s[9] = 1.0;
        s[14] = 0.85;
        CellMetrics color = CellMetrics.of(s);

        int previous = Integer.MAX_VALUE;
        for (int step = 0; step <= 20; step++) {
            AnalysisConfig stepped = config.toBuilder().colorThreshold(step / 20.0).build();
            int count = detector.detect(grid, color, none(), none(), stepped).size();
            assertTrue(count <= previous, "count grew at threshold " + step / 20.0);
            previous = count;
        }
        assertEquals(0, previous);
    }

    @Test
    void mismatchedMetricsAreRejected() {
        CellMetrics shortMetrics = CellMetrics.of(new double[3]);
        assertThrows(IllegalArgumentException.class,
                () -> detector.detect(grid, shortMetrics, none(), none(), config));
    }
}

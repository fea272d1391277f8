package guraa.paintquality.detection;

import guraa.paintquality.analysis.CellMetrics;
import guraa.paintquality.grid.Cell;
import guraa.paintquality.grid.Grid;
import guraa.paintquality.model.AnalysisConfig;
import guraa.paintquality.model.Axis;
import guraa.paintquality.model.IssueType;
import guraa.paintquality.model.ProblemRegion;
import guraa.paintquality.model.SeverityAggregation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fuses the three per-cell scores, flags cells, merges 4-connected flagged cells and classifies the result.
 * <p>
 * A merged component is only reported when some axis confirms it: the peak score of that axis
 * among the member cells must exceed the axis threshold. Raising an axis threshold can therefore
 * only drop whole regions, never split one.
 */
@Slf4j
@Component
public class ProblemDetector {

    private static final Axis[] AXES = Axis.values();

    /**
     * Detect problem regions.
     *
     * @param grid The grid shared by all axes
     * @param color Color axis scores
     * @param coverage Coverage axis scores, signed with the deviation from the surface baseline
     * @param texture Texture axis scores
     * @param config The analysis configuration
     * @return Regions ordered by severity (descending), then by position
     */
    public List<ProblemRegion> detect(Grid grid, CellMetrics color, CellMetrics coverage, CellMetrics texture,
                                      AnalysisConfig config) {
        int n = grid.size();
        if (color.size() != n || coverage.size() != n || texture.size() != n) {
            throw new IllegalArgumentException("Cell metrics do not match the grid size " + n);
        }

        CellMetrics[] metrics = {color, coverage, texture};
        double weightSum = config.totalWeight();
        double[][] contributions = new double[n][AXES.length];
        double[] fused = new double[n];
        boolean[] flagged = new boolean[n];

        for (int i = 0; i < n; i++) {
            double total = 0;
            for (Axis axis : AXES) {
                double contribution = config.weightOf(axis) * metrics[axis.ordinal()].score(i) / weightSum;
                contributions[i][axis.ordinal()] = contribution;
                total += contribution;
            }
            fused[i] = Math.min(1.0, total);
            flagged[i] = fused[i] > config.getDetectionThreshold();
        }

        CellUnionFind components = new CellUnionFind(n);
        for (int i = 0; i < n; i++) {
            if (!flagged[i]) {
                continue;
            }
            Cell cell = grid.cell(i);
            if (cell.getCol() + 1 < grid.getCols() && flagged[i + 1]) {
                components.union(i, i + 1);
            }
            if (cell.getRow() + 1 < grid.getRows() && flagged[i + grid.getCols()]) {
                components.union(i, i + grid.getCols());
            }
        }

        // Group members by component, keyed in order of each component's first (smallest) cell index
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            if (flagged[i]) {
                groups.computeIfAbsent(components.find(i), root -> new ArrayList<>()).add(i);
            }
        }

        List<Candidate> candidates = new ArrayList<>();
        for (List<Integer> members : groups.values()) {
            Candidate candidate = buildRegion(grid, members, metrics, contributions, fused, config);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.region.getSeverity()).reversed()
                .thenComparingInt(c -> c.firstIndex));

        List<ProblemRegion> regions = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            regions.add(candidate.region);
        }

        log.debug("Flagged cells formed {} component(s), {} reported as regions", groups.size(), regions.size());
        return regions;
    }

    private Candidate buildRegion(Grid grid, List<Integer> members, CellMetrics[] metrics,
                                  double[][] contributions, double[] fused, AnalysisConfig config) {
        int minX = Integer.MAX_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int maxY = Integer.MIN_VALUE;
        long area = 0;
        double[] peaks = new double[AXES.length];
        double[] summed = new double[AXES.length];
        double signedCoverage = 0;
        double maxSeverity = 0;
        double severitySum = 0;

        for (int index : members) {
            Cell cell = grid.cell(index);
            minX = Math.min(minX, cell.getX());
            minY = Math.min(minY, cell.getY());
            maxX = Math.max(maxX, cell.getX() + cell.getWidth());
            maxY = Math.max(maxY, cell.getY() + cell.getHeight());
            area += cell.area();

            for (Axis axis : AXES) {
                peaks[axis.ordinal()] = Math.max(peaks[axis.ordinal()], metrics[axis.ordinal()].score(index));
                summed[axis.ordinal()] += contributions[index][axis.ordinal()];
            }
            signedCoverage += metrics[Axis.COVERAGE.ordinal()].signed(index);
            maxSeverity = Math.max(maxSeverity, fused[index]);
            severitySum += fused[index];
        }

        if (!confirmed(peaks, config) || area < config.getMinRegionArea()) {
            return null;
        }

        Axis dominant = dominantAxis(summed);
        int agreeing = 0;
        for (int index : members) {
            if (dominantAxis(contributions[index]) == dominant) {
                agreeing++;
            }
        }

        double severity = config.getSeverityAggregation() == SeverityAggregation.MEAN
                ? severitySum / members.size()
                : maxSeverity;

        ProblemRegion region = ProblemRegion.builder()
                .x(minX)
                .y(minY)
                .width(maxX - minX)
                .height(maxY - minY)
                .area(area)
                .cellCount(members.size())
                .severity(clamp(severity))
                .confidence(clamp((double) agreeing / members.size()))
                .issueType(classify(dominant, signedCoverage))
                .build();
        return new Candidate(region, members.get(0));
    }

    private boolean confirmed(double[] peaks, AnalysisConfig config) {
        for (Axis axis : AXES) {
            if (peaks[axis.ordinal()] > config.thresholdOf(axis)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Pick the axis with the largest contribution. Ties go to the axis declared first
     * (color, then coverage, then texture).
     *
     * @param contributions Contributions indexed by axis ordinal
     * @return The dominant axis
     */
    static Axis dominantAxis(double[] contributions) {
        Axis best = AXES[0];
        for (Axis axis : AXES) {
            if (contributions[axis.ordinal()] > contributions[best.ordinal()]) {
                best = axis;
            }
        }
        return best;
    }

    static IssueType classify(Axis dominant, double signedCoverage) {
        switch (dominant) {
            case COLOR:
                return IssueType.COLOR_INCONSISTENCY;
            case COVERAGE:
                return signedCoverage > 0 ? IssueType.OVER_APPLICATION : IssueType.UNEVEN_COVERAGE;
            default:
                return IssueType.TEXTURE_VARIATION;
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static final class Candidate {
        private final ProblemRegion region;
        private final int firstIndex;

        private Candidate(ProblemRegion region, int firstIndex) {
            this.region = region;
            this.firstIndex = firstIndex;
        }
    }
}

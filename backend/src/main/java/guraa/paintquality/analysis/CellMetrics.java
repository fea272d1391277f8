package guraa.paintquality.analysis;

import java.util.Arrays;

/**
 * Immutable per-cell scores of one axis, indexed by cell index.
 * Scores are normalized to [0, 1]; the optional signed values carry direction
 * (the coverage deviation, negative when paint changed a cell less than the surface overall).
 */
public final class CellMetrics {

    private final double[] scores;
    private final double[] signed;

    private CellMetrics(double[] scores, double[] signed) {
        this.scores = scores;
        this.signed = signed;
    }

    /**
     * Create metrics without direction.
     *
     * @param scores Per-cell scores; copied, clamped to [0, 1], non-finite values become 0
     * @return The metrics
     */
    public static CellMetrics of(double[] scores) {
        return of(scores, new double[scores.length]);
    }

    /**
     * Create metrics with signed values.
     *
     * @param scores Per-cell scores; copied, clamped to [0, 1], non-finite values become 0
     * @param signed Per-cell signed values; copied, non-finite values become 0
     * @return The metrics
     */
    public static CellMetrics of(double[] scores, double[] signed) {
        if (scores.length != signed.length) {
            throw new IllegalArgumentException("Score and signed arrays differ in length");
        }
        double[] s = new double[scores.length];
        double[] d = new double[signed.length];
        for (int i = 0; i < scores.length; i++) {
            s[i] = Double.isFinite(scores[i]) ? Math.max(0.0, Math.min(1.0, scores[i])) : 0.0;
            d[i] = Double.isFinite(signed[i]) ? signed[i] : 0.0;
        }
        return new CellMetrics(s, d);
    }

    public int size() {
        return scores.length;
    }

    public double score(int cellIndex) {
        return scores[cellIndex];
    }

    public double signed(int cellIndex) {
        return signed[cellIndex];
    }

    @Override
    public String toString() {
        return "CellMetrics" + Arrays.toString(scores);
    }
}

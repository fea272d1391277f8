package guraa.paintquality.model;

/**
 * How member cell severities are folded into a region severity.
 */
public enum SeverityAggregation {
    MAX,
    MEAN
}

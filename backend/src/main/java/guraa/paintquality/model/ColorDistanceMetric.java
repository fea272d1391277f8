package guraa.paintquality.model;

/**
 * Perceptual distance used between before/after mean cell colors.
 */
public enum ColorDistanceMetric {
    /** Euclidean distance in CIELAB. */
    CIE76,
    /** CIEDE2000 color difference. */
    CIEDE2000
}

package guraa.paintquality.model;

/**
 * Error taxonomy reported on a failed analysis result.
 */
public enum AnalysisErrorKind {
    DECODE_ERROR,
    VALIDATION_ERROR,
    DIMENSION_MISMATCH,
    INTERNAL_COMPUTATION_ERROR,
    CANCELLED
}

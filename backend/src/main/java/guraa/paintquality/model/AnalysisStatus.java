package guraa.paintquality.model;

/**
 * Terminal status of one analysis invocation.
 */
public enum AnalysisStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}

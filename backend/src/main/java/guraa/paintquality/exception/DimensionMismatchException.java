package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * The two images cannot be brought to a common frame without stretching past the configured tolerance.
 */
public class DimensionMismatchException extends AnalysisException {

    public DimensionMismatchException(String message) {
        super(AnalysisErrorKind.DIMENSION_MISMATCH, message);
    }
}

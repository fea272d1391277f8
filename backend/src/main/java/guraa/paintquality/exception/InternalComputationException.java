package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * An unexpected numeric or execution failure inside the pipeline.
 */
public class InternalComputationException extends AnalysisException {

    public InternalComputationException(String message, Throwable cause) {
        super(AnalysisErrorKind.INTERNAL_COMPUTATION_ERROR, message, cause);
    }
}

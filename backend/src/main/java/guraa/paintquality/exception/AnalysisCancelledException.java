package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * The caller's cancellation token was set while the analysis was running.
 */
public class AnalysisCancelledException extends AnalysisException {

    public AnalysisCancelledException(String message) {
        super(AnalysisErrorKind.CANCELLED, message);
    }
}

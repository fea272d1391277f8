package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * Base class for failures that end an analysis.
 * The engine converts these into a failed {@code AnalysisResult}; they never escape {@code analyze}.
 */
public abstract class AnalysisException extends Exception {

    private final AnalysisErrorKind kind;

    protected AnalysisException(AnalysisErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AnalysisException(AnalysisErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AnalysisErrorKind getKind() {
        return kind;
    }
}

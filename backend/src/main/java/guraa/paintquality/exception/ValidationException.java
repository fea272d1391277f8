package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * An input violates a size or dimension constraint, or is missing.
 */
public class ValidationException extends AnalysisException {

    public ValidationException(String message) {
        super(AnalysisErrorKind.VALIDATION_ERROR, message);
    }
}

package guraa.paintquality.exception;

import guraa.paintquality.model.AnalysisErrorKind;

/**
 * Image bytes are corrupt or in an unsupported format.
 */
public class DecodeException extends AnalysisException {

    public DecodeException(String message) {
        super(AnalysisErrorKind.DECODE_ERROR, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(AnalysisErrorKind.DECODE_ERROR, message, cause);
    }
}

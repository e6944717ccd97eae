package com.threatattribution.engine.training;

import com.threatattribution.engine.AttributionException;

/**
 * Raised when fitting or evaluating the classifier fails for a reason other
 * than bad input data. No model is produced.
 *
 * @author Naveed Gung
 */
public class TrainingInternalException extends AttributionException {

    public TrainingInternalException(String message) {
        super(message);
    }

    public TrainingInternalException(String message, Throwable cause) {
        super(message, cause);
    }
}

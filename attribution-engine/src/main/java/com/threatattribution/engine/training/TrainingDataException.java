package com.threatattribution.engine.training;

import com.threatattribution.engine.AttributionException;

/**
 * Raised when the intrusion-set corpus handed to the trainer is empty or
 * malformed.
 *
 * @author Naveed Gung
 */
public class TrainingDataException extends AttributionException {

    public TrainingDataException(String message) {
        super(message);
    }

    public TrainingDataException(String message, Throwable cause) {
        super(message, cause);
    }
}

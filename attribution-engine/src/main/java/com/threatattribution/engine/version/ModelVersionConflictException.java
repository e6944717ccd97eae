package com.threatattribution.engine.version;

import com.threatattribution.engine.AttributionException;

/**
 * Raised when a trained model cannot be registered because its version no
 * longer advances the registry.
 *
 * @author Naveed Gung
 */
public class ModelVersionConflictException extends AttributionException {

    public ModelVersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.threatattribution.engine.stix;

import com.threatattribution.engine.AttributionException;

/**
 * Raised when an incident cannot be turned into a feature string.
 *
 * @author Naveed Gung
 */
public class InputFormatException extends AttributionException {

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

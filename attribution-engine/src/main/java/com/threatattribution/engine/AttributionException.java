package com.threatattribution.engine;

/**
 * Base type for all failures raised by the attribution pipeline.
 *
 * @author Naveed Gung
 */
public class AttributionException extends RuntimeException {

    public AttributionException(String message) {
        super(message);
    }

    public AttributionException(String message, Throwable cause) {
        super(message, cause);
    }
}

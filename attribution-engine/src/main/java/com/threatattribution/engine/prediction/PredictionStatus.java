package com.threatattribution.engine.prediction;

/**
 * Outcome of a prediction call.
 *
 * <p>
 * Failure codes are part of the wire format: a failed prediction reports its
 * code in place of the label block.
 * </p>
 *
 * @author Naveed Gung
 */
public enum PredictionStatus {

    OK(0, "Prediction succeeded"),
    INVALID_INPUT(-1, "Incident cannot be serialized into features"),
    MODEL_UNAVAILABLE(-2, "No attribution model is available"),
    INTERNAL_ERROR(-3, "Scoring failed");

    private final int wireCode;
    private final String description;

    PredictionStatus(int wireCode, String description) {
        this.wireCode = wireCode;
        this.description = description;
    }

    public int getWireCode() {
        return wireCode;
    }

    public String getDescription() {
        return description;
    }

    public boolean isFailure() {
        return this != OK;
    }

    /**
     * Decode from the wire representation.
     *
     * @param code the code found in a result document
     * @return the corresponding status
     * @throws IllegalArgumentException if the code is unknown
     */
    public static PredictionStatus fromWireCode(int code) {
        for (PredictionStatus status : values()) {
            if (status.wireCode == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown prediction status code: " + code);
    }
}

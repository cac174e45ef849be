package org.carball.cflow.model.analysis;

public enum ResultStatus {
    OK,
    EXTRACTION_ERROR,
    MALFORMED_CONTROL_FLOW,
    INVARIANT_VIOLATION;

    public boolean isFailure() {
        return this != OK;
    }
}

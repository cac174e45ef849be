package org.carball.cflow.model.analysis;

import java.util.Objects;

/**
 * One entry per function-like fragment found in a file. A successful entry carries
 * a report, a failed one carries the error message.
 */
public record FunctionResult(
        int index,
        String name,
        ResultStatus status,
        ComplexityReport report,
        String error,
        String diagram
) {

    public FunctionResult {
        Objects.requireNonNull(status, "status");
        if (status == ResultStatus.OK && report == null) {
            throw new IllegalArgumentException("successful result for " + name + " has no report");
        }
        if (status != ResultStatus.OK && error == null) {
            throw new IllegalArgumentException("failed result for " + name + " has no error message");
        }
    }

    public static FunctionResult success(int index, String name, ComplexityReport report, String diagram) {
        return new FunctionResult(index, name, ResultStatus.OK, report, null, diagram);
    }

    public static FunctionResult failure(int index, String name, ResultStatus status, String error) {
        return new FunctionResult(index, name, status, null, error, null);
    }

    public boolean isSuccess() {
        return status == ResultStatus.OK;
    }

    public boolean hasDiagram() {
        return diagram != null;
    }
}

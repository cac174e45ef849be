package org.carball.cflow.analyzer;

/**
 * A control-flow graph broke one of its structural guarantees. This points at a
 * defect in graph construction, not at the analyzed source.
 */
public class InvariantViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String functionName;

    public InvariantViolationException(String functionName, String message) {
        super(message + " (in " + functionName + ")");
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}

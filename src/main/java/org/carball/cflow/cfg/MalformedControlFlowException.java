package org.carball.cflow.cfg;

import lombok.Getter;

/**
 * Thrown when a function body's branches or brackets do not line up.
 * Scoped to one function: the caller records an error entry and moves on.
 */
@Getter
public class MalformedControlFlowException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String functionName;
    private final int offset;

    public MalformedControlFlowException(String functionName, int offset, String message) {
        super(String.format("%s (in %s at offset %d)", message, functionName, offset));
        this.functionName = functionName;
        this.offset = offset;
    }
}

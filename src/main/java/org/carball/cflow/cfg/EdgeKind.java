package org.carball.cflow.cfg;

public enum EdgeKind {
    TRUE,
    FALSE,
    FALLTHROUGH,
    /** Direct self-call, from the calling block to the entry block. Not a control-flow edge. */
    CALL,
    RETURN,
    LOOP_BACK,
    CASE,
    /** {@code break} or {@code continue}. */
    JUMP;

    public boolean isControlFlow() {
        return this != CALL;
    }
}

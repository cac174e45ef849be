package org.carball.cflow.cfg;

public record Edge(int source, int target, EdgeKind kind) {

    public boolean isControlFlow() {
        return kind.isControlFlow();
    }
}

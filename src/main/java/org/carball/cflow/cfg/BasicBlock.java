package org.carball.cflow.cfg;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line run of statement fragments with a single entry and exit.
 * Fragments are opaque text; only the block boundaries matter to the metrics.
 * Mutable while the builder owns it, read-only once the graph is assembled.
 */
@Getter
public class BasicBlock {

    private final int id;
    private BlockKind kind;
    private boolean terminal;
    private final List<String> statements = new ArrayList<>();
    private final List<Edge> outgoing = new ArrayList<>();

    BasicBlock(int id, BlockKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public List<String> getStatements() {
        return Collections.unmodifiableList(statements);
    }

    public List<Edge> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public String label() {
        return String.join("; ", statements);
    }

    void setKind(BlockKind kind) {
        this.kind = kind;
    }

    void addStatement(String statement) {
        statements.add(statement);
    }

    void markTerminal() {
        this.terminal = true;
    }

    void addOutgoing(Edge edge) {
        outgoing.add(edge);
    }

    @Override
    public String toString() {
        return "B" + id + "(" + kind + ")";
    }
}

package org.carball.cflow.output;

import org.carball.cflow.cfg.BasicBlock;
import org.carball.cflow.cfg.ControlFlowGraph;
import org.carball.cflow.cfg.Edge;

/**
 * Renders a control-flow graph as a Mermaid flowchart.
 */
public class MermaidCfgRenderer {

    public String render(ControlFlowGraph graph) {
        StringBuilder mermaid = new StringBuilder("graph TD\n");

        for (BasicBlock block : graph.getBlocks()) {
            String id = nodeId(block.getId());
            String label = escapeLabel(block.label());
            switch (block.getKind()) {
                case ENTRY:
                case EXIT:
                    mermaid.append(String.format("    %s([%s])\n", id, block.getKind()));
                    break;
                case CONDITION:
                case LOOP_HEADER:
                case SWITCH:
                    mermaid.append(String.format("    %s{\"%s\"}\n", id,
                            label.isEmpty() ? block.getKind().name().toLowerCase() : label));
                    break;
                case MERGE:
                    if (label.isEmpty()) {
                        mermaid.append(String.format("    %s(( ))\n", id));
                    } else {
                        mermaid.append(String.format("    %s[\"%s\"]\n", id, label));
                    }
                    break;
                default:
                    mermaid.append(String.format("    %s[\"%s\"]\n", id, label.isEmpty() ? " " : label));
                    break;
            }
        }

        graph.controlEdges().forEach(edge -> appendEdge(mermaid, edge));
        // self-calls last, so they do not interleave with the flow
        graph.callEdges().forEach(edge -> appendEdge(mermaid, edge));
        return mermaid.toString();
    }

    private static void appendEdge(StringBuilder mermaid, Edge edge) {
        mermaid.append("    ").append(nodeId(edge.source())).append(' ')
                .append(arrow(edge)).append(' ')
                .append(nodeId(edge.target())).append('\n');
    }

    private static String arrow(Edge edge) {
        switch (edge.kind()) {
            case TRUE:
                return "-->|T|";
            case FALSE:
                return "-->|F|";
            case CASE:
                return "-->|case|";
            case LOOP_BACK:
                return "-->|loop|";
            case JUMP:
                return "-->|jump|";
            case RETURN:
                return "-.->";
            case CALL:
                return "-.->|call|";
            default:
                return "-->";
        }
    }

    private static String nodeId(int blockId) {
        return "B" + blockId;
    }

    /**
     * Escapes a label for use inside a quoted Mermaid node. Ampersands go first so
     * that entities produced by the later replacements are not escaped twice.
     */
    public static String escapeLabel(String label) {
        return label.replace("&", "&amp;")
                .replace("\"", "&quot;")
                .replace("'", "&apos;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\\", "\\\\")
                .replace('\n', ' ');
    }
}

package org.carball.cflow.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.cfg.BasicBlock;
import org.carball.cflow.cfg.ControlFlowGraph;
import org.carball.cflow.cfg.Edge;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.model.analysis.ComplexityReport;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Slf4j
public class ComplexityCalculator {

    private final ComplexityThresholds thresholds;

    public ComplexityCalculator() {
        this(ComplexityThresholds.defaults());
    }

    public ComplexityCalculator(ComplexityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Computes the metrics of a graph. Cyclomatic complexity is
     * {@code E - N + 2} over control-flow edges; self-call edges are left out.
     *
     * @throws InvariantViolationException if the graph is structurally broken
     */
    public ComplexityReport calculate(ControlFlowGraph graph) {
        String name = graph.getFunctionName();
        validate(graph);

        List<Edge> controlEdges = graph.controlEdges();
        int blockCount = graph.getBlocks().size();
        int complexity = controlEdges.size() - blockCount + 2;

        if (complexity < 1) {
            throw new InvariantViolationException(name,
                    "cyclomatic complexity " + complexity + " is below 1");
        }
        if (complexity != graph.getDecisionPoints() + 1) {
            throw new InvariantViolationException(name, String.format(
                    "edge count gives complexity %d but %d decision points were counted",
                    complexity, graph.getDecisionPoints()));
        }

        int unreachable = blockCount - graph.reachableBlockIds().size();
        if (unreachable > 0) {
            log.debug("{} has {} unreachable blocks", name, unreachable);
        }

        return ComplexityReport.builder()
                .functionName(name)
                .cyclomaticComplexity(complexity)
                .maxNestingDepth(graph.getMaxNestingDepth())
                .recursive(graph.isRecursive())
                .blockCount(blockCount)
                .edgeCount(controlEdges.size())
                .decisionPoints(graph.getDecisionPoints())
                .unreachableBlocks(unreachable)
                .riskLevel(thresholds.riskLevelFor(complexity))
                .build();
    }

    private void validate(ControlFlowGraph graph) {
        String name = graph.getFunctionName();
        if (!graph.containsBlock(graph.getEntryId())) {
            throw new InvariantViolationException(name, "entry block " + graph.getEntryId() + " is missing");
        }
        if (!graph.containsBlock(graph.getExitId())) {
            throw new InvariantViolationException(name, "exit block " + graph.getExitId() + " is missing");
        }

        Set<Integer> withSuccessor = new HashSet<>();
        for (Edge edge : graph.getEdges()) {
            if (!graph.containsBlock(edge.source()) || !graph.containsBlock(edge.target())) {
                throw new InvariantViolationException(name, "dangling edge " + edge);
            }
            if (edge.isControlFlow()) {
                withSuccessor.add(edge.source());
            }
        }

        if (withSuccessor.contains(graph.getExitId())) {
            throw new InvariantViolationException(name, "exit block has outgoing control edges");
        }
        for (BasicBlock block : graph.getBlocks()) {
            if (block.getId() != graph.getExitId() && !withSuccessor.contains(block.getId())) {
                throw new InvariantViolationException(name, "block " + block + " has no outgoing control edge");
            }
        }
    }
}

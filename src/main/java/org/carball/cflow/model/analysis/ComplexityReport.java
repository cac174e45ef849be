package org.carball.cflow.model.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * Metrics computed from one function's control-flow graph.
 */
@Value
@Builder
public class ComplexityReport {
    String functionName;
    int cyclomaticComplexity;
    int maxNestingDepth;
    boolean recursive;
    int blockCount;
    int edgeCount;
    int decisionPoints;
    int unreachableBlocks;
    RiskLevel riskLevel;

    public boolean hasUnreachableCode() {
        return unreachableBlocks > 0;
    }
}

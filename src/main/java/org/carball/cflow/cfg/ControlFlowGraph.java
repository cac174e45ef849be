package org.carball.cflow.cfg;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Blocks and edges of one function. Every {@code return} and the implicit end of
 * the body lead to a single synthetic exit block.
 */
@Getter
public class ControlFlowGraph {

    private final String functionName;
    private final int entryId;
    private final int exitId;
    private final List<BasicBlock> blocks;
    private final List<Edge> edges;
    private final int maxNestingDepth;
    private final int decisionPoints;
    private final boolean recursive;

    @Getter(AccessLevel.NONE)
    private final Map<Integer, BasicBlock> blocksById = new LinkedHashMap<>();

    public ControlFlowGraph(String functionName, int entryId, int exitId,
                            List<BasicBlock> blocks, List<Edge> edges,
                            int maxNestingDepth, int decisionPoints, boolean recursive) {
        this.functionName = functionName;
        this.entryId = entryId;
        this.exitId = exitId;
        this.blocks = List.copyOf(blocks);
        this.edges = List.copyOf(edges);
        this.maxNestingDepth = maxNestingDepth;
        this.decisionPoints = decisionPoints;
        this.recursive = recursive;
        for (BasicBlock block : this.blocks) {
            blocksById.put(block.getId(), block);
        }
    }

    public Optional<BasicBlock> block(int id) {
        return Optional.ofNullable(blocksById.get(id));
    }

    public boolean containsBlock(int id) {
        return blocksById.containsKey(id);
    }

    public List<Edge> controlEdges() {
        return edges.stream().filter(Edge::isControlFlow).collect(Collectors.toList());
    }

    public List<Edge> callEdges() {
        return edges.stream().filter(e -> !e.isControlFlow()).collect(Collectors.toList());
    }

    public List<Edge> outgoing(int blockId) {
        return edges.stream()
                .filter(e -> e.source() == blockId && e.isControlFlow())
                .collect(Collectors.toList());
    }

    /**
     * Ids of the blocks reachable from the entry over control-flow edges.
     */
    public Set<Integer> reachableBlockIds() {
        Map<Integer, List<Integer>> successors = controlEdges().stream()
                .collect(Collectors.groupingBy(Edge::source,
                        Collectors.mapping(Edge::target, Collectors.toList())));

        Set<Integer> visited = new LinkedHashSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(entryId);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (visited.add(current)) {
                for (int next : successors.getOrDefault(current, List.of())) {
                    if (!visited.contains(next)) {
                        stack.push(next);
                    }
                }
            }
        }
        return visited;
    }
}

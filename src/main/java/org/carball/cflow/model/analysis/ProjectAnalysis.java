package org.carball.cflow.model.analysis;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record ProjectAnalysis(List<FileAnalysis> files) {

    public ProjectAnalysis {
        files = List.copyOf(files);
    }

    /**
     * A successful function together with the file it was found in.
     */
    public record FunctionEntry(String path, FunctionResult result) {
        public ComplexityReport report() {
            return result.report();
        }
    }

    public int fileCount() {
        return files.size();
    }

    public int functionCount() {
        return files.stream().mapToInt(f -> f.functions().size()).sum();
    }

    public int failureCount() {
        return files.stream().mapToInt(f -> f.failures().size()).sum();
    }

    public int unreadableFileCount() {
        return (int) files.stream().filter(f -> !f.isReadable()).count();
    }

    public List<FunctionEntry> successfulFunctions() {
        return files.stream()
                .flatMap(f -> f.successes().stream().map(r -> new FunctionEntry(f.path(), r)))
                .collect(Collectors.toList());
    }

    public double averageComplexity() {
        return successfulFunctions().stream()
                .mapToInt(e -> e.report().getCyclomaticComplexity())
                .average()
                .orElse(0.0);
    }

    public int maxComplexity() {
        return successfulFunctions().stream()
                .mapToInt(e -> e.report().getCyclomaticComplexity())
                .max()
                .orElse(0);
    }

    /**
     * Successful functions ordered by descending complexity; ties keep discovery order.
     */
    public List<FunctionEntry> mostComplex(int limit) {
        return successfulFunctions().stream()
                .sorted(Comparator.comparingInt((FunctionEntry e) -> e.report().getCyclomaticComplexity()).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    public List<FunctionEntry> exceeding(int complexity) {
        return successfulFunctions().stream()
                .filter(e -> e.report().getCyclomaticComplexity() > complexity)
                .collect(Collectors.toList());
    }

    public Map<RiskLevel, Long> riskBreakdown() {
        Map<RiskLevel, Long> counts = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) {
            counts.put(level, 0L);
        }
        successfulFunctions().forEach(e -> counts.merge(e.report().getRiskLevel(), 1L, Long::sum));
        return counts;
    }
}

package org.carball.cflow.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.model.analysis.ComplexityReport;
import org.carball.cflow.model.analysis.FileAnalysis;
import org.carball.cflow.model.analysis.FunctionResult;
import org.carball.cflow.model.analysis.ProjectAnalysis;
import org.carball.cflow.model.analysis.RiskLevel;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
public class ComplexityReportWriter {

    static final String ANALYZER_VERSION = "1.0.0";
    private static final int TOP_FUNCTIONS = 10;

    private final ProjectAnalysis analysis;
    private final ComplexityThresholds thresholds;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;
    private final ObjectMapper lineMapper;

    public ComplexityReportWriter(ProjectAnalysis analysis, ComplexityThresholds thresholds) {
        this(analysis, thresholds, Clock.systemDefaultZone());
    }

    public ComplexityReportWriter(ProjectAnalysis analysis, ComplexityThresholds thresholds, Clock clock) {
        this.analysis = analysis;
        this.thresholds = thresholds;
        this.timestamp = LocalDateTime.now(clock);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        this.lineMapper = new ObjectMapper();
        this.lineMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    /**
     * One compact JSON object per function, in file order then discovery order.
     */
    public String toJsonLines() {
        StringBuilder lines = new StringBuilder();
        try {
            for (FileAnalysis file : analysis.files()) {
                for (FunctionResult result : file.functions()) {
                    FunctionEntry entry = toEntry(result);
                    entry.setFile(file.path());
                    lines.append(lineMapper.writeValueAsString(entry)).append('\n');
                }
            }
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON Lines report", e);
            throw new IllegalStateException("Failed to generate JSON Lines report", e);
        }
        return lines.toString();
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();

        md.append("# Control-Flow Complexity Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Analyzer Version:** ").append(ANALYZER_VERSION).append("  \n");
        md.append("**Profile:** ").append(thresholds.getProfileName()).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Files Analyzed | ").append(analysis.fileCount()).append(" |\n");
        md.append("| Functions Found | ").append(analysis.functionCount()).append(" |\n");
        md.append("| Functions Not Analyzed | ").append(analysis.failureCount()).append(" |\n");
        md.append("| Average Complexity | ").append(String.format("%.2f", analysis.averageComplexity())).append(" |\n");
        md.append("| Maximum Complexity | ").append(analysis.maxComplexity()).append(" |\n\n");

        md.append("### Risk Bands\n\n");
        md.append("| Risk | Complexity | Functions |\n");
        md.append("|------|------------|-----------|\n");
        Map<RiskLevel, Long> breakdown = analysis.riskBreakdown();
        md.append("| LOW | 1-").append(thresholds.getLowRiskLimit())
                .append(" | ").append(breakdown.get(RiskLevel.LOW)).append(" |\n");
        md.append("| MODERATE | ").append(thresholds.getLowRiskLimit() + 1).append('-').append(thresholds.getModerateRiskLimit())
                .append(" | ").append(breakdown.get(RiskLevel.MODERATE)).append(" |\n");
        md.append("| HIGH | ").append(thresholds.getModerateRiskLimit() + 1).append('-').append(thresholds.getHighRiskLimit())
                .append(" | ").append(breakdown.get(RiskLevel.HIGH)).append(" |\n");
        md.append("| VERY_HIGH | ").append(thresholds.getHighRiskLimit() + 1).append("+")
                .append(" | ").append(breakdown.get(RiskLevel.VERY_HIGH)).append(" |\n\n");

        List<ProjectAnalysis.FunctionEntry> top = analysis.mostComplex(TOP_FUNCTIONS);
        if (!top.isEmpty()) {
            md.append("## Most Complex Functions\n\n");
            md.append("| Function | File | Complexity | Nesting | Risk |\n");
            md.append("|----------|------|------------|---------|------|\n");
            for (ProjectAnalysis.FunctionEntry entry : top) {
                ComplexityReport report = entry.report();
                md.append("| `").append(escapeCell(entry.result().name())).append("` | ")
                        .append(escapeCell(entry.path())).append(" | ")
                        .append(report.getCyclomaticComplexity()).append(" | ")
                        .append(report.getMaxNestingDepth()).append(" | ")
                        .append(report.getRiskLevel()).append(" |\n");
            }
            md.append('\n');
        }

        md.append("## Files\n\n");
        for (FileAnalysis file : analysis.files()) {
            appendFile(md, file);
        }

        List<String> failures = failureLines();
        if (!failures.isEmpty()) {
            md.append("## Functions Not Analyzed\n\n");
            failures.forEach(line -> md.append(line).append('\n'));
            md.append('\n');
        }

        return md.toString();
    }

    private void appendFile(StringBuilder md, FileAnalysis file) {
        md.append("### ").append(file.path()).append("\n\n");
        if (!file.isReadable()) {
            md.append("*").append(file.error()).append("*\n\n");
            return;
        }
        if (!file.anomalies().isEmpty()) {
            md.append("- **Lexical anomalies:** ").append(file.anomalies().size()).append("\n\n");
        }
        List<FunctionResult> successes = file.successes();
        if (successes.isEmpty()) {
            md.append("No functions measured.\n\n");
        } else {
            md.append("| Function | Complexity | Nesting | Recursive | Blocks | Unreachable | Risk |\n");
            md.append("|----------|------------|---------|-----------|--------|-------------|------|\n");
            for (FunctionResult result : successes) {
                ComplexityReport report = result.report();
                md.append("| `").append(escapeCell(result.name())).append("` | ")
                        .append(report.getCyclomaticComplexity()).append(" | ")
                        .append(report.getMaxNestingDepth()).append(" | ")
                        .append(report.isRecursive() ? "yes" : "no").append(" | ")
                        .append(report.getBlockCount()).append(" | ")
                        .append(report.getUnreachableBlocks()).append(" | ")
                        .append(report.getRiskLevel()).append(" |\n");
            }
            md.append('\n');
        }

        for (FunctionResult result : successes) {
            if (result.hasDiagram()) {
                md.append("#### ").append(result.name()).append("\n\n");
                md.append("```mermaid\n").append(result.diagram()).append("```\n\n");
            }
        }
    }

    private List<String> failureLines() {
        return analysis.files().stream()
                .flatMap(file -> file.failures().stream()
                        .map(f -> String.format("- `%s` in %s: **%s** %s",
                                f.name(), file.path(), f.status(), f.error())))
                .collect(Collectors.toList());
    }

    private static String escapeCell(String text) {
        return text.replace("|", "\\|");
    }

    private ReportData buildReportData() {
        ReportData data = new ReportData();

        AnalysisMetadata metadata = new AnalysisMetadata();
        metadata.setGeneratedAt(timestamp);
        metadata.setAnalyzerVersion(ANALYZER_VERSION);
        metadata.setProfile(thresholds.getProfileName());
        metadata.setCountBooleanOperators(thresholds.isCountBooleanOperators());
        metadata.setFilesAnalyzed(analysis.fileCount());
        metadata.setFunctionsFound(analysis.functionCount());
        metadata.setFunctionsFailed(analysis.failureCount());
        metadata.setAverageComplexity(Math.round(analysis.averageComplexity() * 100.0) / 100.0);
        metadata.setMaxComplexity(analysis.maxComplexity());
        data.setMetadata(metadata);

        data.setFiles(analysis.files().stream().map(this::toFileEntry).collect(Collectors.toList()));
        return data;
    }

    private FileEntry toFileEntry(FileAnalysis file) {
        FileEntry entry = new FileEntry();
        entry.setPath(file.path());
        entry.setError(file.error());
        entry.setLexicalAnomalies(file.anomalies().size());
        entry.setFunctions(file.functions().stream().map(this::toEntry).collect(Collectors.toList()));
        return entry;
    }

    private FunctionEntry toEntry(FunctionResult result) {
        FunctionEntry entry = new FunctionEntry();
        entry.setName(result.name());
        entry.setStatus(result.status().name());
        if (result.isSuccess()) {
            ComplexityReport report = result.report();
            entry.setCyclomaticComplexity(report.getCyclomaticComplexity());
            entry.setMaxNestingDepth(report.getMaxNestingDepth());
            entry.setRecursive(report.isRecursive());
            entry.setBlockCount(report.getBlockCount());
            entry.setEdgeCount(report.getEdgeCount());
            entry.setDecisionPoints(report.getDecisionPoints());
            entry.setUnreachableBlocks(report.getUnreachableBlocks());
            entry.setRiskLevel(report.getRiskLevel().name());
            entry.setMermaid(result.diagram());
        } else {
            entry.setError(result.error());
        }
        return entry;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private AnalysisMetadata metadata;
        private List<FileEntry> files;
    }

    @lombok.Data
    private static class AnalysisMetadata {
        @JsonProperty("generated_at")
        private LocalDateTime generatedAt;
        @JsonProperty("analyzer_version")
        private String analyzerVersion;
        private String profile;
        @JsonProperty("count_boolean_operators")
        private boolean countBooleanOperators;
        @JsonProperty("files_analyzed")
        private int filesAnalyzed;
        @JsonProperty("functions_found")
        private int functionsFound;
        @JsonProperty("functions_failed")
        private int functionsFailed;
        @JsonProperty("average_complexity")
        private double averageComplexity;
        @JsonProperty("max_complexity")
        private int maxComplexity;
    }

    @lombok.Data
    private static class FileEntry {
        private String path;
        private String error;
        @JsonProperty("lexical_anomalies")
        private int lexicalAnomalies;
        private List<FunctionEntry> functions;
    }

    @lombok.Data
    private static class FunctionEntry {
        private String file;
        private String name;
        private String status;
        @JsonProperty("cyclomatic_complexity")
        private Integer cyclomaticComplexity;
        @JsonProperty("max_nesting_depth")
        private Integer maxNestingDepth;
        @JsonProperty("is_recursive")
        private Boolean recursive;
        @JsonProperty("block_count")
        private Integer blockCount;
        @JsonProperty("edge_count")
        private Integer edgeCount;
        @JsonProperty("decision_points")
        private Integer decisionPoints;
        @JsonProperty("unreachable_blocks")
        private Integer unreachableBlocks;
        @JsonProperty("risk_level")
        private String riskLevel;
        private String error;
        private String mermaid;
    }
}

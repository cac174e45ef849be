package org.carball.cflow.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.analyzer.CfgMetricsAnalyzer;
import org.carball.cflow.config.AnalysisProfile;
import org.carball.cflow.config.AnalyzerConfig;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.config.ConfigurationLoader;
import org.carball.cflow.config.OutputFormat;
import org.carball.cflow.model.analysis.ComplexityReport;
import org.carball.cflow.model.analysis.ProjectAnalysis;
import org.carball.cflow.model.analysis.RiskLevel;
import org.carball.cflow.output.ComplexityReportWriter;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
public class CfgMetricsCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_THRESHOLD_EXCEEDED = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        Control-Flow Graph Complexity Analyzer v%s          ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Options followed by a value
    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--output", "-o", "--format", "-f", "--parallelism", "--max-nesting",
            "--config", "--profile", "--fail-over",
            "--thresholds.low", "--thresholds.moderate", "--thresholds.high");

    public static void main(String[] args) {
        System.exit(run(args, new ConfigurationLoader()));
    }

    static int run(String[] args, ConfigurationLoader loader) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? EXIT_ERROR : EXIT_OK;
        }

        try {
            AnalyzerConfig config = parseArgs(args, loader);
            if (config.isVerbose()) {
                enableDebugLogging();
            }

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Inputs: " + config.getInputs());
            System.out.println("   Profile: " + config.getThresholds().getProfileName());
            if (config.getOutputFormat() == OutputFormat.BOTH) {
                String baseFileName = removeFileExtension(config.getOutputFile());
                System.out.println("   Output: " + baseFileName + ".json, " + baseFileName + ".md");
            } else {
                System.out.println("   Output: " + config.getOutputFile());
            }
            System.out.println();

            CfgMetricsAnalyzer analyzer = new CfgMetricsAnalyzer(config);

            System.out.print("📊 Building control-flow graphs... ");
            ProjectAnalysis analysis = analyzer.analyze();
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            outputResults(analysis, config);
            System.out.println("✓");

            printSummary(analysis);

            System.out.println("\n✅ Analysis complete!");

            if (config.getFailOver() != null) {
                List<ProjectAnalysis.FunctionEntry> offenders = analysis.exceeding(config.getFailOver());
                if (!offenders.isEmpty()) {
                    System.out.println("\n⚠️  " + offenders.size() + " function(s) exceed complexity " + config.getFailOver() + ":");
                    offenders.forEach(e -> System.out.printf("   %-40s %d  (%s)%n",
                            e.result().name(), e.report().getCyclomaticComplexity(), e.path()));
                    return EXIT_THRESHOLD_EXCEEDED;
                }
            }
            return EXIT_OK;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_ERROR;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar cflow-metrics.jar <path>... [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  path                Source file or directory (searched recursively)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: complexity-report.json)");
        System.out.println("  --format, -f        Output format: json|jsonl|markdown|both (default: json)");
        System.out.println("  --count-boolean-operators  Count each && and || as a decision point");
        System.out.println("  --parallelism       Worker threads per file (default: 1)");
        System.out.println("  --max-nesting       Deepest nesting accepted per function (default: 256)");
        System.out.println("  --config            YAML file with analysis settings");
        System.out.println("  --profile           Analysis profile: " + AnalysisProfile.getAvailableProfiles());
        System.out.println("  --mermaid           Include Mermaid CFG diagrams in the report");
        System.out.println("  --fail-over         Exit with code 2 when a function exceeds this complexity");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Analyze a source tree");
        System.out.println("  java -jar cflow-metrics.jar ./src");
        System.out.println();
        System.out.println("  # Markdown report with diagrams, strict profile");
        System.out.println("  java -jar cflow-metrics.jar ./src -f markdown --mermaid --profile strict");
        System.out.println();
        System.out.println("  # Fail a CI build when any function is too complex");
        System.out.println("  java -jar cflow-metrics.jar ./src --fail-over 15");
        System.out.println();
        System.out.println(AnalysisProfile.getProfileHelp());
        System.out.println(ConfigurationLoader.getThresholdHelp());
        System.out.println("Exit codes: 0 success, 1 configuration or IO error, 2 complexity threshold exceeded");
    }

    static AnalyzerConfig parseArgs(String[] args, ConfigurationLoader loader) throws IOException {
        AnalyzerConfig config = new AnalyzerConfig();

        // Set defaults
        config.setOutputFile("complexity-report.json");
        config.setOutputFormat(OutputFormat.JSON);
        config.setVerbose(false);

        String profileName = null;
        Path configFile = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (VALUE_OPTIONS.contains(arg) && i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            switch (arg) {
                case "--output":
                case "-o":
                    config.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    config.setOutputFormat(parseFormat(args[++i]));
                    break;

                case "--profile":
                    profileName = args[++i];
                    break;

                case "--config":
                    configFile = Paths.get(args[++i]);
                    break;

                case "--fail-over":
                    config.setFailOver(parsePositive(arg, args[++i]));
                    break;

                case "--mermaid":
                    config.setIncludeMermaid(true);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                case "--count-boolean-operators":
                    // Boolean flag, applied by the configuration loader
                    break;

                case "--parallelism":
                case "--max-nesting":
                case "--thresholds.low":
                case "--thresholds.moderate":
                case "--thresholds.high":
                    // Value is applied by the configuration loader
                    i++;
                    break;

                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    config.getInputs().add(Paths.get(arg));
                    break;
            }
        }

        ComplexityThresholds thresholds = loader.loadConfiguration(profileName, configFile, args);
        config.setThresholds(thresholds);

        config.setOutputFile(withFormatExtension(config.getOutputFile(), config.getOutputFormat()));

        validateConfig(config);
        return config;
    }

    private static OutputFormat parseFormat(String value) {
        try {
            return OutputFormat.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid output format. Use: json, jsonl, markdown, or both");
        }
    }

    private static int parsePositive(String option, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new IllegalArgumentException(option + " must be a positive number: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    static String withFormatExtension(String outputFile, OutputFormat format) {
        String baseFileName = removeFileExtension(outputFile);
        switch (format) {
            case MARKDOWN:
                return baseFileName + ".md";
            case JSONL:
                return baseFileName + ".jsonl";
            case BOTH:
            case JSON:
            default:
                return baseFileName + ".json";
        }
    }

    static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }

    private static void validateConfig(AnalyzerConfig config) {
        if (config.getInputs().isEmpty()) {
            throw new IllegalArgumentException("No input files or directories given");
        }
        for (Path input : config.getInputs()) {
            if (!Files.exists(input)) {
                throw new IllegalArgumentException("Input not found: " + input);
            }
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static void enableDebugLogging() {
        org.slf4j.Logger logger = LoggerFactory.getLogger("org.carball.cflow");
        if (logger instanceof Logger) {
            ((Logger) logger).setLevel(Level.DEBUG);
        }
    }

    static void outputResults(ProjectAnalysis analysis, AnalyzerConfig config) throws IOException {
        ComplexityReportWriter writer = new ComplexityReportWriter(analysis, config.getThresholds());
        String baseFileName = removeFileExtension(config.getOutputFile());

        switch (config.getOutputFormat()) {
            case JSON:
                Files.writeString(Paths.get(config.getOutputFile()), writer.toJson());
                break;
            case JSONL:
                Files.writeString(Paths.get(config.getOutputFile()), writer.toJsonLines());
                break;
            case MARKDOWN:
                Files.writeString(Paths.get(config.getOutputFile()), writer.toMarkdown());
                break;
            case BOTH:
                Files.writeString(Paths.get(baseFileName + ".json"), writer.toJson());
                Files.writeString(Paths.get(baseFileName + ".md"), writer.toMarkdown());
                break;
        }
    }

    private static void printSummary(ProjectAnalysis analysis) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nFiles analyzed: " + analysis.fileCount());
        System.out.println("Functions found: " + analysis.functionCount());
        System.out.println("Functions not analyzed: " + analysis.failureCount());
        System.out.printf("Average complexity: %.2f%n", analysis.averageComplexity());

        Map<RiskLevel, Long> breakdown = analysis.riskBreakdown();
        System.out.println("\nRisk breakdown:");
        System.out.println("  🟢 Low: " + breakdown.get(RiskLevel.LOW));
        System.out.println("  🟡 Moderate: " + breakdown.get(RiskLevel.MODERATE));
        System.out.println("  🟠 High: " + breakdown.get(RiskLevel.HIGH));
        System.out.println("  🔴 Very high: " + breakdown.get(RiskLevel.VERY_HIGH));

        List<ProjectAnalysis.FunctionEntry> top = analysis.mostComplex(5);
        if (top.isEmpty()) {
            System.out.println("\n💡 No functions found in the given inputs.");
            return;
        }

        System.out.println("\n🎯 Most Complex Functions:");
        System.out.println("-".repeat(60));
        for (ProjectAnalysis.FunctionEntry entry : top) {
            ComplexityReport report = entry.report();
            System.out.printf("%-40s CC %-4d depth %d%s%n",
                    entry.result().name(),
                    report.getCyclomaticComplexity(),
                    report.getMaxNestingDepth(),
                    report.isRecursive() ? "  (recursive)" : "");
        }
    }
}

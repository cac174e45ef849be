package org.carball.cflow.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.config.AnalyzerConfig;
import org.carball.cflow.config.ComplexityThresholds;
import org.carball.cflow.model.analysis.FileAnalysis;
import org.carball.cflow.model.analysis.ProjectAnalysis;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Analyzes every source file under the configured inputs. Directories are walked
 * recursively for the configured extensions; files given explicitly are always taken.
 */
@Slf4j
public class CfgMetricsAnalyzer {

    private final AnalyzerConfig config;
    private final ComplexityThresholds thresholds;
    private final SourceAnalyzer sourceAnalyzer;

    public CfgMetricsAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.thresholds = config.getThresholds() != null ?
                config.getThresholds() : ComplexityThresholds.defaults();
        this.sourceAnalyzer = new SourceAnalyzer(thresholds, config.isIncludeMermaid());

        log.info("Initialized CfgMetricsAnalyzer with {} inputs", config.getInputs().size());
        log.info("Using thresholds: {}", thresholds.getConfigurationSummary());
    }

    public ProjectAnalysis analyze() throws IOException {
        return analyze(config.getInputs());
    }

    /**
     * @throws IOException if an input path does not exist or a directory cannot be walked
     */
    public ProjectAnalysis analyze(List<Path> inputs) throws IOException {
        List<Path> files = collectSourceFiles(inputs);
        log.info("Starting analysis of {} source files", files.size());

        List<FileAnalysis> analyses = new ArrayList<>();
        for (Path file : files) {
            if (config.isVerbose()) {
                System.out.println("  - " + file);
            }
            analyses.add(analyzeFile(file));
        }

        ProjectAnalysis analysis = new ProjectAnalysis(analyses);
        log.info("Analysis complete. {} functions in {} files, {} could not be analyzed",
                analysis.functionCount(), analysis.fileCount(), analysis.failureCount());
        return analysis;
    }

    /**
     * Reads the file as UTF-8, replacing undecodable bytes with U+FFFD so that the
     * tokenizer reports them as anomalies instead of the whole file being lost.
     */
    FileAnalysis analyzeFile(Path file) {
        String source;
        try {
            source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return FileAnalysis.unreadable(file.toString(), "could not read file: " + e.getMessage());
        }
        return sourceAnalyzer.analyze(file.toString(), source);
    }

    List<Path> collectSourceFiles(List<Path> inputs) throws IOException {
        TreeSet<Path> files = new TreeSet<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                throw new IOException("Input not found: " + input);
            }
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    files.addAll(walk.filter(Files::isRegularFile)
                            .filter(this::hasSourceExtension)
                            .collect(Collectors.toList()));
                }
            } else {
                files.add(input);
            }
        }
        return new ArrayList<>(files);
    }

    private boolean hasSourceExtension(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> extensions = thresholds.getFileExtensions();
        return extensions != null && extensions.stream()
                .anyMatch(ext -> name.endsWith(ext.toLowerCase(Locale.ROOT)));
    }
}

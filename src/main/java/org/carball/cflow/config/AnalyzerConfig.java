package org.carball.cflow.config;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
public class AnalyzerConfig {
    private List<Path> inputs = new ArrayList<>();
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private boolean includeMermaid;
    private Integer failOver;
    private ComplexityThresholds thresholds;
}

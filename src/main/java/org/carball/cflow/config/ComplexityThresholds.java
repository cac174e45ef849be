package org.carball.cflow.config;

import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.cflow.model.analysis.RiskLevel;

import java.util.List;

@Data
@Builder(toBuilder = true)
@Slf4j
public class ComplexityThresholds {

    public static final List<String> DEFAULT_EXTENSIONS =
            List.of(".c", ".h", ".cc", ".cpp", ".cxx", ".hpp", ".hh", ".hxx");

    // Graph construction
    @Builder.Default
    private boolean countBooleanOperators = false;

    @Builder.Default
    private int maxNesting = 256;

    // Risk bands: complexity up to the limit falls in the band
    @Builder.Default
    private int lowRiskLimit = 10;

    @Builder.Default
    private int moderateRiskLimit = 20;

    @Builder.Default
    private int highRiskLimit = 50;

    // Execution
    @Builder.Default
    private int parallelism = 1;

    @Builder.Default
    private List<String> fileExtensions = DEFAULT_EXTENSIONS;

    // Profile information
    @Builder.Default
    private String profileName = "default";

    @Builder.Default
    private String profileDescription = "Standard cyclomatic complexity bands";

    public static ComplexityThresholds defaults() {
        return ComplexityThresholds.builder().build();
    }

    public RiskLevel riskLevelFor(int complexity) {
        return RiskLevel.fromComplexity(complexity, lowRiskLimit, moderateRiskLimit, highRiskLimit);
    }

    /**
     * Validates the configuration and logs warnings for questionable values.
     * Values that cannot work at all are rejected.
     */
    public void validate() {
        if (maxNesting < 1) {
            throw new IllegalArgumentException("max nesting must be positive: " + maxNesting);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }

        if (lowRiskLimit < 1) {
            log.warn("Low risk limit ({}) should be at least 1, every function would be rated above LOW",
                    lowRiskLimit);
        }
        if (moderateRiskLimit <= lowRiskLimit) {
            log.warn("Moderate risk limit ({}) should be greater than low risk limit ({})",
                    moderateRiskLimit, lowRiskLimit);
        }
        if (highRiskLimit <= moderateRiskLimit) {
            log.warn("High risk limit ({}) should be greater than moderate risk limit ({})",
                    highRiskLimit, moderateRiskLimit);
        }
        if (parallelism > Runtime.getRuntime().availableProcessors() * 4) {
            log.warn("Parallelism ({}) is far above the available processors ({})",
                    parallelism, Runtime.getRuntime().availableProcessors());
        }
        if (fileExtensions == null || fileExtensions.isEmpty()) {
            log.warn("No file extensions configured, directory inputs will yield no files");
        }

        log.debug("Using thresholds - Low: {}, Moderate: {}, High: {}, Booleans: {}, Profile: {}",
                lowRiskLimit, moderateRiskLimit, highRiskLimit, countBooleanOperators, profileName);
    }

    public String getConfigurationSummary() {
        return String.format("Profile: %s | Risk bands: %d/%d/%d | Boolean operators: %s | Max nesting: %d | Parallelism: %d",
                profileName, lowRiskLimit, moderateRiskLimit, highRiskLimit,
                countBooleanOperators ? "counted" : "ignored", maxNesting, parallelism);
    }
}

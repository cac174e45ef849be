package org.carball.cflow.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * Settings read from a YAML configuration file. Keys left out of the file stay
 * {@code null} and leave the underlying profile value untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdConfig {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("count_boolean_operators")
    private Boolean countBooleanOperators;

    @JsonProperty("max_nesting")
    private Integer maxNesting;

    @JsonProperty("low_risk_limit")
    private Integer lowRiskLimit;

    @JsonProperty("moderate_risk_limit")
    private Integer moderateRiskLimit;

    @JsonProperty("high_risk_limit")
    private Integer highRiskLimit;

    @JsonProperty("parallelism")
    private Integer parallelism;

    @JsonProperty("file_extensions")
    private List<String> fileExtensions;

    void applyTo(ComplexityThresholds.ComplexityThresholdsBuilder builder) {
        if (countBooleanOperators != null) {
            builder.countBooleanOperators(countBooleanOperators);
        }
        if (maxNesting != null) {
            builder.maxNesting(maxNesting);
        }
        if (lowRiskLimit != null) {
            builder.lowRiskLimit(lowRiskLimit);
        }
        if (moderateRiskLimit != null) {
            builder.moderateRiskLimit(moderateRiskLimit);
        }
        if (highRiskLimit != null) {
            builder.highRiskLimit(highRiskLimit);
        }
        if (parallelism != null) {
            builder.parallelism(parallelism);
        }
        if (fileExtensions != null) {
            builder.fileExtensions(List.copyOf(fileExtensions));
        }
    }
}

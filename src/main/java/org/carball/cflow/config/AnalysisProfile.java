package org.carball.cflow.config;

import lombok.Getter;

@Getter
public enum AnalysisProfile {

    DEFAULT("default", "Standard cyclomatic complexity bands (10/20/50)",
            false, 10, 20, 50),

    STRICT("strict", "Counts && and || as decisions and tightens the risk bands",
            true, 5, 10, 20),

    LENIENT("lenient", "Wider risk bands for legacy code bases",
            false, 15, 30, 60);

    private final String name;
    private final String description;
    private final boolean countBooleanOperators;
    private final int lowRiskLimit;
    private final int moderateRiskLimit;
    private final int highRiskLimit;

    AnalysisProfile(String name, String description, boolean countBooleanOperators,
                    int lowRiskLimit, int moderateRiskLimit, int highRiskLimit) {
        this.name = name;
        this.description = description;
        this.countBooleanOperators = countBooleanOperators;
        this.lowRiskLimit = lowRiskLimit;
        this.moderateRiskLimit = moderateRiskLimit;
        this.highRiskLimit = highRiskLimit;
    }

    public ComplexityThresholds buildThresholds() {
        return ComplexityThresholds.builder()
                .profileName(name)
                .profileDescription(description)
                .countBooleanOperators(countBooleanOperators)
                .lowRiskLimit(lowRiskLimit)
                .moderateRiskLimit(moderateRiskLimit)
                .highRiskLimit(highRiskLimit)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static AnalysisProfile fromName(String name) {
        for (AnalysisProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown analysis profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (AnalysisProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Analysis Profiles:\n\n");
        for (AnalysisProfile profile : values()) {
            help.append(String.format("  %-10s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}

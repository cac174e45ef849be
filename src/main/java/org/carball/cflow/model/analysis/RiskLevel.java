package org.carball.cflow.model.analysis;

public enum RiskLevel {
    LOW(10),
    MODERATE(20),
    HIGH(50),
    VERY_HIGH(Integer.MAX_VALUE);

    private final int defaultMaxComplexity;

    RiskLevel(int defaultMaxComplexity) {
        this.defaultMaxComplexity = defaultMaxComplexity;
    }

    public static RiskLevel fromComplexity(int complexity) {
        return fromComplexity(complexity, LOW.defaultMaxComplexity,
                MODERATE.defaultMaxComplexity, HIGH.defaultMaxComplexity);
    }

    public static RiskLevel fromComplexity(int complexity, int lowMax, int moderateMax, int highMax) {
        if (complexity <= lowMax) {
            return LOW;
        } else if (complexity <= moderateMax) {
            return MODERATE;
        } else if (complexity <= highMax) {
            return HIGH;
        } else {
            return VERY_HIGH;
        }
    }
}

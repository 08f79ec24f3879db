package com.researchbot.model;

public enum RiskLevel {
    LOW("low", "long-term (1+ years)"),
    MEDIUM("medium", "medium-term (6-12 months)"),
    HIGH("high", "short-term (< 6 months)");

    private final String label;
    private final String timeHorizon;

    RiskLevel(String label, String timeHorizon) {
        this.label = label;
        this.timeHorizon = timeHorizon;
    }

    public String label() {
        return label;
    }

    public String timeHorizon() {
        return timeHorizon;
    }

    public static RiskLevel fromLabel(String raw) {
        if (raw != null) {
            for (RiskLevel r : values()) {
                if (r.label.equalsIgnoreCase(raw.trim())) {
                    return r;
                }
            }
        }
        return MEDIUM;
    }
}

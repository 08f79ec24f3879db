package com.researchbot.model;

public enum ValuationCategory {
    UNDERVALUED("undervalued"),
    FAIR("fair"),
    OVERVALUED("overvalued");

    private final String label;

    ValuationCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * A high score means attractive fundamentals for the price.
     */
    public static ValuationCategory of(double valuationScore) {
        if (valuationScore > 60.0) {
            return UNDERVALUED;
        }
        if (valuationScore < 40.0) {
            return OVERVALUED;
        }
        return FAIR;
    }

    public static ValuationCategory fromLabel(String raw) {
        if (raw != null) {
            for (ValuationCategory c : values()) {
                if (c.label.equalsIgnoreCase(raw.trim())) {
                    return c;
                }
            }
        }
        return FAIR;
    }
}

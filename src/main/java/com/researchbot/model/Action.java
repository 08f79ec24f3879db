package com.researchbot.model;

public enum Action {
    BUY("Buy", 3),
    HOLD("Hold", 2),
    SELL("Sell", 1);

    private final String label;
    private final int rank;

    Action(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String label() {
        return label;
    }

    /** Buy ranks above Hold, Hold above Sell. */
    public int rank() {
        return rank;
    }

    public static Action fromLabel(String raw) {
        if (raw != null) {
            for (Action a : values()) {
                if (a.label.equalsIgnoreCase(raw.trim())) {
                    return a;
                }
            }
        }
        return HOLD;
    }
}

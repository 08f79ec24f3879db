package com.researchbot.model;

public enum SentimentLabel {
    POSITIVE("positive"),
    NEUTRAL("neutral"),
    NEGATIVE("negative");

    private final String label;

    SentimentLabel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SentimentLabel fromLabel(String raw) {
        if (raw != null) {
            for (SentimentLabel s : values()) {
                if (s.label.equalsIgnoreCase(raw.trim())) {
                    return s;
                }
            }
        }
        return NEUTRAL;
    }
}

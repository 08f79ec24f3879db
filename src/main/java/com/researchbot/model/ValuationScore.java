package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class ValuationScore {
    public static final String COMPONENT_PE = "pe_ratio";
    public static final String COMPONENT_GROWTH = "revenue_growth";
    public static final String COMPONENT_MARGIN = "profit_margin";

    /** baseline plus component points, before clamping */
    public final double rawTotal;
    /** rawTotal clamped to [0, 100] */
    public final double score;
    public final List<Component> breakdown;
    public final List<String> warnings;

    public Component component(String name) {
        for (Component c : breakdown) {
            if (c.name().equals(name)) {
                return c;
            }
        }
        return null;
    }

    public record Component(String name, Double input, double points, boolean unavailable) {
    }
}

package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class Recommendation {
    public final Action action;
    public final double confidence;
    public final String reasoning;
    public final String timeHorizon;
    public final List<String> keyPoints;
}

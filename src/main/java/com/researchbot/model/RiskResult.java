package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class RiskResult {
    public final RiskLevel level;
    public final double score;
    public final List<String> factors;
    public final List<String> mitigations;
}

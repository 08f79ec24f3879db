package com.researchbot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Descriptive company information shown in the report's overview section.
 * Missing text fields are {@code N/A}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public class CompanyProfile {
    public static final String NA = "N/A";

    public final String name;
    public final String sector;
    public final String industry;
    public final String description;
    public final String website;
    public final List<String> sources;

    public static CompanyProfile unavailable(String ticker) {
        return new CompanyProfile(ticker == null || ticker.isBlank() ? NA : ticker, NA, NA, NA, NA, List.of());
    }

    public boolean isAvailable() {
        return !NA.equals(sector) || !NA.equals(industry) || !NA.equals(description);
    }
}

package com.researchbot.scoring;

import com.researchbot.model.FinancialMetrics;
import com.researchbot.model.RawMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes provider strings into typed metrics.
 * <p>
 * Accepted shapes: {@code 37.33}, {@code $2.95T}, {@code 1,234.5M}, {@code 26.92%}, {@code 0.2692}.
 * A null field or {@code N/A} means the provider had no value. Empty, blank and other non-numeric
 * text is absent too and produces one warning.
 */
public final class MetricsParser {
    private static final Logger log = LogManager.getLogger(MetricsParser.class);

    public FinancialMetrics parse(RawMetrics raw) {
        RawMetrics in = raw == null ? RawMetrics.EMPTY : raw;
        List<String> warnings = new ArrayList<>();
        FinancialMetrics out = FinancialMetrics.builder()
                .peRatio(parsePlain("pe_ratio", in.peRatio, warnings))
                .marketCap(parseAmount("market_cap", in.marketCap, warnings))
                .revenue(parseAmount("revenue", in.revenue, warnings))
                .earnings(parseAmount("earnings", in.earnings, warnings))
                .profitMargin(parsePercent("profit_margin", in.profitMargin, warnings))
                .revenueGrowth(parsePercent("revenue_growth", in.revenueGrowth, warnings))
                .currentPrice(parseAmount("current_price", in.currentPrice, warnings))
                .fiftyTwoWeekHigh(parseAmount("fifty_two_week_high", in.fiftyTwoWeekHigh, warnings))
                .fiftyTwoWeekLow(parseAmount("fifty_two_week_low", in.fiftyTwoWeekLow, warnings))
                .warnings(List.copyOf(warnings))
                .build();
        for (String w : warnings) {
            log.warn(w);
        }
        return out;
    }

    Double parsePlain(String field, String raw, List<String> warnings) {
        if (isAbsent(raw)) {
            return null;
        }
        return toDouble(field, raw, clean(raw), warnings);
    }

    /**
     * Monetary amounts may carry a T/B/M/K multiplier suffix.
     */
    Double parseAmount(String field, String raw, List<String> warnings) {
        if (isAbsent(raw)) {
            return null;
        }
        String cleaned = clean(raw).toUpperCase(Locale.ROOT);
        double multiplier = 1.0;
        if (!cleaned.isEmpty()) {
            char last = cleaned.charAt(cleaned.length() - 1);
            switch (last) {
                case 'T' -> multiplier = 1e12;
                case 'B' -> multiplier = 1e9;
                case 'M' -> multiplier = 1e6;
                case 'K' -> multiplier = 1e3;
                default -> multiplier = 1.0;
            }
            if (multiplier != 1.0) {
                cleaned = cleaned.substring(0, cleaned.length() - 1);
            }
        }
        Double v = toDouble(field, raw, cleaned, warnings);
        return v == null ? null : v * multiplier;
    }

    /**
     * Written with {@code %}: already percent. Bare with magnitude at most 1: a fraction.
     * Otherwise already percent.
     */
    Double parsePercent(String field, String raw, List<String> warnings) {
        if (isAbsent(raw)) {
            return null;
        }
        boolean explicitPercent = raw.contains("%");
        Double v = toDouble(field, raw, clean(raw), warnings);
        if (v == null) {
            return null;
        }
        if (!explicitPercent && Math.abs(v) <= 1.0) {
            return v * 100.0;
        }
        return v;
    }

    private static Double toDouble(String field, String raw, String cleaned, List<String> warnings) {
        double v;
        try {
            v = Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return malformed(field, raw, warnings);
        }
        if (!Double.isFinite(v)) {
            return malformed(field, raw, warnings);
        }
        return v;
    }

    private static Double malformed(String field, String raw, List<String> warnings) {
        warnings.add(String.format(Locale.US, "%s: malformed value '%s' ignored", field, raw.trim()));
        return null;
    }

    private static boolean isAbsent(String raw) {
        if (raw == null) {
            return true;
        }
        String t = raw.trim();
        return "N/A".equalsIgnoreCase(t) || "NA".equalsIgnoreCase(t);
    }

    private static String clean(String raw) {
        return raw.replace("$", "")
                .replace(",", "")
                .replace("%", "")
                .replaceAll("\\s+", "");
    }
}

package com.researchbot.data;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.data.http.HttpClientEx;
import com.researchbot.data.http.HttpStatusException;
import com.researchbot.model.CompanyProfile;
import com.researchbot.model.RawMetrics;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fundamentals and company profile from the Yahoo Finance quoteSummary endpoint. Ratios are
 * forwarded as explicit percent strings so the parser never has to guess their unit.
 */
public class YahooFinancialDataProvider implements FinancialDataProvider {
    private static final String MODULES = "summaryDetail,financialData,defaultKeyStatistics,price";
    private static final String PROFILE_MODULES = "assetProfile,price";

    private final HttpClientEx http;
    private final int timeoutSec;

    public YahooFinancialDataProvider(HttpClientEx http, int timeoutSec) {
        this.http = http;
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    @Override
    public RawMetrics fetch(String ticker) {
        String symbol = normalize(ticker);
        return parseQuoteSummary(symbol, request(symbol, MODULES));
    }

    @Override
    public CompanyProfile profile(String ticker) {
        String symbol = normalize(ticker);
        return parseProfile(symbol, request(symbol, PROFILE_MODULES));
    }

    private String request(String symbol, String modules) {
        String url = "https://query2.finance.yahoo.com/v10/finance/quoteSummary/"
                + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
                + "?modules=" + modules;
        try {
            return http.getText(url, timeoutSec);
        } catch (HttpStatusException e) {
            if (e.statusCode() == 404) {
                throw new ResearchException(FailureKind.TICKER_NOT_FOUND, "unknown ticker " + symbol, e);
            }
            throw e;
        }
    }

    private static String normalize(String ticker) {
        String symbol = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
        if (symbol.isEmpty()) {
            throw new ResearchException(FailureKind.TICKER_NOT_FOUND, "empty ticker");
        }
        return symbol;
    }

    static RawMetrics parseQuoteSummary(String symbol, String body) {
        JSONObject r0 = firstResult(symbol, body);
        JSONObject detail = r0.optJSONObject("summaryDetail");
        JSONObject fin = r0.optJSONObject("financialData");
        JSONObject stats = r0.optJSONObject("defaultKeyStatistics");
        JSONObject price = r0.optJSONObject("price");

        String pe = raw(detail, "trailingPE");
        if (pe == null) {
            pe = raw(detail, "forwardPE");
        }
        String marketCap = raw(price, "marketCap");
        if (marketCap == null) {
            marketCap = raw(detail, "marketCap");
        }
        return RawMetrics.builder()
                .peRatio(pe)
                .marketCap(marketCap)
                .revenue(raw(fin, "totalRevenue"))
                .earnings(raw(stats, "netIncomeToCommon"))
                .profitMargin(percent(fin, "profitMargins"))
                .revenueGrowth(percent(fin, "revenueGrowth"))
                .currentPrice(raw(fin, "currentPrice"))
                .fiftyTwoWeekHigh(raw(detail, "fiftyTwoWeekHigh"))
                .fiftyTwoWeekLow(raw(detail, "fiftyTwoWeekLow"))
                .build();
    }

    static CompanyProfile parseProfile(String symbol, String body) {
        JSONObject r0 = firstResult(symbol, body);
        JSONObject asset = r0.optJSONObject("assetProfile");
        JSONObject price = r0.optJSONObject("price");

        String name = text(price, "longName");
        if (name.isEmpty()) {
            name = text(price, "shortName");
        }
        String website = text(asset, "website");
        List<String> sources = new ArrayList<>();
        sources.add("https://finance.yahoo.com/quote/" + URLEncoder.encode(symbol, StandardCharsets.UTF_8) + "/profile");
        if (!website.isEmpty()) {
            sources.add(website);
        }
        return CompanyProfile.builder()
                .name(name.isEmpty() ? symbol : name)
                .sector(orNa(text(asset, "sector")))
                .industry(orNa(text(asset, "industry")))
                .description(orNa(text(asset, "longBusinessSummary")))
                .website(orNa(website))
                .sources(List.copyOf(sources))
                .build();
    }

    private static JSONObject firstResult(String symbol, String body) {
        JSONObject root;
        try {
            root = new JSONObject(body);
        } catch (JSONException e) {
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "unreadable quoteSummary for " + symbol, e);
        }
        JSONObject summary = root.optJSONObject("quoteSummary");
        if (summary == null) {
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "quoteSummary missing for " + symbol);
        }
        JSONObject error = summary.optJSONObject("error");
        JSONArray result = summary.optJSONArray("result");
        if (result == null || result.length() == 0 || result.optJSONObject(0) == null) {
            String code = error == null ? "" : error.optString("code", "");
            if (error == null || "Not Found".equalsIgnoreCase(code)) {
                throw new ResearchException(FailureKind.TICKER_NOT_FOUND, "unknown ticker " + symbol);
            }
            throw new ResearchException(FailureKind.PROVIDER_UNAVAILABLE, "quoteSummary error for " + symbol + ": " + code);
        }
        return result.optJSONObject(0);
    }

    private static String text(JSONObject module, String field) {
        if (module == null || module.isNull(field)) {
            return "";
        }
        return module.optString(field, "").trim();
    }

    private static String orNa(String value) {
        return value.isEmpty() ? CompanyProfile.NA : value;
    }

    // Yahoo wraps numbers as {"raw": 0.2692, "fmt": "26.92%"}
    private static String raw(JSONObject module, String field) {
        if (module == null) {
            return null;
        }
        JSONObject value = module.optJSONObject(field);
        if (value == null || !value.has("raw") || value.isNull("raw")) {
            return null;
        }
        double v = value.optDouble("raw", Double.NaN);
        if (Double.isNaN(v)) {
            return null;
        }
        return String.format(Locale.US, "%.4f", v);
    }

    private static String percent(JSONObject module, String field) {
        String fraction = raw(module, field);
        if (fraction == null) {
            return null;
        }
        return String.format(Locale.US, "%.4f%%", Double.parseDouble(fraction) * 100.0);
    }
}

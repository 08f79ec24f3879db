package com.researchbot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures one research run's stage timings and ticker counters.
 * Safe to share between batch workers.
 */
public final class RunTelemetry {
    public static final String STEP_FINANCIAL_FETCH = "FINANCIAL_FETCH";
    public static final String STEP_PROFILE_FETCH = "PROFILE_FETCH";
    public static final String STEP_NEWS_FETCH = "NEWS_FETCH";
    public static final String STEP_AI_SUMMARY = "AI_SUMMARY";
    public static final String STEP_RESEARCH = "RESEARCH";
    public static final String STEP_ANALYSIS = "ANALYSIS";
    public static final String STEP_REPORT = "REPORT";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String sessionId;
    private final String runMode;
    private final Instant startedAt;
    private Instant finishedAt;

    private int tickersRequested;
    private int tickersSucceeded;
    private int tickersFailed;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();

    public RunTelemetry(String sessionId, String runMode, Instant startedAt) {
        this.sessionId = blankTo(sessionId, "-");
        this.runMode = blankTo(runMode, "SINGLE");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String sessionId() {
        return sessionId;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized void setTickersRequested(int count) {
        this.tickersRequested = Math.max(0, count);
    }

    public synchronized void recordStep(String name, long elapsedMs, boolean failed) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.calls++;
        stat.elapsedMs += Math.max(0L, elapsedMs);
        if (failed) {
            stat.errorCount++;
            errorsTotal++;
        }
    }

    public synchronized void recordTicker(boolean succeeded) {
        if (succeeded) {
            tickersSucceeded++;
        } else {
            tickersFailed++;
        }
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.calls, stat.elapsedMs, stat.errorCount));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("session_id=").append(sessionId).append('\n');
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(totalElapsedMs()).append('\n');
        sb.append("tickers requested=").append(tickersRequested)
                .append(" succeeded=").append(tickersSucceeded)
                .append(" failed=").append(tickersFailed).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s calls=%d elapsed_ms=%d err=%d",
                    stat.name,
                    stat.calls,
                    stat.elapsedMs,
                    stat.errorCount
            ));
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long calls;
        private long elapsedMs;
        private long errorCount;

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long calls, long elapsedMs, long errorCount) {
    }
}

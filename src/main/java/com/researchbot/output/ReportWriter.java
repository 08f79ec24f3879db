package com.researchbot.output;

import com.researchbot.model.BatchSummary;
import com.researchbot.model.Report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes report and batch-summary JSON files under {@code <outputs.dir>/reports}.
 */
public class ReportWriter {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Path reportsDir;

    public ReportWriter(Path outputsDir) {
        this.reportsDir = outputsDir.resolve("reports");
    }

    public Path writeReport(Report report) throws IOException {
        Files.createDirectories(reportsDir);
        String ts = FILE_TS.format(report.reportDate);
        Path out = reportsDir.resolve(safeName(report.ticker) + "_" + ts + ".json");
        Files.writeString(out, ReportJson.toJson(report).toString(2), StandardCharsets.UTF_8);
        return out;
    }

    public Path writeBatchSummary(String sessionId, BatchSummary summary, Instant finishedAt) throws IOException {
        Files.createDirectories(reportsDir);
        Path out = reportsDir.resolve("batch_" + FILE_TS.format(finishedAt) + ".json");
        String json = ReportJson.toJson(summary)
                .put("session_id", sessionId)
                .toString(2);
        Files.writeString(out, json, StandardCharsets.UTF_8);
        return out;
    }

    static String safeName(String ticker) {
        String t = ticker == null ? "" : ticker.trim();
        String cleaned = t.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isEmpty() ? "UNKNOWN" : cleaned;
    }
}

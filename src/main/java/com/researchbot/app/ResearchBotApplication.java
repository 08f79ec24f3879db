package com.researchbot.app;

import com.researchbot.config.Config;
import com.researchbot.core.ResearchException;
import com.researchbot.model.BatchSummary;
import com.researchbot.model.MemoryEntry;
import com.researchbot.model.Report;
import com.researchbot.output.ReportWriter;
import com.researchbot.pipeline.BatchCoordinator;
import com.researchbot.pipeline.ResearchSystem;
import com.researchbot.pipeline.TickerOutcome;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class ResearchBotApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    private static final int DEFAULT_HISTORY_LIMIT = 5;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new ResearchBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("researchbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("researchbot", options);
            return EXIT_OK;
        }
        int modes = (cmd.hasOption("ticker") ? 1 : 0) + (cmd.hasOption("tickers") ? 1 : 0) + (cmd.hasOption("history") ? 1 : 0);
        if (modes != 1) {
            new HelpFormatter().printHelp("researchbot", options);
            System.err.println("ERROR: exactly one of --ticker, --tickers or --history is required.");
            return EXIT_USAGE;
        }
        int limit = DEFAULT_HISTORY_LIMIT;
        if (cmd.hasOption("limit")) {
            try {
                limit = Integer.parseInt(cmd.getOptionValue("limit").trim());
            } catch (NumberFormatException e) {
                System.err.println("ERROR: --limit must be an integer.");
                return EXIT_USAGE;
            }
            if (limit < 1) {
                System.err.println("ERROR: --limit must be >= 1.");
                return EXIT_USAGE;
            }
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);

        try (ResearchSystem system = ResearchSystem.fromConfig(config)) {
            ReportWriter writer = new ReportWriter(config.getPath("outputs.dir"));
            if (cmd.hasOption("ticker")) {
                return runSingle(system, writer, cmd.getOptionValue("ticker"));
            }
            if (cmd.hasOption("tickers")) {
                List<String> tickers = splitTickers(cmd.getOptionValue("tickers"));
                if (tickers.isEmpty()) {
                    System.err.println("ERROR: --tickers needs at least one symbol.");
                    return EXIT_USAGE;
                }
                return runBatch(system, writer, tickers);
            }
            return printHistory(system, cmd.getOptionValue("history"), limit);
        } catch (ResearchException e) {
            System.err.println("ERROR: " + e.kind().label() + ": " + e.getMessage());
            return EXIT_FATAL;
        } catch (IOException e) {
            System.err.println("ERROR: failed to write report: " + e.getMessage());
            return EXIT_FATAL;
        }
    }

    private int runSingle(ResearchSystem system, ReportWriter writer, String ticker) throws IOException {
        if (ticker == null || ticker.isBlank()) {
            System.err.println("ERROR: --ticker needs a symbol.");
            return EXIT_USAGE;
        }
        Report report = system.researchSingle(ticker);
        Path out = writer.writeReport(report);
        System.out.println(report.executiveSummary);
        System.out.println(report.recommendation.reasoning);
        System.out.println("Report written: " + out.toAbsolutePath());
        return EXIT_OK;
    }

    private int runBatch(ResearchSystem system, ReportWriter writer, List<String> tickers) throws IOException {
        BatchCoordinator.BatchResult result = system.researchBatch(tickers);
        for (TickerOutcome outcome : result.outcomes()) {
            if (outcome.succeeded()) {
                Path out = writer.writeReport(outcome.report());
                System.out.println(outcome.report().executiveSummary + " -> " + out.getFileName());
            } else {
                System.out.println(outcome.ticker + " FAILED (" + outcome.failureKind.label() + "): " + outcome.failureMessage);
            }
        }
        BatchSummary summary = result.summary();
        Path summaryPath = writer.writeBatchSummary(result.sessionId(), summary, Instant.now());
        System.out.println(summary.narrative);
        System.out.println("Batch summary written: " + summaryPath.toAbsolutePath());
        return EXIT_OK;
    }

    private int printHistory(ResearchSystem system, String ticker, int limit) {
        List<MemoryEntry> entries = system.analysisHistory(ticker, limit);
        if (entries.isEmpty()) {
            System.out.println("No stored analyses for " + ticker.trim().toUpperCase(Locale.ROOT));
            return EXIT_OK;
        }
        for (MemoryEntry e : entries) {
            Report r = e.report();
            System.out.println(String.format(
                    Locale.US,
                    "%s %s %s valuation=%.1f confidence=%.0f risk=%s sentiment=%s",
                    e.storedAt(),
                    e.ticker(),
                    r.recommendation.action.label(),
                    r.valuation.score,
                    r.recommendation.confidence,
                    r.risk.level.label(),
                    r.sentiment.label.label()
            ));
        }
        return EXIT_OK;
    }

    static List<String> splitTickers(String raw) {
        List<String> out = new ArrayList<>();
        if (raw == null) {
            return out;
        }
        for (String token : raw.split("[,;\\s]+")) {
            String t = token.trim();
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("t").longOpt("ticker").hasArg().argName("SYMBOL")
                .desc("Research a single ticker").build());
        options.addOption(Option.builder("b").longOpt("tickers").hasArg().argName("LIST")
                .desc("Research a comma separated list of tickers as one batch").build());
        options.addOption(Option.builder().longOpt("history").hasArg().argName("SYMBOL")
                .desc("Show stored analyses for a ticker, most recent first").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("N")
                .desc("Maximum history entries (default " + DEFAULT_HISTORY_LIMIT + ")").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (ResearchBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("researchbot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(ResearchBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }
}

package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.RunTelemetry;
import com.researchbot.model.Action;
import com.researchbot.model.BatchSummary;
import com.researchbot.model.Report;
import com.researchbot.model.RiskLevel;
import com.researchbot.model.SentimentLabel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans tickers out over a fixed worker pool. A ticker's failure is recorded in its outcome
 * and never aborts the batch; outcomes keep the input order.
 */
public final class BatchCoordinator {
    private static final Logger log = LogManager.getLogger(BatchCoordinator.class);
    static final int TOP_PICKS_LIMIT = 3;

    private final TickerPipeline pipeline;
    private final int sizeLimit;

    public BatchCoordinator(TickerPipeline pipeline, int sizeLimit) {
        this.pipeline = pipeline;
        this.sizeLimit = Math.max(1, sizeLimit);
    }

    public BatchResult run(String sessionId, List<String> tickers, RunTelemetry telemetry) {
        List<String> input = tickers == null ? List.of() : List.copyOf(tickers);
        telemetry.setTickersRequested(input.size());
        if (input.isEmpty()) {
            return new BatchResult(sessionId, List.of(), summarize(List.of()));
        }

        int poolSize = Math.max(1, Math.min(sizeLimit, input.size()));
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "batch-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("[{}] batch started: tickers={} workers={}", sessionId, input.size(), poolSize);

        List<TickerOutcome> outcomes = new ArrayList<>(input.size());
        try {
            List<Future<TickerOutcome>> futures = new ArrayList<>(input.size());
            for (String ticker : input) {
                futures.add(pool.submit(() -> pipeline.run(sessionId, ticker, telemetry)));
            }
            for (int i = 0; i < futures.size(); i++) {
                String ticker = input.get(i);
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    log.error("[{}] {} worker failed", sessionId, ticker, cause);
                    outcomes.add(TickerOutcome.failure(ticker, FailureKind.RESEARCH_FAILED, String.valueOf(cause.getMessage())));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcomes.add(TickerOutcome.failure(ticker, FailureKind.RESEARCH_FAILED, "batch interrupted"));
                }
            }
        } finally {
            pool.shutdownNow();
        }

        BatchSummary summary = summarize(outcomes);
        log.info("[{}] batch finished: successful={} failed={}", sessionId, summary.successful, summary.failed);
        return new BatchResult(sessionId, List.copyOf(outcomes), summary);
    }

    /**
     * Builds the comparison summary; entries and failures follow the outcome order.
     */
    static BatchSummary summarize(List<TickerOutcome> outcomes) {
        List<BatchSummary.Entry> entries = new ArrayList<>();
        List<BatchSummary.Failure> failures = new ArrayList<>();
        Map<Action, Integer> actionCounts = new EnumMap<>(Action.class);
        Map<RiskLevel, List<String>> riskGroups = new EnumMap<>(RiskLevel.class);
        Map<SentimentLabel, List<String>> sentimentGroups = new EnumMap<>(SentimentLabel.class);
        for (Action a : Action.values()) {
            actionCounts.put(a, 0);
        }
        for (RiskLevel r : RiskLevel.values()) {
            riskGroups.put(r, new ArrayList<>());
        }
        for (SentimentLabel s : SentimentLabel.values()) {
            sentimentGroups.put(s, new ArrayList<>());
        }

        for (TickerOutcome o : outcomes) {
            if (!o.succeeded()) {
                failures.add(new BatchSummary.Failure(o.ticker, o.failureKind, o.failureMessage));
                continue;
            }
            Report r = o.report();
            BatchSummary.Entry entry = new BatchSummary.Entry(
                    o.ticker,
                    r.recommendation.action,
                    r.valuation.score,
                    r.recommendation.confidence,
                    r.risk.level,
                    r.sentiment.label
            );
            entries.add(entry);
            actionCounts.merge(entry.action(), 1, Integer::sum);
            riskGroups.get(entry.riskLevel()).add(o.ticker);
            sentimentGroups.get(entry.sentiment()).add(o.ticker);
        }

        Set<Action> distinctActions = new LinkedHashSet<>();
        for (BatchSummary.Entry e : entries) {
            distinctActions.add(e.action());
        }

        String topPick = null;
        List<String> topPicks = List.of();
        String note = null;
        if (entries.isEmpty()) {
            note = "No clear favorite: no ticker completed successfully.";
        } else if (distinctActions.size() == 1) {
            note = "No clear favorite: every analyzed ticker received the same recommendation ("
                    + entries.get(0).action().label() + ").";
        } else {
            List<BatchSummary.Entry> ranked = new ArrayList<>(entries);
            ranked.sort(Comparator
                    .comparingInt((BatchSummary.Entry e) -> e.action().rank()).reversed()
                    .thenComparing(Comparator.comparingDouble(BatchSummary.Entry::valuationScore).reversed()));
            topPick = ranked.get(0).ticker();
            List<String> picks = new ArrayList<>();
            for (int i = 0; i < ranked.size() && i < TOP_PICKS_LIMIT; i++) {
                picks.add(ranked.get(i).ticker());
            }
            topPicks = List.copyOf(picks);
        }

        StringBuilder narrative = new StringBuilder();
        narrative.append(String.format(Locale.US,
                "Analyzed %d stocks. Recommendations: %d Buy, %d Hold, %d Sell.",
                outcomes.size(),
                actionCounts.get(Action.BUY),
                actionCounts.get(Action.HOLD),
                actionCounts.get(Action.SELL)));
        if (!failures.isEmpty()) {
            List<String> failed = new ArrayList<>();
            for (BatchSummary.Failure f : failures) {
                failed.add(f.ticker());
            }
            narrative.append(" Failed: ").append(failures.size())
                    .append(" (").append(String.join(", ", failed)).append(").");
        }
        if (topPick != null) {
            BatchSummary.Entry best = null;
            for (BatchSummary.Entry e : entries) {
                if (e.ticker().equals(topPick)) {
                    best = e;
                    break;
                }
            }
            narrative.append(String.format(Locale.US, " Top pick: %s (%s, valuation score %.1f).",
                    topPick, best.action().label(), best.valuationScore()));
        } else {
            narrative.append(' ').append(note);
        }

        return BatchSummary.builder()
                .totalRequested(outcomes.size())
                .successful(entries.size())
                .failed(failures.size())
                .entries(List.copyOf(entries))
                .failures(List.copyOf(failures))
                .actionCounts(actionCounts)
                .topPick(topPick)
                .topPicks(topPicks)
                .riskGroups(riskGroups)
                .sentimentGroups(sentimentGroups)
                .narrative(narrative.toString())
                .note(note)
                .build();
    }

    /**
     * Outcomes in input order plus the comparison summary.
     */
    public record BatchResult(String sessionId, List<TickerOutcome> outcomes, BatchSummary summary) {

        public List<Report> reports() {
            List<Report> out = new ArrayList<>();
            for (TickerOutcome o : outcomes) {
                if (o.succeeded()) {
                    out.add(o.report());
                }
            }
            return out;
        }
    }
}

package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.core.RunTelemetry;
import com.researchbot.model.AnalysisResult;
import com.researchbot.model.ResearchRecord;
import com.researchbot.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;

/**
 * Research, analysis and report for one ticker inside one session.
 * Never throws: every failure becomes a {@link TickerOutcome}.
 */
public final class TickerPipeline {
    private static final Logger log = LogManager.getLogger(TickerPipeline.class);

    private final SessionManager sessions;
    private final ResearchStage research;
    private final AnalysisStage analysis;
    private final ReportStage report;

    public TickerPipeline(SessionManager sessions, ResearchStage research, AnalysisStage analysis, ReportStage report) {
        this.sessions = sessions;
        this.research = research;
        this.analysis = analysis;
        this.report = report;
    }

    public TickerOutcome run(String sessionId, String ticker, RunTelemetry telemetry) {
        Runnable checkpoint = () -> sessions.touch(sessionId);
        String stage = RunTelemetry.STEP_RESEARCH;
        long t0 = System.currentTimeMillis();
        try {
            sessions.touch(sessionId).recordTicker(ticker);
            log.info("[{}] {} research started", sessionId, ticker);
            ResearchRecord record = research.research(sessionId, ticker, checkpoint, telemetry);
            telemetry.recordStep(stage, System.currentTimeMillis() - t0, false);

            stage = RunTelemetry.STEP_ANALYSIS;
            t0 = System.currentTimeMillis();
            checkpoint.run();
            AnalysisResult result = analysis.analyze(record);
            telemetry.recordStep(stage, System.currentTimeMillis() - t0, false);

            stage = RunTelemetry.STEP_REPORT;
            t0 = System.currentTimeMillis();
            checkpoint.run();
            PublishedReport published = report.publish(sessionId, record, result);
            telemetry.recordStep(stage, System.currentTimeMillis() - t0, !published.persisted());

            log.info("[{}] {} completed: {} (valuation {}, confidence {})", sessionId, ticker,
                    result.recommendation.action.label(),
                    String.format(Locale.US, "%.1f", result.valuation.score),
                    String.format(Locale.US, "%.0f", result.recommendation.confidence));
            telemetry.recordTicker(true);
            return TickerOutcome.success(ticker, published);
        } catch (ResearchException e) {
            telemetry.recordStep(stage, System.currentTimeMillis() - t0, true);
            telemetry.recordTicker(false);
            log.warn("[{}] {} failed at {}: {}", sessionId, ticker, stage, e.toString());
            return TickerOutcome.failure(ticker, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            telemetry.recordStep(stage, System.currentTimeMillis() - t0, true);
            telemetry.recordTicker(false);
            log.error("[{}] {} failed unexpectedly at {}", sessionId, ticker, stage, e);
            return TickerOutcome.failure(ticker, FailureKind.RESEARCH_FAILED, stage + " error: " + e.getMessage());
        }
    }
}

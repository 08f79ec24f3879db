package com.researchbot.pipeline;

import com.researchbot.core.FailureKind;
import com.researchbot.core.ResearchException;
import com.researchbot.model.Report;

/**
 * Result of one ticker's pipeline run: a published report or a failure, never both.
 */
public final class TickerOutcome {
    public final String ticker;
    public final PublishedReport published;
    public final FailureKind failureKind;
    public final String failureMessage;

    private TickerOutcome(String ticker, PublishedReport published, FailureKind failureKind, String failureMessage) {
        this.ticker = ticker;
        this.published = published;
        this.failureKind = failureKind;
        this.failureMessage = failureMessage;
    }

    public static TickerOutcome success(String ticker, PublishedReport published) {
        return new TickerOutcome(ticker, published, null, null);
    }

    public static TickerOutcome failure(String ticker, FailureKind kind, String message) {
        return new TickerOutcome(ticker, null, kind, message == null ? "" : message);
    }

    public boolean succeeded() {
        return published != null;
    }

    public Report report() {
        return published == null ? null : published.report();
    }

    /**
     * Rebuilds the failure as an exception for callers that expect one.
     */
    public ResearchException toException() {
        if (succeeded()) {
            throw new IllegalStateException(ticker + " did not fail");
        }
        return new ResearchException(failureKind, failureMessage);
    }
}

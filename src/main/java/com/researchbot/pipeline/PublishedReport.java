package com.researchbot.pipeline;

import com.researchbot.core.ResearchException;
import com.researchbot.model.Report;

/**
 * A built report plus the memory-bank failure, if storing it failed.
 */
public record PublishedReport(Report report, ResearchException persistenceFailure) {

    public boolean persisted() {
        return persistenceFailure == null;
    }
}

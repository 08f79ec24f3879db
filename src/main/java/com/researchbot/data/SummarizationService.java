package com.researchbot.data;

import com.researchbot.model.ResearchRecord;

public interface SummarizationService {

    /**
     * @throws com.researchbot.core.ResearchException SERVICE_UNAVAILABLE
     */
    String summarize(ResearchRecord record);
}

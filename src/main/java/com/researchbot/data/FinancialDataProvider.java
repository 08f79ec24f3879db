package com.researchbot.data;

import com.researchbot.model.CompanyProfile;
import com.researchbot.model.RawMetrics;

public interface FinancialDataProvider {

    /**
     * @throws com.researchbot.core.ResearchException TICKER_NOT_FOUND or PROVIDER_UNAVAILABLE
     */
    RawMetrics fetch(String ticker);

    /**
     * Company description for the report overview. Providers without one report it as unavailable.
     *
     * @throws com.researchbot.core.ResearchException PROVIDER_UNAVAILABLE
     */
    default CompanyProfile profile(String ticker) {
        return CompanyProfile.unavailable(ticker);
    }
}
